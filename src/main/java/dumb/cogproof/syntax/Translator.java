package dumb.cogproof.syntax;

import dumb.cogproof.Formula;
import dumb.cogproof.TranslationException;
import dumb.cogproof.ValidationException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Map;

import static dumb.cogproof.util.Log.debug;

/** Validation and conversion between the registered surface syntaxes. */
public class Translator {

    /** Confidence kept across each reported loss. */
    static final double LOSS_FACTOR = 0.9;

    private final Map<Syntax, SurfaceSyntax> syntaxes = new EnumMap<>(Syntax.class);
    private final NaturalLanguage english = new NaturalLanguage();

    public Translator() {
        register(new TdfolSyntax());
        register(new DcecSyntax());
        register(new ModalSyntax());
        register(new TptpSyntax());
        register(new InteractiveSyntax(InteractiveSyntax.Dialect.LEAN));
        register(new InteractiveSyntax(InteractiveSyntax.Dialect.COQ));
        register(english);
    }

    public final void register(SurfaceSyntax s) {
        syntaxes.put(s.syntax(), s);
    }

    public SurfaceSyntax syntax(Syntax s) {
        var x = syntaxes.get(s);
        if (x == null) throw new IllegalArgumentException("no surface syntax registered for " + s);
        return x;
    }

    public ValidationResult validate(String text, Syntax syntax) {
        try {
            return ValidationResult.ok(syntax, syntax(syntax).parse(text));
        } catch (ValidationException e) {
            return ValidationResult.failed(syntax, e);
        }
    }

    public Formula parse(String text, Syntax syntax) throws ValidationException {
        return syntax(syntax).parse(text);
    }

    public ConversionResult convert(String text, Syntax from, Syntax to) throws ValidationException, TranslationException {
        double confidence = 1;
        Formula f;
        if (from == Syntax.NATURAL_LANGUAGE && syntax(from) == english) {
            var r = english.read(text);
            f = r.formula();
            confidence *= r.confidence();
        } else f = parse(text, from);
        return convert(f, from, to, confidence);
    }

    public ConversionResult convert(Formula f, Syntax to) throws TranslationException {
        return convert(f, Syntax.TDFOL, to, 1);
    }

    private ConversionResult convert(Formula f, Syntax from, Syntax to, double confidence) throws TranslationException {
        var target = syntax(to);
        var warnings = new ArrayList<>(target.losses(f));
        String out;
        if (to == Syntax.NATURAL_LANGUAGE && target == english) {
            var g = english.gloss(f);
            out = g.text();
            confidence *= g.confidence();
            if (!g.grammatical()) warnings.add("gloss fell back to a template");
        } else out = target.serialize(f);
        for (var i = 0; i < warnings.size(); i++) confidence *= LOSS_FACTOR;
        debug("converted " + from + " -> " + to + " (" + warnings.size() + " warnings)");
        return new ConversionResult(f, from, to, out, warnings, confidence);
    }
}
