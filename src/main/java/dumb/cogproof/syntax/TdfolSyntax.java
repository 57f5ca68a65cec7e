package dumb.cogproof.syntax;

import dumb.cogproof.Formula;
import dumb.cogproof.Signature;
import dumb.cogproof.TranslationException;
import dumb.cogproof.ValidationException;

public class TdfolSyntax implements SurfaceSyntax {

    private final TdfolParser.Limits limits;

    public TdfolSyntax() {
        this(TdfolParser.Limits.DEFAULT);
    }

    public TdfolSyntax(TdfolParser.Limits limits) {
        this.limits = limits;
    }

    @Override
    public Syntax syntax() {
        return Syntax.TDFOL;
    }

    @Override
    public Formula parse(String text) throws ValidationException {
        return TdfolParser.parse(text, new Signature(), limits);
    }

    @Override
    public String serialize(Formula f) throws TranslationException {
        if (f.hasMeta()) throw new TranslationException("rule metavariables have no surface form", "meta");
        return f.text();
    }
}
