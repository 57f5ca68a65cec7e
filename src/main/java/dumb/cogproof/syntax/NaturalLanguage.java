package dumb.cogproof.syntax;

import dumb.cogproof.Formula;
import dumb.cogproof.Term;
import dumb.cogproof.TranslationException;
import dumb.cogproof.ValidationException;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static dumb.cogproof.util.Log.debug;

/**
 * English glosses of formulas, and a small pattern reader for normative English sentences.
 * <p>
 * A gloss is built compositionally, one phrase per connective and operator; when that fails (rule
 * metavariables, very deep nesting) a template wraps the native text instead. Reading recognises
 * universal statements, obligations, permissions, prohibitions, always/eventually and if-then.
 */
public class NaturalLanguage implements SurfaceSyntax {

    public static final double GRAMMAR_CONFIDENCE = 0.9;
    public static final double TEMPLATE_CONFIDENCE = 0.6;

    static final int MAX_GRAMMAR_DEPTH = 12;

    private static final Map<String, String> COMPARISONS = Map.of(
            "=", "equals", "!=", "differs from", "<", "is less than", ">", "is greater than",
            "<=", "is at most", ">=", "is at least");

    public record Gloss(String text, double confidence, boolean grammatical) {
    }

    public enum PatternType {
        UNIVERSAL, OBLIGATION, PERMISSION, PROHIBITION, TEMPORAL, CONDITIONAL, ATOMIC
    }

    /** A sentence read into a formula, with the pattern that matched it. */
    public record Reading(Formula formula, PatternType pattern, double confidence) {
    }

    @Override
    public Syntax syntax() {
        return Syntax.NATURAL_LANGUAGE;
    }

    @Override
    public Formula parse(String text) throws ValidationException {
        return read(text).formula();
    }

    @Override
    public String serialize(Formula f) {
        return gloss(f).text();
    }

    @Override
    public List<String> losses(Formula f) {
        return List.of("an English gloss is not guaranteed to read back to the same formula");
    }

    public Gloss gloss(Formula f) {
        try {
            var g = new Grammar();
            return new Gloss(capitalize(g.clause(f, 0)) + ".", GRAMMAR_CONFIDENCE, true);
        } catch (TranslationException e) {
            debug("gloss falls back to template: " + e.getMessage());
            return new Gloss("The following holds: " + f.text() + ".", TEMPLATE_CONFIDENCE, false);
        }
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }

    private static final class Grammar {
        private final Set<String> names = new HashSet<>();

        String clause(Formula f, int depth) throws TranslationException {
            if (depth > MAX_GRAMMAR_DEPTH) throw new TranslationException("too deeply nested for a readable gloss", f.text());
            var d = depth + 1;
            if (f instanceof Formula.Pred p) return atom(p);
            if (f instanceof Formula.Not n) return "it is not the case that " + clause(n.body, d);
            if (f instanceof Formula.Bin b) {
                var l = nested(b.left, d);
                var r = nested(b.right, d);
                return switch (b.op) {
                    case AND -> l + " and " + r;
                    case OR -> "either " + l + " or " + r;
                    case IMPLIES -> "if " + l + " then " + r;
                    case IFF -> l + " if and only if " + r;
                };
            }
            if (f instanceof Formula.Quant q) {
                var name = fresh(q.var);
                var body = clause(q.instantiate(Term.Const.of(name)), d);
                names.remove(name);
                return (q.kind == Formula.Quantifier.FORALL ? "for every " + name + ", " : "there is some " + name + " such that ") + body;
            }
            if (f instanceof Formula.Modal m)
                return (m.op == Formula.ModalOp.NECESSARY ? "necessarily " : "possibly ") + nested(m.body, d);
            if (f instanceof Formula.Temporal t) {
                return switch (t.op) {
                    case ALWAYS -> "it is always the case that " + nested(t.body, d);
                    case EVENTUALLY -> "eventually " + nested(t.body, d);
                    case NEXT -> "at the next moment " + nested(t.body, d);
                    case UNTIL -> nested(t.body, d) + " until " + nested(requireSecond(t), d);
                    case SINCE -> nested(t.body, d) + " since " + nested(requireSecond(t), d);
                };
            }
            if (f instanceof Formula.Deontic o) {
                var who = o.agent.text();
                var what = nested(o.action, d);
                return switch (o.op) {
                    case OBLIGATORY -> who + " is obliged to see that " + what;
                    case PERMITTED -> who + " is permitted to see that " + what;
                    case FORBIDDEN -> who + " is forbidden to see that " + what;
                };
            }
            if (f instanceof Formula.Cognitive c) {
                var body = nested(c.body, d);
                if (c.op == Formula.CognitiveOp.COMMON_KNOWLEDGE) return "it is common knowledge that " + body;
                return c.agent.text() + " " + verb(c.op) + " that " + body;
            }
            throw new TranslationException("no phrase for " + f.getClass().getSimpleName(), f.text());
        }

        /** Compound sub-clauses are bracketed so the gloss stays unambiguous. */
        private String nested(Formula f, int depth) throws TranslationException {
            var s = clause(f, depth);
            return f instanceof Formula.Bin || f instanceof Formula.Temporal t && t.op.arity == 2 ? "(" + s + ")" : s;
        }

        private static Formula requireSecond(Formula.Temporal t) throws TranslationException {
            if (t.body2 == null) throw new TranslationException("binary temporal operator without a second operand", t.text());
            return t.body2;
        }

        private String fresh(String base) {
            var name = base;
            for (var i = 1; !names.add(name); i++) name = base + i;
            return name;
        }

        private static String atom(Formula.Pred p) {
            if (p.comparison())
                return p.args.get(0).text() + " " + COMPARISONS.get(p.symbol) + " " + p.args.get(1).text();
            return switch (p.arity()) {
                case 0 -> p.symbol + " holds";
                case 1 -> p.args.get(0).text() + " is " + p.symbol;
                default -> p.symbol + " holds of " + join(p.args);
            };
        }

        private static String join(List<Term> args) {
            var sb = new StringBuilder();
            for (var i = 0; i < args.size(); i++) {
                if (i > 0) sb.append(i == args.size() - 1 ? " and " : ", ");
                sb.append(args.get(i).text());
            }
            return sb.toString();
        }

        private static String verb(Formula.CognitiveOp op) {
            return switch (op) {
                case BELIEVES -> "believes";
                case KNOWS -> "knows";
                case INTENDS -> "intends";
                case DESIRES -> "desires";
                case PERCEIVES -> "perceives";
                case SAYS -> "says";
                case COMMON_KNOWLEDGE -> "commonly knows";
            };
        }
    }

    // ---- reading

    private static final Pattern CONDITIONAL = Pattern.compile("^if (.+?),? then (.+)$");
    private static final Pattern TEMPORAL = Pattern.compile("^(always|eventually) (.+)$");
    private static final Pattern UNIVERSAL = Pattern.compile("^(?:all|every|each|any) (\\w+?) (?:are|is) (\\w+)$");
    private static final Pattern PROHIBITION = Pattern.compile("^(?:the )?(\\w+) (?:must not|shall not|may not|cannot|is forbidden to|is prohibited from) (\\w+)(?: (?:the )?(\\w+))?$");
    private static final Pattern OBLIGATION = Pattern.compile("^(?:the )?(\\w+) (?:must|shall|has to|is required to|is obligated to) (\\w+)(?: (?:the )?(\\w+))?$");
    private static final Pattern PERMISSION = Pattern.compile("^(?:the )?(\\w+) (?:may|can|is allowed to|is permitted to) (\\w+)(?: (?:the )?(\\w+))?$");
    private static final Pattern COPULA = Pattern.compile("^(?:the )?(\\w+) (?:is|are) (\\w+)$");
    private static final Pattern ACTION = Pattern.compile("^(?:the )?(\\w+) (\\w+?)s?(?: (?:the )?(\\w+))?$");

    /**
     * Reads one sentence. Conditionals and temporal adverbs wrap the reading of their parts; the
     * confidence of a composite reading is the product of its parts' confidences.
     */
    public Reading read(String sentence) throws ValidationException {
        var s = normalize(sentence);
        if (s.isEmpty()) throw new ValidationException("empty sentence");
        var reading = match(s);
        if (reading == null) throw new ValidationException("no sentence pattern matches '" + sentence.strip() + "'");
        return reading;
    }

    private @Nullable Reading match(String s) throws ValidationException {
        Matcher m;
        if ((m = CONDITIONAL.matcher(s)).matches()) {
            var a = read(m.group(1));
            var b = read(m.group(2));
            return new Reading(Formula.implies(a.formula(), b.formula()), PatternType.CONDITIONAL,
                    0.9 * a.confidence() * b.confidence());
        }
        if ((m = TEMPORAL.matcher(s)).matches()) {
            var body = read(m.group(2));
            var f = m.group(1).equals("always") ? Formula.always(body.formula()) : Formula.eventually(body.formula());
            return new Reading(f, PatternType.TEMPORAL, 0.95 * body.confidence());
        }
        if ((m = UNIVERSAL.matcher(s)).matches()) {
            var x = Term.Var.free("x");
            var f = Formula.forall("x", Formula.implies(
                    Formula.pred(singular(m.group(1)), x),
                    Formula.pred(singular(m.group(2)), x)));
            return new Reading(f, PatternType.UNIVERSAL, 0.85);
        }
        if ((m = PROHIBITION.matcher(s)).matches())
            return new Reading(Formula.forbidden(agent(m), action(m)), PatternType.PROHIBITION, 0.85);
        if ((m = OBLIGATION.matcher(s)).matches())
            return new Reading(Formula.obligatory(agent(m), action(m)), PatternType.OBLIGATION, 0.85);
        if ((m = PERMISSION.matcher(s)).matches())
            return new Reading(Formula.permitted(agent(m), action(m)), PatternType.PERMISSION, 0.8);
        if ((m = COPULA.matcher(s)).matches())
            return new Reading(Formula.pred(m.group(2), Term.Const.of(m.group(1))), PatternType.ATOMIC, 0.75);
        if ((m = ACTION.matcher(s)).matches())
            return new Reading(action(m), PatternType.ATOMIC, 0.7);
        return null;
    }

    private static Term agent(Matcher m) {
        return Term.Const.of(m.group(1));
    }

    private static Formula action(Matcher m) {
        var args = new ArrayList<Term>();
        args.add(Term.Const.of(m.group(1)));
        if (m.group(3) != null) args.add(Term.Const.of(m.group(3)));
        return Formula.pred(m.group(2), args.toArray(Term[]::new));
    }

    private static String normalize(String s) {
        s = s.strip().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        while (!s.isEmpty() && ".!;".indexOf(s.charAt(s.length() - 1)) >= 0) s = s.substring(0, s.length() - 1).strip();
        return s;
    }

    /** Crude plural folding: {@code contractors} to {@code contractor}, {@code classes} to {@code class}. */
    static String singular(String w) {
        if (w.endsWith("sses") || w.endsWith("ches") || w.endsWith("shes")) return w.substring(0, w.length() - 2);
        if (w.endsWith("ies") && w.length() > 4) return w.substring(0, w.length() - 3) + "y";
        if (w.endsWith("s") && !w.endsWith("ss") && w.length() > 3) return w.substring(0, w.length() - 1);
        return w;
    }
}
