package dumb.cogproof.syntax;

import dumb.cogproof.Formula;
import dumb.cogproof.Span;
import dumb.cogproof.Term;
import dumb.cogproof.TranslationException;
import dumb.cogproof.ValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Propositional multi-modal string form read by tableaux provers: {@code ~ & | -> <->}, boxes
 * {@code [] [G] [X] [O:agent] [K:agent]} and diamonds {@code <> <G> <O:agent>}. Sub-formulas with no
 * modal reading (quantifiers, until/since, comparisons) are kept as opaque atoms in braces.
 */
public class ModalSyntax implements SurfaceSyntax {

    @Override
    public Syntax syntax() {
        return Syntax.MODAL;
    }

    @Override
    public Formula parse(String text) throws ValidationException {
        var p = new Parser(text);
        var f = p.formula();
        p.skipSpace();
        if (p.i < text.length()) throw p.error("unexpected '" + text.charAt(p.i) + "'");
        return f;
    }

    @Override
    public String serialize(Formula f) throws TranslationException {
        var sb = new StringBuilder();
        write(f, sb, 0);
        return sb.toString();
    }

    @Override
    public List<String> losses(Formula f) {
        var out = new ArrayList<String>();
        if (f.subformulas().anyMatch(g -> g instanceof Formula.Deontic d && d.op == Formula.DeonticOp.FORBIDDEN))
            out.add("Forbidden is written as the obligation of the negation");
        if (f.subformulas().anyMatch(g -> g instanceof Formula.Temporal t && t.op.arity == 2))
            out.add("Until/Since sub-formulas are opaque atoms to a modal prover");
        if (f.subformulas().anyMatch(Formula.Quant.class::isInstance))
            out.add("quantified sub-formulas are opaque atoms to a modal prover");
        return out;
    }

    private static void write(Formula f, StringBuilder sb, int prec) throws TranslationException {
        if (f instanceof Formula.Meta) throw new TranslationException("rule metavariables have no modal form", "meta");
        if (f instanceof Formula.Pred p) {
            if (!p.comparison() && Term.IDENTIFIER.matcher(p.symbol).matches()) sb.append(p.text());
            else opaque(f, sb);
        } else if (f instanceof Formula.Not n) {
            sb.append('~');
            write(n.body, sb, 5);
        } else if (f instanceof Formula.Bin b) {
            var p = b.op.precedence;
            var paren = prec > p;
            if (paren) sb.append('(');
            write(b.left, sb, b.op == Formula.Connective.AND || b.op == Formula.Connective.OR ? p : p + 1);
            sb.append(' ').append(b.op.symbol).append(' ');
            write(b.right, sb, b.op == Formula.Connective.IMPLIES ? p : p + 1);
            if (paren) sb.append(')');
        } else if (f instanceof Formula.Modal m) {
            sb.append(m.op == Formula.ModalOp.NECESSARY ? "[]" : "<>");
            write(m.body, sb, 5);
        } else if (f instanceof Formula.Temporal t) {
            switch (t.op) {
                case ALWAYS -> sb.append("[G]");
                case EVENTUALLY -> sb.append("<G>");
                case NEXT -> sb.append("[X]");
                default -> {
                    opaque(f, sb);
                    return;
                }
            }
            write(t.body, sb, 5);
        } else if (f instanceof Formula.Deontic d) {
            var agent = agent(d.agent);
            switch (d.op) {
                case OBLIGATORY -> sb.append("[O:").append(agent).append(']');
                case PERMITTED -> sb.append("<O:").append(agent).append('>');
                case FORBIDDEN -> sb.append("[O:").append(agent).append("]~");
            }
            write(d.action, sb, 5);
        } else if (f instanceof Formula.Cognitive c) {
            if (c.op == Formula.CognitiveOp.COMMON_KNOWLEDGE) sb.append("[C]");
            else sb.append('[').append(index(c.op)).append(':').append(agent(c.agent)).append(']');
            write(c.body, sb, 5);
        } else opaque(f, sb);
    }

    private static String agent(Term t) throws TranslationException {
        var s = t.text();
        if (s.indexOf(']') >= 0 || s.indexOf('>') >= 0 || s.indexOf(':') >= 0)
            throw new TranslationException("agent '" + s + "' cannot be written as a modality index", s);
        return s;
    }

    private static void opaque(Formula f, StringBuilder sb) throws TranslationException {
        if (f.loose(0))
            throw new TranslationException("open sub-formula cannot be made opaque", f.text());
        sb.append('{').append(f.text()).append('}');
    }

    static String index(Formula.CognitiveOp op) {
        return switch (op) {
            case BELIEVES -> "B";
            case KNOWS -> "K";
            case INTENDS -> "I";
            case DESIRES -> "D";
            case PERCEIVES -> "P";
            case SAYS -> "S";
            case COMMON_KNOWLEDGE -> "C";
        };
    }

    private static final class Parser {
        private final String s;
        private int i;
        private int depth;

        Parser(String s) {
            this.s = s;
        }

        Formula formula() throws ValidationException {
            var l = implication();
            while (true) {
                skipSpace();
                if (!s.startsWith("<->", i)) return l;
                i += 3;
                l = Formula.iff(l, implication());
            }
        }

        private Formula implication() throws ValidationException {
            var l = disjunction();
            skipSpace();
            if (s.startsWith("->", i)) {
                i += 2;
                return Formula.implies(l, implication());
            }
            return l;
        }

        private Formula disjunction() throws ValidationException {
            var l = conjunction();
            while (true) {
                skipSpace();
                if (!s.startsWith("|", i)) return l;
                i++;
                l = Formula.or(l, conjunction());
            }
        }

        private Formula conjunction() throws ValidationException {
            var l = unary();
            while (true) {
                skipSpace();
                if (!s.startsWith("&", i)) return l;
                i++;
                l = Formula.and(l, unary());
            }
        }

        private Formula unary() throws ValidationException {
            if (++depth > TdfolParser.Limits.DEFAULT.maxDepth()) throw error("formula nesting is too deep");
            try {
                skipSpace();
                if (i >= s.length()) throw error("expected a formula but reached end of input");
                var c = s.charAt(i);
                if (c == '~') {
                    i++;
                    return Formula.not(unary());
                }
                if (c == '[') return modality(']', true);
                if (c == '<' && !s.startsWith("<->", i)) return modality('>', false);
                if (c == '(') {
                    i++;
                    var f = formula();
                    skipSpace();
                    expect(')');
                    return f;
                }
                if (c == '{') return opaque();
                return atom();
            } finally {
                depth--;
            }
        }

        private Formula modality(char close, boolean box) throws ValidationException {
            var start = i++;
            var end = s.indexOf(close, i);
            if (end < 0) throw error("unterminated modality starting at '" + s.charAt(start) + "'");
            var index = s.substring(i, end).strip();
            i = end + 1;
            var body = unary();
            if (index.isEmpty()) return box ? Formula.necessary(body) : Formula.possible(body);
            if (index.equals("G")) return box ? Formula.always(body) : Formula.eventually(body);
            if (index.equals("X")) return box ? Formula.next(body) : dual(Formula.next(Formula.not(body)));
            if (index.equals("C")) {
                var ck = Formula.cognitive(Formula.CognitiveOp.COMMON_KNOWLEDGE, Formula.EVERYONE, box ? body : Formula.not(body));
                return box ? ck : dual(ck);
            }
            var colon = index.indexOf(':');
            if (colon < 0) throw error("unknown modality index '" + index + "'");
            var kind = index.substring(0, colon);
            var agent = TdfolParser.parseTerm(index.substring(colon + 1));
            if (kind.equals("O"))
                return box ? Formula.obligatory(agent, body) : Formula.permitted(agent, body);
            for (var op : Formula.CognitiveOp.values()) {
                if (op != Formula.CognitiveOp.COMMON_KNOWLEDGE && index(op).equals(kind)) {
                    return box ? new Formula.Cognitive(op, agent, body) : dual(new Formula.Cognitive(op, agent, Formula.not(body)));
                }
            }
            throw error("unknown modality index '" + index + "'");
        }

        private static Formula dual(Formula boxedNegation) {
            return Formula.not(boxedNegation);
        }

        private Formula opaque() throws ValidationException {
            var start = ++i;
            var level = 1;
            while (i < s.length() && level > 0) {
                var c = s.charAt(i++);
                if (c == '{') level++;
                else if (c == '}') level--;
            }
            if (level > 0) throw error("unterminated '{'");
            return TdfolParser.parse(s.substring(start, i - 1));
        }

        private Formula atom() throws ValidationException {
            var start = i;
            while (i < s.length() && (Character.isLetterOrDigit(s.charAt(i)) || s.charAt(i) == '_')) i++;
            if (i == start) throw error("unexpected '" + s.charAt(i) + "'");
            if (i < s.length() && s.charAt(i) == '(') {
                var level = 0;
                do {
                    var c = s.charAt(i++);
                    if (c == '(') level++;
                    else if (c == ')') level--;
                } while (i < s.length() && level > 0);
                if (level > 0) throw error("unbalanced parentheses in atom");
            }
            return TdfolParser.parse(s.substring(start, i));
        }

        void skipSpace() {
            while (i < s.length() && Character.isWhitespace(s.charAt(i))) i++;
        }

        private void expect(char c) throws ValidationException {
            if (i >= s.length() || s.charAt(i) != c) throw error("expected '" + c + "'");
            i++;
        }

        ValidationException error(String message) {
            var from = Math.max(0, i - 20);
            var to = Math.min(s.length(), i + 20);
            return new ValidationException(message, Span.at(s, i, Math.min(i + 1, s.length())), s.substring(from, to));
        }
    }
}
