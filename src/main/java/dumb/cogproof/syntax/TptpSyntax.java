package dumb.cogproof.syntax;

import dumb.cogproof.Formula;
import dumb.cogproof.Signature;
import dumb.cogproof.Span;
import dumb.cogproof.Term;
import dumb.cogproof.TranslationException;
import dumb.cogproof.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * TPTP first-order form. Arithmetic maps onto the {@code $sum}/{@code $greater} family; modal,
 * temporal, deontic and cognitive operators have no FOF reading and are rejected.
 * Free variables are written {@code FV_name} so they survive a round trip.
 */
public class TptpSyntax implements SurfaceSyntax {

    private static final Pattern LOWER_WORD = Pattern.compile("[a-z][A-Za-z0-9_]*");
    private static final Pattern UPPER_WORD = Pattern.compile("[A-Z][A-Za-z0-9_]*");
    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");
    private static final String FREE_PREFIX = "FV_";
    private static final Map<String, String> TO_TPTP = Map.of(
            "+", "$sum", "-", "$difference", "*", "$product", "/", "$quotient",
            ">", "$greater", "<", "$less", ">=", "$greatereq", "<=", "$lesseq");
    private static final Map<String, String> FROM_TPTP = Map.of(
            "$sum", "+", "$difference", "-", "$product", "*", "$quotient", "/",
            "$greater", ">", "$less", "<", "$greatereq", ">=", "$lesseq", "<=");

    @Override
    public Syntax syntax() {
        return Syntax.TPTP;
    }

    @Override
    public Formula parse(String text) throws ValidationException {
        var p = new Parser(text);
        var f = p.annotatedOrFormula();
        p.skip();
        if (p.i < text.length()) throw p.error("unexpected '" + text.charAt(p.i) + "'");
        return f;
    }

    @Override
    public String serialize(Formula f) throws TranslationException {
        var w = new Writer();
        w.formula(f);
        return w.sb.toString();
    }

    /** A complete problem: axioms then the conjecture. */
    public String problem(Formula goal, List<Formula> axioms) throws TranslationException {
        var sb = new StringBuilder();
        for (var i = 0; i < axioms.size(); i++)
            sb.append("fof(a").append(i + 1).append(", axiom, ").append(serialize(axioms.get(i))).append(").\n");
        sb.append("fof(goal, conjecture, ").append(serialize(goal)).append(").\n");
        return sb.toString();
    }

    @Override
    public List<String> losses(Formula f) {
        return f.subformulas().anyMatch(g -> g instanceof Formula.Modal || g instanceof Formula.Temporal
                || g instanceof Formula.Deontic || g instanceof Formula.Cognitive)
                ? List.of("modal, temporal, deontic and cognitive operators have no TPTP FOF form") : List.of();
    }

    private static final class Writer {
        final StringBuilder sb = new StringBuilder();
        private final List<String> scope = new ArrayList<>();

        void formula(Formula f) throws TranslationException {
            if (f instanceof Formula.Pred p) {
                if (p.symbol.equals("=") && p.arity() == 2) {
                    term(p.args.get(0));
                    sb.append(" = ");
                    term(p.args.get(1));
                } else if (p.comparison()) {
                    sb.append(TO_TPTP.get(p.symbol));
                    args(p.args);
                } else {
                    symbol(p.symbol);
                    if (!p.args.isEmpty()) args(p.args);
                }
            } else if (f instanceof Formula.Not n) {
                sb.append('~');
                unit(n.body);
            } else if (f instanceof Formula.Bin b) {
                unit(b.left);
                sb.append(switch (b.op) {
                    case AND -> " & ";
                    case OR -> " | ";
                    case IMPLIES -> " => ";
                    case IFF -> " <=> ";
                });
                unit(b.right);
            } else if (f instanceof Formula.Quant q) {
                var name = fresh(q.var);
                sb.append(q.kind == Formula.Quantifier.FORALL ? '!' : '?').append('[').append(name).append("]: ");
                scope.add(name);
                unit(q.body);
                scope.remove(scope.size() - 1);
            } else {
                var construct = f.getClass().getSimpleName();
                throw new TranslationException("TPTP FOF cannot express " + construct.toLowerCase() + " operators", construct);
            }
        }

        private void unit(Formula f) throws TranslationException {
            var paren = f instanceof Formula.Bin;
            if (paren) sb.append('(');
            formula(f);
            if (paren) sb.append(')');
        }

        private void args(List<Term> ts) {
            sb.append('(');
            for (var i = 0; i < ts.size(); i++) {
                if (i > 0) sb.append(", ");
                term(ts.get(i));
            }
            sb.append(')');
        }

        private void term(Term t) {
            if (t instanceof Term.Var v) {
                if (v.isFree()) sb.append(FREE_PREFIX).append(v.name());
                else sb.append(v.index() < scope.size() ? scope.get(scope.size() - 1 - v.index()) : "X");
            } else if (t instanceof Term.Const c) {
                if (c.numeric()) sb.append(c.name());
                else symbol(c.name());
            } else if (t instanceof Term.Fn fn) {
                var mapped = fn.arithmetic() ? TO_TPTP.get(fn.symbol()) : null;
                if (mapped != null) sb.append(mapped);
                else symbol(fn.symbol());
                args(fn.args());
            }
        }

        private void symbol(String s) {
            if (LOWER_WORD.matcher(s).matches()) sb.append(s);
            else sb.append('\'').append(s.replace("\\", "\\\\").replace("'", "\\'")).append('\'');
        }

        private String fresh(String base) {
            var cap = base.isEmpty() ? "X" : Character.toUpperCase(base.charAt(0)) + base.substring(1);
            var name = UPPER_WORD.matcher(cap).matches() && !cap.startsWith(FREE_PREFIX) ? cap : "X";
            var i = 1;
            var root = name;
            while (scope.contains(name)) name = root + i++;
            return name;
        }
    }

    private static final class Parser {
        private final String s;
        private final Signature signature = new Signature();
        private final List<String> scope = new ArrayList<>();
        int i;

        Parser(String s) {
            this.s = s;
        }

        Formula annotatedOrFormula() throws ValidationException {
            skip();
            if (s.startsWith("fof(", i) || s.startsWith("tff(", i)) {
                i += 4;
                word();
                expect(',');
                word();
                expect(',');
                var f = formula();
                skip();
                if (peek() == ',') {
                    var close = s.lastIndexOf(')');
                    if (close < i) throw error("unterminated annotated formula");
                    i = close;
                }
                expect(')');
                skip();
                if (peek() == '.') i++;
                return f;
            }
            return formula();
        }

        private Formula formula() throws ValidationException {
            var l = unit();
            skip();
            if (s.startsWith("<=>", i)) {
                i += 3;
                return Formula.iff(l, unit());
            }
            if (s.startsWith("<~>", i)) {
                i += 3;
                return Formula.not(Formula.iff(l, unit()));
            }
            if (s.startsWith("=>", i)) {
                i += 2;
                return Formula.implies(l, unit());
            }
            if (s.startsWith("<=", i)) {
                i += 2;
                return Formula.implies(unit(), l);
            }
            if (peek() == '&' || peek() == '|') {
                var op = peek();
                while (peek() == op) {
                    i++;
                    var r = unit();
                    l = op == '&' ? Formula.and(l, r) : Formula.or(l, r);
                    skip();
                }
            }
            return l;
        }

        private Formula unit() throws ValidationException {
            skip();
            var c = peek();
            if (c == '~') {
                i++;
                return Formula.not(unit());
            }
            if (c == '(') {
                i++;
                var f = formula();
                expect(')');
                return f;
            }
            if (c == '!' || c == '?') {
                i++;
                expect('[');
                var names = new ArrayList<String>();
                while (true) {
                    var v = word();
                    if (!UPPER_WORD.matcher(v).matches()) throw error("quantified variable must start with an uppercase letter");
                    names.add(v);
                    skip();
                    if (peek() != ',') break;
                    i++;
                }
                expect(']');
                expect(':');
                names.forEach(scope::add);
                var body = unit();
                var kind = c == '!' ? Formula.Quantifier.FORALL : Formula.Quantifier.EXISTS;
                for (var k = names.size() - 1; k >= 0; k--) {
                    scope.remove(scope.size() - 1);
                    body = new Formula.Quant(kind, names.get(k), body);
                }
                return body;
            }
            return atomic();
        }

        private Formula atomic() throws ValidationException {
            var start = i;
            var l = term();
            skip();
            if (peek() == '=' && !s.startsWith("=>", i) || s.startsWith("!=", i)) {
                var neq = peek() == '!';
                i += neq ? 2 : 1;
                var r = term();
                var eq = Formula.pred("=", l, r);
                return neq ? Formula.not(eq) : eq;
            }
            if (l instanceof Term.Fn fn) {
                signature.predicate(fn.symbol(), fn.args().size(), Span.at(s, start, i));
                return new Formula.Pred(fn.symbol(), fn.args());
            }
            if (l instanceof Term.Const c && !c.numeric()) {
                if (c.name().equals("$true") || c.name().equals("$false")) return Formula.pred(c.name());
                signature.predicate(c.name(), 0, Span.at(s, start, i));
                return Formula.pred(c.name());
            }
            throw error("expected an atomic formula");
        }

        private Term term() throws ValidationException {
            skip();
            var start = i;
            if (peek() == '\'') {
                var name = quoted();
                return application(name, start);
            }
            var w = word();
            if (NUMBER.matcher(w).matches()) return Term.Const.of(w);
            if (UPPER_WORD.matcher(w).matches()) {
                var k = scope.lastIndexOf(w);
                if (k >= 0) return Term.Var.bound(w, scope.size() - 1 - k);
                return Term.Var.free(w.startsWith(FREE_PREFIX) && w.length() > FREE_PREFIX.length() ? w.substring(FREE_PREFIX.length()) : w);
            }
            return application(w, start);
        }

        private Term application(String name, int start) throws ValidationException {
            skip();
            if (peek() != '(') return Term.Const.of(name);
            i++;
            var args = new ArrayList<Term>();
            while (true) {
                args.add(term());
                skip();
                if (peek() != ',') break;
                i++;
            }
            expect(')');
            return new Term.Fn(FROM_TPTP.getOrDefault(name, name), args);
        }

        private String quoted() throws ValidationException {
            var sb = new StringBuilder();
            i++;
            while (true) {
                if (i >= s.length()) throw error("unterminated quoted name");
                var c = s.charAt(i++);
                if (c == '\'') break;
                if (c == '\\' && i < s.length()) c = s.charAt(i++);
                sb.append(c);
            }
            return sb.toString();
        }

        private String word() throws ValidationException {
            skip();
            var start = i;
            if (peek() == '$') i++;
            if (peek() == '-') i++;
            while (i < s.length() && (Character.isLetterOrDigit(s.charAt(i)) || s.charAt(i) == '_' || s.charAt(i) == '.'
                    && i + 1 < s.length() && Character.isDigit(s.charAt(i + 1)) && i > start)) i++;
            if (i == start) throw error(i < s.length() ? "unexpected '" + s.charAt(i) + "'" : "unexpected end of input");
            return s.substring(start, i);
        }

        private int peek() {
            return i < s.length() ? s.charAt(i) : -1;
        }

        void skip() {
            while (i < s.length()) {
                var c = s.charAt(i);
                if (Character.isWhitespace(c)) i++;
                else if (c == '%') {
                    while (i < s.length() && s.charAt(i) != '\n') i++;
                } else return;
            }
        }

        private void expect(char c) throws ValidationException {
            skip();
            if (peek() != c) throw error("expected '" + c + "'");
            i++;
        }

        ValidationException error(String message) {
            var from = Math.max(0, i - 20);
            var to = Math.min(s.length(), i + 20);
            return new ValidationException(message, Span.at(s, i, Math.min(s.length(), i + 1)), s.substring(from, to));
        }
    }
}
