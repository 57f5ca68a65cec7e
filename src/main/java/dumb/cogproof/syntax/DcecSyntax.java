package dumb.cogproof.syntax;

import dumb.cogproof.Formula;
import dumb.cogproof.Signature;
import dumb.cogproof.Span;
import dumb.cogproof.Term;
import dumb.cogproof.TranslationException;
import dumb.cogproof.ValidationException;
import dumb.cogproof.syntax.SExprReader.SExpr;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Prefix s-expression interchange syntax of the cognitive event calculus:
 * {@code (Obligatory agent1 (pay agent1 100))}, {@code (forall (?x) (implies (P ?x) (Q ?x)))}.
 * Agents are always written out, so the round trip is exact.
 */
public class DcecSyntax implements SurfaceSyntax {

    private static final Pattern SAFE_SYMBOL = Pattern.compile("[\\p{L}\\p{N}_\\-+*/.<>=:!#%&']+");
    private static final Map<String, Formula.Connective> CONNECTIVES = Map.of(
            "and", Formula.Connective.AND, "or", Formula.Connective.OR,
            "implies", Formula.Connective.IMPLIES, "=>", Formula.Connective.IMPLIES,
            "iff", Formula.Connective.IFF, "<=>", Formula.Connective.IFF);
    private static final Map<String, Object> OPERATORS = new HashMap<>();
    static final Set<String> RESERVED = new HashSet<>();

    static {
        for (var o : Formula.TemporalOp.values()) OPERATORS.put(o.keyword, o);
        for (var o : Formula.ModalOp.values()) OPERATORS.put(o.keyword, o);
        for (var o : Formula.DeonticOp.values()) OPERATORS.put(o.keyword, o);
        for (var o : Formula.CognitiveOp.values()) OPERATORS.put(o.keyword, o);
        RESERVED.addAll(OPERATORS.keySet());
        RESERVED.addAll(CONNECTIVES.keySet());
        RESERVED.addAll(List.of("not", "forall", "exists"));
    }

    @Override
    public Syntax syntax() {
        return Syntax.DCEC;
    }

    @Override
    public Formula parse(String text) throws ValidationException {
        return new Reader(text).read(SExprReader.readOne(text));
    }

    @Override
    public String serialize(Formula f) throws TranslationException {
        var sb = new StringBuilder();
        new Writer(sb, f).formula(f);
        return sb.toString();
    }

    private static final class Reader {
        private final String text;
        private final Signature signature = new Signature();
        private final List<String> scope = new ArrayList<>();
        private final Set<String> boundNames = new HashSet<>();
        private final List<SExpr.VarRef> freeUses = new ArrayList<>();

        Reader(String text) {
            this.text = text;
        }

        Formula read(SExpr e) throws ValidationException {
            var f = formula(e);
            for (var v : freeUses)
                if (boundNames.contains(v.name()))
                    throw error("variable '?" + v.name() + "' is used outside the scope of the quantifier that binds it", v);
            return f;
        }

        private Formula formula(SExpr e) throws ValidationException {
            if (e instanceof SExpr.Sym s) {
                if (RESERVED.contains(s.name())) throw error("operator '" + s.name() + "' needs operands", e);
                signature.predicate(s.name(), 0, s.span());
                return new Formula.Pred(s.name(), List.of());
            }
            if (e instanceof SExpr.Str s) {
                signature.predicate(s.value(), 0, s.span());
                return new Formula.Pred(s.value(), List.of());
            }
            if (e instanceof SExpr.VarRef) throw error("a variable cannot stand for a formula", e);
            var l = (SExpr.Lst) e;
            if (l.size() == 0) throw error("empty list is not a formula", e);
            var head = l.head();
            if (head == null) {
                if (l.get(0) instanceof SExpr.Str s) return atom(s.value(), l);
                throw error("expected an operator or predicate symbol at the head of the list", l.get(0));
            }
            if (head.equals("not")) {
                arity(l, 1);
                return Formula.not(formula(l.get(1)));
            }
            var conn = CONNECTIVES.get(head);
            if (conn != null) {
                if (conn == Formula.Connective.AND || conn == Formula.Connective.OR) {
                    if (l.size() < 3) throw error("'" + head + "' needs at least two operands", l);
                    var f = formula(l.get(1));
                    for (var i = 2; i < l.size(); i++) f = new Formula.Bin(conn, f, formula(l.get(i)));
                    return f;
                }
                arity(l, 2);
                return new Formula.Bin(conn, formula(l.get(1)), formula(l.get(2)));
            }
            if (head.equals("forall") || head.equals("exists")) return quantifier(l, head);
            var op = OPERATORS.get(head);
            if (op instanceof Formula.TemporalOp t) {
                arity(l, t.arity);
                return new Formula.Temporal(t, formula(l.get(1)), t.arity == 2 ? formula(l.get(2)) : null);
            }
            if (op instanceof Formula.ModalOp m) {
                arity(l, 1);
                return new Formula.Modal(m, formula(l.get(1)));
            }
            if (op instanceof Formula.DeonticOp d) {
                if (l.size() == 2) return Formula.deontic(d, formula(l.get(1)));
                arity(l, 2);
                return new Formula.Deontic(d, term(l.get(1)), formula(l.get(2)));
            }
            if (op instanceof Formula.CognitiveOp c) {
                if (c == Formula.CognitiveOp.COMMON_KNOWLEDGE) {
                    arity(l, 1);
                    return Formula.cognitive(c, Formula.EVERYONE, formula(l.get(1)));
                }
                arity(l, 2);
                return new Formula.Cognitive(c, term(l.get(1)), formula(l.get(2)));
            }
            return atom(head, l);
        }

        private Formula atom(String symbol, SExpr.Lst l) throws ValidationException {
            var args = new ArrayList<Term>();
            for (var i = 1; i < l.size(); i++) args.add(term(l.get(i)));
            signature.predicate(symbol, args.size(), l.span());
            return new Formula.Pred(symbol, args);
        }

        private Formula quantifier(SExpr.Lst l, String head) throws ValidationException {
            arity(l, 2);
            var names = new ArrayList<String>();
            var spec = l.get(1);
            if (spec instanceof SExpr.VarRef v) names.add(v.name());
            else if (spec instanceof SExpr.Lst vs && vs.size() > 0) {
                for (var x : vs.items()) {
                    if (!(x instanceof SExpr.VarRef v)) throw error("quantified variables must be written ?name", x);
                    names.add(v.name());
                }
            } else throw error("expected a variable or a list of variables after '" + head + "'", spec);
            scope.addAll(names);
            boundNames.addAll(names);
            var body = formula(l.get(2));
            var kind = head.equals("forall") ? Formula.Quantifier.FORALL : Formula.Quantifier.EXISTS;
            for (var i = names.size() - 1; i >= 0; i--) {
                scope.remove(scope.size() - 1);
                body = new Formula.Quant(kind, names.get(i), body);
            }
            return body;
        }

        private Term term(SExpr e) throws ValidationException {
            if (e instanceof SExpr.VarRef v) {
                var i = scope.lastIndexOf(v.name());
                if (i >= 0) return Term.Var.bound(v.name(), scope.size() - 1 - i);
                freeUses.add(v);
                return Term.Var.free(v.name());
            }
            if (e instanceof SExpr.Sym s) return Term.Const.of(s.name());
            if (e instanceof SExpr.Str s) return Term.Const.of(s.value());
            var l = (SExpr.Lst) e;
            if (l.size() < 2) throw error("function application needs a symbol and arguments", e);
            String symbol;
            if (l.get(0) instanceof SExpr.Sym s) symbol = s.name();
            else if (l.get(0) instanceof SExpr.Str s) symbol = s.value();
            else throw error("expected a function symbol", l.get(0));
            var args = new ArrayList<Term>();
            for (var i = 1; i < l.size(); i++) args.add(term(l.get(i)));
            signature.function(symbol, args.size(), l.span());
            return new Term.Fn(symbol, args);
        }

        private void arity(SExpr.Lst l, int n) throws ValidationException {
            if (l.size() != n + 1)
                throw error("'" + l.head() + "' takes " + n + " operand(s) but got " + (l.size() - 1), l);
        }

        private ValidationException error(String message, SExpr at) {
            var s = at.span();
            var ctx = s.known() ? text.substring(Math.max(0, s.start()), Math.min(text.length(), Math.max(s.end(), s.start()) + 1)) : "";
            return new ValidationException(message, s.known() ? s : Span.NONE, ctx.length() > 50 ? ctx.substring(0, 50) : ctx);
        }
    }

    private static final class Writer {
        private final StringBuilder sb;
        private final List<String> scope = new ArrayList<>();
        private final Set<String> freeNames = new HashSet<>();

        Writer(StringBuilder sb, Formula root) {
            this.sb = sb;
            root.freeVars().forEach(v -> freeNames.add(v.name()));
        }

        void formula(Formula f) throws TranslationException {
            if (f instanceof Formula.Pred p) {
                if (RESERVED.contains(p.symbol) || p.symbol.equals("not"))
                    throw new TranslationException("predicate '" + p.symbol + "' collides with a reserved operator", p.symbol);
                if (p.args.isEmpty()) symbol(p.symbol);
                else {
                    sb.append('(');
                    symbol(p.symbol);
                    for (var a : p.args) {
                        sb.append(' ');
                        term(a);
                    }
                    sb.append(')');
                }
            } else if (f instanceof Formula.Not n) {
                sb.append("(not ");
                formula(n.body);
                sb.append(')');
            } else if (f instanceof Formula.Bin b) {
                sb.append('(').append(b.op.name().toLowerCase()).append(' ');
                formula(b.left);
                sb.append(' ');
                formula(b.right);
                sb.append(')');
            } else if (f instanceof Formula.Quant q) {
                var name = fresh(q.var);
                sb.append('(').append(q.kind.keyword).append(" (?").append(name).append(") ");
                scope.add(name);
                formula(q.body);
                scope.remove(scope.size() - 1);
                sb.append(')');
            } else if (f instanceof Formula.Modal m) {
                unary(m.op.keyword, null, m.body);
            } else if (f instanceof Formula.Temporal t) {
                sb.append('(').append(t.op.keyword).append(' ');
                formula(t.body);
                if (t.body2 != null) {
                    sb.append(' ');
                    formula(t.body2);
                }
                sb.append(')');
            } else if (f instanceof Formula.Deontic d) {
                unary(d.op.keyword, d.agent, d.action);
            } else if (f instanceof Formula.Cognitive c) {
                unary(c.op.keyword, c.op == Formula.CognitiveOp.COMMON_KNOWLEDGE ? null : c.agent, c.body);
            } else {
                throw new TranslationException("rule metavariables have no s-expression form", "meta");
            }
        }

        private void unary(String op, Term agent, Formula body) throws TranslationException {
            sb.append('(').append(op).append(' ');
            if (agent != null) {
                term(agent);
                sb.append(' ');
            }
            formula(body);
            sb.append(')');
        }

        private void term(Term t) {
            if (t instanceof Term.Var v) {
                sb.append('?');
                if (v.isFree()) sb.append(v.name());
                else sb.append(v.index() < scope.size() ? scope.get(scope.size() - 1 - v.index()) : v.name());
            } else if (t instanceof Term.Const c) symbol(c.name());
            else if (t instanceof Term.Fn fn) {
                sb.append('(');
                symbol(fn.symbol());
                for (var a : fn.args()) {
                    sb.append(' ');
                    term(a);
                }
                sb.append(')');
            }
        }

        private void symbol(String s) {
            if (SAFE_SYMBOL.matcher(s).matches() && !RESERVED.contains(s)) sb.append(s);
            else sb.append('"').append(s.replace("\\", "\\\\").replace("\"", "\\\"")).append('"');
        }

        private String fresh(String base) {
            var name = base;
            var i = 1;
            while (scope.contains(name) || freeNames.contains(name) || !Term.IDENTIFIER.matcher(name).matches())
                name = "x" + i++;
            return name;
        }
    }
}
