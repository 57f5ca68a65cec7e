package dumb.cogproof.syntax;

import dumb.cogproof.Formula;
import dumb.cogproof.Signature;
import dumb.cogproof.Span;
import dumb.cogproof.Term;
import dumb.cogproof.TranslationException;
import dumb.cogproof.ValidationException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Proposition syntax of the interactive provers: Lean 4 ({@code ∀ x, P x → Q x}) and Coq
 * ({@code forall x, P x -> Q x}). Modal, temporal, deontic and cognitive operators are written as
 * applications of reserved heads such as {@code Obligatory agent1 (pay agent1 100)}, which the
 * generated preamble declares as opaque constants.
 */
public class InteractiveSyntax implements SurfaceSyntax {

    private static final Map<String, Object> HEADS = new HashMap<>();

    static {
        for (var o : Formula.TemporalOp.values()) HEADS.put(o.keyword, o);
        for (var o : Formula.ModalOp.values()) HEADS.put(o.keyword, o);
        for (var o : Formula.DeonticOp.values()) HEADS.put(o.keyword, o);
        for (var o : Formula.CognitiveOp.values()) HEADS.put(o.keyword, o);
    }

    private final Dialect dialect;

    public InteractiveSyntax(Dialect dialect) {
        this.dialect = dialect;
    }

    public Dialect dialect() {
        return dialect;
    }

    public static Set<String> reservedHeads() {
        return HEADS.keySet();
    }

    @Override
    public Syntax syntax() {
        return dialect == Dialect.LEAN ? Syntax.LEAN : Syntax.COQ;
    }

    @Override
    public Formula parse(String text) throws ValidationException {
        return new Parser(text, dialect).parseAll();
    }

    @Override
    public String serialize(Formula f) throws TranslationException {
        var w = new Writer(dialect, f);
        w.formula(f, 0);
        return w.sb.toString();
    }

    /**
     * A self-contained theory file: declarations for every symbol and operator head, then the goal as
     * a theorem whose hypotheses are the axioms. Free variables are closed universally.
     */
    public String problem(Formula goal, List<Formula> axioms) throws TranslationException {
        var closedAxioms = new ArrayList<Formula>(axioms.size());
        for (var a : axioms) closedAxioms.add(close(a));
        var closedGoal = close(goal);
        var all = new ArrayList<Formula>(closedAxioms);
        all.add(closedGoal);
        var sorts = SortInference.of(all);
        var names = new Writer(dialect, Formula.chain(Formula.Connective.AND, all));
        var individual = sorts.constants().contains("U") ? "U0" : "U";
        var lean = dialect == Dialect.LEAN;
        var arrow = lean ? " → " : " -> ";
        var integer = lean ? "Int" : "Z";

        var sb = new StringBuilder();
        if (lean) sb.append("set_option autoImplicit false\n");
        else sb.append("Require Import ZArith Lia.\nOpen Scope Z_scope.\n");
        declare(sb, individual, "Type");
        for (var c : sorts.constants())
            declare(sb, names.name(c), sorts.constant(c) == SortInference.Sort.INT ? integer : individual);
        for (var e : sorts.functions().entrySet()) {
            var type = new StringBuilder();
            for (var i = 0; i < e.getValue(); i++)
                type.append(sorts.functionArg(e.getKey(), e.getValue(), i) == SortInference.Sort.INT ? integer : individual).append(arrow);
            type.append(sorts.functionResult(e.getKey(), e.getValue()) == SortInference.Sort.INT ? integer : individual);
            declare(sb, names.name(e.getKey()), type.toString());
        }
        for (var e : sorts.predicates().entrySet()) {
            var type = new StringBuilder();
            for (var i = 0; i < e.getValue(); i++)
                type.append(sorts.predicateArg(e.getKey(), e.getValue(), i) == SortInference.Sort.INT ? integer : individual).append(arrow);
            declare(sb, names.name(e.getKey()), type.append("Prop").toString());
        }
        var heads = new LinkedHashMap<String, String>();
        all.forEach(f -> f.subformulas().forEach(g -> {
            if (g instanceof Formula.Modal m) heads.putIfAbsent(m.op.keyword, "Prop" + arrow + "Prop");
            else if (g instanceof Formula.Temporal t)
                heads.putIfAbsent(t.op.keyword, t.op.arity == 2 ? "Prop" + arrow + "Prop" + arrow + "Prop" : "Prop" + arrow + "Prop");
            else if (g instanceof Formula.Deontic d) heads.putIfAbsent(d.op.keyword, individual + arrow + "Prop" + arrow + "Prop");
            else if (g instanceof Formula.Cognitive c)
                heads.putIfAbsent(c.op.keyword, c.op == Formula.CognitiveOp.COMMON_KNOWLEDGE ? "Prop" + arrow + "Prop" : individual + arrow + "Prop" + arrow + "Prop");
        }));
        for (var e : heads.entrySet()) declare(sb, e.getKey(), e.getValue());

        if (lean) {
            sb.append("theorem goal_holds");
            for (var i = 0; i < closedAxioms.size(); i++)
                sb.append(" (h").append(i + 1).append(" : ").append(serialize(closedAxioms.get(i))).append(')');
            sb.append(" : ").append(serialize(closedGoal)).append(" := by\n");
            sb.append("  first | assumption | omega | simp_all | (intros; simp_all)\n");
        } else {
            sb.append("Theorem goal_holds : ");
            for (var a : closedAxioms) sb.append('(').append(serialize(a)).append(") -> ");
            sb.append('(').append(serialize(closedGoal)).append(").\n");
            sb.append("Proof.\n  intros; first [ assumption | lia | firstorder ].\nQed.\n");
        }
        return sb.toString();
    }

    private void declare(StringBuilder sb, String name, String type) {
        if (dialect == Dialect.LEAN) sb.append("axiom ").append(name).append(" : ").append(type).append('\n');
        else sb.append("Parameter ").append(name).append(" : ").append(type).append(".\n");
    }

    private static Formula close(Formula f) {
        var vars = f.freeVars().stream().map(Term.Var::name).sorted().toList();
        for (var i = vars.size() - 1; i >= 0; i--) f = Formula.forall(vars.get(i), f);
        return f;
    }

    public enum Dialect {
        LEAN("∀", "∃", "¬", "∧", "∨", "→", "↔", "≠", "≤", "≥",
                Set.of("fun", "Type", "Prop", "theorem", "have", "show", "from", "at", "by", "do", "then", "else", "if",
                        "match", "with", "let", "in", "end", "def", "axiom", "variable", "open", "True", "False")),
        COQ("forall", "exists", "~", "/\\", "\\/", "->", "<->", "<>", "<=", ">=",
                Set.of("forall", "exists", "fun", "Type", "Prop", "Set", "match", "with", "end", "let", "in", "if", "then",
                        "else", "as", "return", "Theorem", "Proof", "Qed", "at", "Parameter", "True", "False"));

        final String forall, exists, not, and, or, implies, iff, neq, le, ge;
        final Set<String> reserved;

        Dialect(String forall, String exists, String not, String and, String or, String implies, String iff,
                String neq, String le, String ge, Set<String> reserved) {
            this.forall = forall;
            this.exists = exists;
            this.not = not;
            this.and = and;
            this.or = or;
            this.implies = implies;
            this.iff = iff;
            this.neq = neq;
            this.le = le;
            this.ge = ge;
            this.reserved = reserved;
        }

        String relation(String symbol) {
            return switch (symbol) {
                case "<=" -> le;
                case ">=" -> ge;
                default -> symbol;
            };
        }
    }

    private static final class Writer {
        final StringBuilder sb = new StringBuilder();
        private final Dialect d;
        private final List<String> scope = new ArrayList<>();
        private final Set<String> constants;

        Writer(Dialect d, Formula root) {
            this.d = d;
            this.constants = root.allTerms().filter(Term.Const.class::isInstance).map(t -> ((Term.Const) t).name()).collect(Collectors.toSet());
        }

        void formula(Formula f, int prec) throws TranslationException {
            if (f instanceof Formula.Pred p) pred(p);
            else if (f instanceof Formula.Not n) {
                if (n.body instanceof Formula.Pred p && p.symbol.equals("=") && p.arity() == 2) {
                    wrap(prec > 6, () -> relation(p.args.get(0), d.neq, p.args.get(1)));
                    return;
                }
                sb.append(d.not).append(d == Dialect.COQ ? " " : "");
                formula(n.body, 7);
            } else if (f instanceof Formula.Bin b) {
                var p = b.op.precedence;
                var paren = prec > p;
                if (paren) sb.append('(');
                formula(b.left, p + 1);
                sb.append(' ').append(switch (b.op) {
                    case AND -> d.and;
                    case OR -> d.or;
                    case IMPLIES -> d.implies;
                    case IFF -> d.iff;
                }).append(' ');
                formula(b.right, b.op == Formula.Connective.IFF ? p + 1 : p);
                if (paren) sb.append(')');
            } else if (f instanceof Formula.Quant q) {
                var paren = prec > 0;
                if (paren) sb.append('(');
                var name = fresh(q.var);
                sb.append(q.kind == Formula.Quantifier.FORALL ? d.forall : d.exists).append(' ').append(name).append(", ");
                scope.add(name);
                formula(q.body, 0);
                scope.remove(scope.size() - 1);
                if (paren) sb.append(')');
            } else if (f instanceof Formula.Modal m) {
                head(m.op.keyword, null, m.body, null, prec);
            } else if (f instanceof Formula.Temporal t) {
                head(t.op.keyword, null, t.body, t.body2, prec);
            } else if (f instanceof Formula.Deontic o) {
                head(o.op.keyword, o.agent, o.action, null, prec);
            } else if (f instanceof Formula.Cognitive c) {
                head(c.op.keyword, c.op == Formula.CognitiveOp.COMMON_KNOWLEDGE ? null : c.agent, c.body, null, prec);
            } else throw new TranslationException("rule metavariables have no " + d.name().toLowerCase() + " form", "meta");
        }

        private void head(String op, Term agent, Formula a, Formula b, int prec) throws TranslationException {
            var paren = prec > 8;
            if (paren) sb.append('(');
            sb.append(op);
            if (agent != null) {
                sb.append(' ');
                atomicTerm(agent);
            }
            sb.append(" (");
            formula(a, 0);
            sb.append(')');
            if (b != null) {
                sb.append(" (");
                formula(b, 0);
                sb.append(')');
            }
            if (paren) sb.append(')');
        }

        private void pred(Formula.Pred p) throws TranslationException {
            if (p.comparison()) {
                relation(p.args.get(0), d.relation(p.symbol), p.args.get(1));
                return;
            }
            if (HEADS.containsKey(p.symbol))
                throw new TranslationException("predicate '" + p.symbol + "' collides with a reserved head", p.symbol);
            sb.append(name(p.symbol));
            for (var a : p.args) {
                sb.append(' ');
                atomicTerm(a);
            }
        }

        private void relation(Term l, String op, Term r) throws TranslationException {
            term(l);
            sb.append(' ').append(op).append(' ');
            term(r);
        }

        private void wrap(boolean paren, Body body) throws TranslationException {
            if (paren) sb.append('(');
            body.run();
            if (paren) sb.append(')');
        }

        private void term(Term t) throws TranslationException {
            if (t instanceof Term.Fn fn && fn.arithmetic()) {
                atomicTerm(fn.args().get(0));
                sb.append(' ').append(fn.symbol()).append(' ');
                atomicTerm(fn.args().get(1));
            } else if (t instanceof Term.Fn fn) {
                sb.append(name(fn.symbol()));
                for (var a : fn.args()) {
                    sb.append(' ');
                    atomicTerm(a);
                }
            } else atomicTerm(t);
        }

        private void atomicTerm(Term t) throws TranslationException {
            if (t instanceof Term.Var v) {
                if (v.isFree()) sb.append('?').append(v.name());
                else sb.append(v.index() < scope.size() ? scope.get(scope.size() - 1 - v.index()) : v.name());
            } else if (t instanceof Term.Const c) {
                if (c.numeric()) sb.append(c.name().startsWith("-") ? "(" + c.name() + ")" : c.name());
                else sb.append(name(c.name()));
            } else {
                sb.append('(');
                term(t);
                sb.append(')');
            }
        }

        private String name(String s) throws TranslationException {
            if (Term.IDENTIFIER.matcher(s).matches() && !d.reserved.contains(s)) return s;
            if (d == Dialect.LEAN && s.indexOf('»') < 0) return "«" + s + "»";
            throw new TranslationException("'" + s + "' is not a valid " + d.name().toLowerCase() + " identifier", s);
        }

        private String fresh(String base) {
            var name = Term.IDENTIFIER.matcher(base).matches() ? base : "x";
            var root = name;
            var i = 1;
            while (scope.contains(name) || constants.contains(name) || d.reserved.contains(name) || HEADS.containsKey(name))
                name = root + i++;
            return name;
        }

        @FunctionalInterface
        private interface Body {
            void run() throws TranslationException;
        }
    }

    private static final class Parser {
        private static final List<String> SYMBOLS = List.of(
                "<->", "/\\", "\\/", "->", "<>", "<=", ">=", "∀", "∃", "¬", "∧", "∨", "→", "↔", "≠", "≤", "≥",
                "~", "(", ")", ",", "=", "<", ">", "+", "-", "*", "/");
        private static final Set<String> RELATIONS = Set.of("=", "<", ">", "<=", ">=", "≤", "≥", "≠", "<>");

        private final String src;
        private final Dialect d;
        private final List<Tok> toks = new ArrayList<>();
        private final Signature signature = new Signature();
        private final List<String> scope = new ArrayList<>();
        private final Set<String> bound = new HashSet<>();
        private final List<Tok> constUses = new ArrayList<>();
        private int pos;

        Parser(String src, Dialect d) throws ValidationException {
            this.src = src;
            this.d = d;
            lex();
        }

        Formula parseAll() throws ValidationException {
            var f = formula();
            if (peek().kind != Kind.EOF) throw error("unexpected '" + peek().text + "'", peek());
            for (var c : constUses)
                if (bound.contains(c.text))
                    throw error("variable '" + c.text + "' is used outside the scope of the quantifier that binds it", c);
            return f;
        }

        private Formula formula() throws ValidationException {
            if (atQuantifier()) return quantifier();
            var l = implication();
            if (acceptSym("↔") || acceptSym("<->")) return Formula.iff(l, implication());
            return l;
        }

        private Formula implication() throws ValidationException {
            var l = disjunction();
            if (acceptSym("→") || acceptSym("->")) return Formula.implies(l, implicationOrQuant());
            return l;
        }

        private Formula implicationOrQuant() throws ValidationException {
            return atQuantifier() ? quantifier() : implication();
        }

        private Formula disjunction() throws ValidationException {
            var l = conjunction();
            if (acceptSym("∨") || acceptSym("\\/")) return Formula.or(l, atQuantifier() ? quantifier() : disjunction());
            return l;
        }

        private Formula conjunction() throws ValidationException {
            var l = unary();
            if (acceptSym("∧") || acceptSym("/\\")) return Formula.and(l, atQuantifier() ? quantifier() : conjunction());
            return l;
        }

        private Formula unary() throws ValidationException {
            if (acceptSym("¬") || acceptSym("~")) return Formula.not(unary());
            if (atQuantifier()) return quantifier();
            return primary();
        }

        private boolean atQuantifier() {
            var t = peek();
            return t.is("∀") || t.is("∃") || t.kind == Kind.IDENT && (t.text.equals("forall") || t.text.equals("exists"));
        }

        private Formula quantifier() throws ValidationException {
            var t = next();
            var kind = t.is("∀") || t.text.equals("forall") ? Formula.Quantifier.FORALL : Formula.Quantifier.EXISTS;
            var names = new ArrayList<String>();
            while (peek().kind == Kind.IDENT) names.add(next().text);
            if (names.isEmpty()) throw error("expected a bound variable", peek());
            if (!acceptSym(",")) throw error("expected ',' after bound variables", peek());
            scope.addAll(names);
            bound.addAll(names);
            var body = formula();
            for (var i = names.size() - 1; i >= 0; i--) {
                scope.remove(scope.size() - 1);
                body = new Formula.Quant(kind, names.get(i), body);
            }
            return body;
        }

        private Formula primary() throws ValidationException {
            var t = peek();
            if (t.kind == Kind.IDENT && HEADS.containsKey(t.text)) return head();
            if (t.is("(")) {
                var mark = pos;
                var uses = constUses.size();
                var depth = scope.size();
                try {
                    next();
                    var f = formula();
                    expectSym(")");
                    if (!(peek().kind == Kind.SYM && (RELATIONS.contains(peek().text) || "+-*/".contains(peek().text))))
                        return f;
                } catch (ValidationException e) {
                    pos = mark;
                    while (constUses.size() > uses) constUses.remove(constUses.size() - 1);
                    while (scope.size() > depth) scope.remove(scope.size() - 1);
                    try {
                        return comparisonOrAtom();
                    } catch (ValidationException e2) {
                        throw e.span().start() >= e2.span().start() ? e : e2;
                    }
                }
                pos = mark;
                while (constUses.size() > uses) constUses.remove(constUses.size() - 1);
            }
            return comparisonOrAtom();
        }

        private Formula head() throws ValidationException {
            var t = next();
            var op = HEADS.get(t.text);
            Term agent = null;
            if (op instanceof Formula.DeonticOp || op instanceof Formula.CognitiveOp c && c != Formula.CognitiveOp.COMMON_KNOWLEDGE)
                agent = atomicTerm();
            var a = parenthesized();
            if (op instanceof Formula.TemporalOp top)
                return new Formula.Temporal(top, a, top.arity == 2 ? parenthesized() : null);
            if (op instanceof Formula.ModalOp m) return new Formula.Modal(m, a);
            if (op instanceof Formula.DeonticOp o) return new Formula.Deontic(o, agent, a);
            return Formula.cognitive((Formula.CognitiveOp) op, agent != null ? agent : Formula.EVERYONE, a);
        }

        private Formula parenthesized() throws ValidationException {
            expectSym("(");
            var f = formula();
            expectSym(")");
            return f;
        }

        private Formula comparisonOrAtom() throws ValidationException {
            var start = peek();
            var uses = constUses.size();
            var l = arith();
            var t = peek();
            if (t.kind == Kind.SYM && RELATIONS.contains(t.text)) {
                next();
                var r = arith();
                return switch (t.text) {
                    case "≠", "<>" -> Formula.not(Formula.pred("=", l, r));
                    case "≤" -> Formula.pred("<=", l, r);
                    case "≥" -> Formula.pred(">=", l, r);
                    default -> Formula.pred(t.text, l, r);
                };
            }
            if (l instanceof Term.Fn fn && !fn.arithmetic()) {
                signature.predicate(fn.symbol(), fn.args().size(), span(start));
                return new Formula.Pred(fn.symbol(), fn.args());
            }
            if (l instanceof Term.Const c && !c.numeric() && constUses.size() > uses) {
                constUses.remove(constUses.size() - 1);
                signature.predicate(c.name(), 0, span(start));
                return Formula.pred(c.name());
            }
            throw error("expected a proposition", start);
        }

        private Term arith() throws ValidationException {
            var l = product();
            while (peek().is("+") || peek().is("-")) {
                var op = next().text;
                l = Term.Fn.of(op, l, product());
            }
            return l;
        }

        private Term product() throws ValidationException {
            var l = application();
            while (peek().is("*") || peek().is("/")) {
                var op = next().text;
                l = Term.Fn.of(op, l, application());
            }
            return l;
        }

        private Term application() throws ValidationException {
            var t = peek();
            if (t.kind == Kind.IDENT && !atQuantifier() && !HEADS.containsKey(t.text) && startsAtomicTerm(peek(1))) {
                next();
                var args = new ArrayList<Term>();
                while (startsAtomicTerm(peek())) args.add(atomicTerm());
                signature.function(t.text, args.size(), span(t));
                return new Term.Fn(t.text, args);
            }
            return atomicTerm();
        }

        private boolean startsAtomicTerm(Tok t) {
            return t.kind == Kind.NUMBER || t.kind == Kind.VAR || t.is("(")
                    || t.kind == Kind.IDENT && !HEADS.containsKey(t.text) && !t.text.equals("forall") && !t.text.equals("exists");
        }

        private Term atomicTerm() throws ValidationException {
            var t = next();
            switch (t.kind) {
                case NUMBER:
                    return Term.Const.of(t.text);
                case VAR:
                    return Term.Var.free(t.text);
                case IDENT: {
                    var i = scope.lastIndexOf(t.text);
                    if (i >= 0) return Term.Var.bound(t.text, scope.size() - 1 - i);
                    constUses.add(t);
                    return Term.Const.of(t.text);
                }
                default:
                    if (t.is("(")) {
                        if (peek().is("-") && peek(1).kind == Kind.NUMBER) {
                            next();
                            var n = next();
                            expectSym(")");
                            return Term.Const.of("-" + n.text);
                        }
                        var inner = arith();
                        expectSym(")");
                        return inner;
                    }
                    throw error(t.kind == Kind.EOF ? "expected a term but reached end of input" : "expected a term but found '" + t.text + "'", t);
            }
        }

        private void lex() throws ValidationException {
            var i = 0;
            var n = src.length();
            while (i < n) {
                var c = src.charAt(i);
                if (Character.isWhitespace(c)) {
                    i++;
                    continue;
                }
                var start = i;
                if (c == '«') {
                    var end = src.indexOf('»', i);
                    if (end < 0) throw new ValidationException("unterminated «", Span.at(src, i, n), src.substring(i));
                    toks.add(new Tok(Kind.IDENT, src.substring(i + 1, end), start, end + 1));
                    i = end + 1;
                } else if (Character.isLetter(c) || c == '_') {
                    while (i < n && (Character.isLetterOrDigit(src.charAt(i)) || src.charAt(i) == '_' || src.charAt(i) == '\'')) i++;
                    toks.add(new Tok(Kind.IDENT, src.substring(start, i), start, i));
                } else if (Character.isDigit(c)) {
                    while (i < n && (Character.isDigit(src.charAt(i)) || src.charAt(i) == '.' && i + 1 < n && Character.isDigit(src.charAt(i + 1)))) i++;
                    toks.add(new Tok(Kind.NUMBER, src.substring(start, i), start, i));
                } else if (c == '?') {
                    i++;
                    while (i < n && (Character.isLetterOrDigit(src.charAt(i)) || src.charAt(i) == '_')) i++;
                    if (i == start + 1) throw new ValidationException("'?' must be followed by a name", Span.at(src, start, i), "?");
                    toks.add(new Tok(Kind.VAR, src.substring(start + 1, i), start, i));
                } else {
                    final var at = i;
                    var sym = SYMBOLS.stream().filter(s -> src.startsWith(s, at)).findFirst()
                            .orElseThrow(() -> new ValidationException("unexpected character '" + c + "'", Span.at(src, at, at + 1), String.valueOf(c)));
                    i += sym.length();
                    toks.add(new Tok(Kind.SYM, sym, start, i));
                }
            }
            toks.add(new Tok(Kind.EOF, "", n, n));
        }

        private Tok peek() {
            return toks.get(pos);
        }

        private Tok peek(int ahead) {
            return toks.get(Math.min(pos + ahead, toks.size() - 1));
        }

        private Tok next() {
            var t = toks.get(pos);
            if (t.kind != Kind.EOF) pos++;
            return t;
        }

        private boolean acceptSym(String s) {
            if (!peek().is(s)) return false;
            next();
            return true;
        }

        private void expectSym(String s) throws ValidationException {
            if (!acceptSym(s))
                throw error("expected '" + s + "' but found " + (peek().kind == Kind.EOF ? "end of input" : "'" + peek().text + "'"), peek());
        }

        private Span span(Tok t) {
            return Span.at(src, t.start, t.end);
        }

        private ValidationException error(String message, Tok t) {
            var from = Math.max(0, t.start - 20);
            var to = Math.min(src.length(), t.end + 20);
            return new ValidationException(message, span(t), src.substring(from, to));
        }

        enum Kind {IDENT, NUMBER, VAR, SYM, EOF}

        record Tok(Kind kind, String text, int start, int end) {
            boolean is(String s) {
                return kind == Kind.SYM && text.equals(s);
            }
        }
    }
}
