package dumb.cogproof;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Immutable TDFOL formula tree. Equality is alpha-equivalence: quantifiers ignore their display
 * name and bound variables compare by de Bruijn index.
 */
public abstract sealed class Formula permits Formula.Pred, Formula.Not, Formula.Bin, Formula.Quant, Formula.Modal,
        Formula.Temporal, Formula.Deontic, Formula.Cognitive, Formula.Meta {

    public static final Term.Const ANYONE = Term.Const.of("anyone");
    public static final Term.Const EVERYONE = Term.Const.of("everyone");

    private volatile String textCache;
    private volatile CanonicalForm canonCache;
    private volatile ContentHash hashCache;
    private volatile int hashCodeCache;
    private volatile boolean hashCodeCalculated;
    private volatile int weightCache = -1;

    /** Operator or symbol of this node, excluding display-only data. */
    public abstract Object label();

    public List<Formula> children() {
        return List.of();
    }

    /** Terms held directly by this node: predicate arguments, agents. */
    public List<Term> terms() {
        return List.of();
    }

    protected abstract Formula rebuild(List<Term> terms, List<Formula> children);

    public final String text() {
        var t = textCache;
        if (t == null) textCache = t = Printer.print(this);
        return t;
    }

    public final CanonicalForm canonical() {
        var c = canonCache;
        if (c == null) {
            c = Canon.build(this);
            canonCache = c;
            c.formula().canonCache = c;
        }
        return c;
    }

    public final ContentHash hash() {
        var h = hashCache;
        if (h == null) hashCache = h = ContentHash.of(canonical().text());
        return h;
    }

    public int weight() {
        if (weightCache == -1)
            weightCache = 1 + terms().stream().mapToInt(Term::weight).sum() + children().stream().mapToInt(Formula::weight).sum();
        return weightCache;
    }

    public int depth() {
        return 1 + children().stream().mapToInt(Formula::depth).max().orElse(0);
    }

    /** Pre-order traversal including this node. */
    public Stream<Formula> subformulas() {
        return Stream.concat(Stream.of(this), children().stream().flatMap(Formula::subformulas));
    }

    public Stream<Term> allTerms() {
        return subformulas().flatMap(f -> f.terms().stream()).flatMap(Term::subterms);
    }

    public Set<Term.Var> freeVars() {
        return allTerms().filter(t -> t instanceof Term.Var v && v.isFree()).map(Term.Var.class::cast).collect(Collectors.toUnmodifiableSet());
    }

    /** Variable-free terms in first-occurrence order, including nested arguments. */
    public List<Term> groundTerms() {
        return allTerms().filter(Term::ground).distinct().toList();
    }

    public boolean hasMeta() {
        return subformulas().anyMatch(Meta.class::isInstance);
    }

    /** True when some bound variable refers past the given number of enclosing binders. */
    public boolean loose(int depth) {
        var kidDepth = this instanceof Quant ? depth + 1 : depth;
        return terms().stream().anyMatch(t -> t.loose(depth)) || children().stream().anyMatch(c -> c.loose(kidDepth));
    }

    public final Formula mapTerms(TermMapper m) {
        return mapTerms(m, 0);
    }

    private Formula mapTerms(TermMapper m, int depth) {
        var kidDepth = this instanceof Quant ? depth + 1 : depth;
        var changed = false;
        var ts = terms();
        var newTerms = new ArrayList<Term>(ts.size());
        for (var t : ts) {
            var u = m.apply(t, depth);
            changed |= u != t;
            newTerms.add(u);
        }
        var cs = children();
        var newKids = new ArrayList<Formula>(cs.size());
        for (var c : cs) {
            var u = c.mapTerms(m, kidDepth);
            changed |= u != c;
            newKids.add(u);
        }
        return changed ? rebuild(newTerms, newKids) : this;
    }

    /** This node with its terms and children replaced, keeping operator and symbol. */
    public final Formula with(List<Term> terms, List<Formula> children) {
        return rebuild(terms, children);
    }

    /** Moves the formula under {@code by} additional binders by raising its loose indices. */
    public final Formula shift(int by) {
        if (by == 0) return this;
        return mapTerms((t, depth) -> Term.replaceVars(t, v -> !v.isFree() && v.index() >= depth ? Term.Var.bound(v.name(), v.index() + by) : v));
    }

    /** Top-down replacement; the function returns null to descend into a node unchanged. */
    public final Formula replace(Function<Formula, @Nullable Formula> f) {
        var r = f.apply(this);
        if (r != null) return r;
        var cs = children();
        if (cs.isEmpty()) return this;
        var changed = false;
        var newKids = new ArrayList<Formula>(cs.size());
        for (var c : cs) {
            var u = c.replace(f);
            changed |= u != c;
            newKids.add(u);
        }
        return changed ? rebuild(terms(), newKids) : this;
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Formula that) || getClass() != o.getClass()) return false;
        return hashCode() == that.hashCode() && label().equals(that.label()) && terms().equals(that.terms()) && children().equals(that.children());
    }

    @Override
    public final int hashCode() {
        if (!hashCodeCalculated) {
            hashCodeCache = Objects.hash(getClass().getSimpleName(), label(), terms(), children());
            hashCodeCalculated = true;
        }
        return hashCodeCache;
    }

    @Override
    public String toString() {
        return text();
    }

    @FunctionalInterface
    public interface TermMapper {
        Term apply(Term t, int depth);
    }

    public static Pred pred(String symbol, Term... args) {
        return new Pred(symbol, List.of(args));
    }

    public static Not not(Formula f) {
        return new Not(f);
    }

    public static Bin and(Formula l, Formula r) {
        return new Bin(Connective.AND, l, r);
    }

    public static Bin or(Formula l, Formula r) {
        return new Bin(Connective.OR, l, r);
    }

    public static Bin implies(Formula l, Formula r) {
        return new Bin(Connective.IMPLIES, l, r);
    }

    public static Bin iff(Formula l, Formula r) {
        return new Bin(Connective.IFF, l, r);
    }

    /** Right-nested chain of the given connective. */
    public static Formula chain(Connective op, List<Formula> operands) {
        if (operands.isEmpty()) throw new IllegalArgumentException("Empty " + op + " chain");
        var f = operands.get(operands.size() - 1);
        for (var i = operands.size() - 2; i >= 0; i--) f = new Bin(op, operands.get(i), f);
        return f;
    }

    /** Binds the free variable {@code var} in {@code body} under a new quantifier. */
    public static Quant quant(Quantifier kind, String var, Formula body) {
        return new Quant(kind, var, body.mapTerms((t, depth) -> Term.replaceVars(t,
                v -> v.isFree() && v.name().equals(var) ? Term.Var.bound(var, depth) : v)));
    }

    public static Quant forall(String var, Formula body) {
        return quant(Quantifier.FORALL, var, body);
    }

    public static Quant exists(String var, Formula body) {
        return quant(Quantifier.EXISTS, var, body);
    }

    public static Temporal always(Formula f) {
        return new Temporal(TemporalOp.ALWAYS, f, null);
    }

    public static Temporal eventually(Formula f) {
        return new Temporal(TemporalOp.EVENTUALLY, f, null);
    }

    public static Temporal next(Formula f) {
        return new Temporal(TemporalOp.NEXT, f, null);
    }

    public static Temporal until(Formula f, Formula g) {
        return new Temporal(TemporalOp.UNTIL, f, g);
    }

    public static Temporal since(Formula f, Formula g) {
        return new Temporal(TemporalOp.SINCE, f, g);
    }

    public static Modal necessary(Formula f) {
        return new Modal(ModalOp.NECESSARY, f);
    }

    public static Modal possible(Formula f) {
        return new Modal(ModalOp.POSSIBLE, f);
    }

    public static Deontic deontic(DeonticOp op, Formula action) {
        return new Deontic(op, defaultAgent(action), action);
    }

    public static Deontic obligatory(Term agent, Formula action) {
        return new Deontic(DeonticOp.OBLIGATORY, agent, action);
    }

    public static Deontic permitted(Term agent, Formula action) {
        return new Deontic(DeonticOp.PERMITTED, agent, action);
    }

    public static Deontic forbidden(Term agent, Formula action) {
        return new Deontic(DeonticOp.FORBIDDEN, agent, action);
    }

    public static Cognitive cognitive(CognitiveOp op, Term agent, Formula body) {
        return new Cognitive(op, op == CognitiveOp.COMMON_KNOWLEDGE ? EVERYONE : agent, body);
    }

    public static Meta meta(String name) {
        return new Meta(name);
    }

    /** Agent implied by an action when none is written: the first argument of an atomic action. */
    public static Term defaultAgent(Formula action) {
        if (action instanceof Pred p && !p.args.isEmpty() && !Pred.COMPARISONS.contains(p.symbol)) {
            var first = p.args.get(0);
            if (first instanceof Term.Const c && !c.numeric() || first instanceof Term.Var) return first;
        }
        return ANYONE;
    }

    public enum Connective {
        AND("&", 4), OR("|", 3), IMPLIES("->", 2), IFF("<->", 1);

        public final String symbol;
        public final int precedence;

        Connective(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }
    }

    public enum Quantifier {
        FORALL("forall"), EXISTS("exists");

        public final String keyword;

        Quantifier(String keyword) {
            this.keyword = keyword;
        }
    }

    public enum ModalOp {
        NECESSARY("Necessary"), POSSIBLE("Possible");

        public final String keyword;

        ModalOp(String keyword) {
            this.keyword = keyword;
        }
    }

    public enum TemporalOp {
        ALWAYS("Always", 1), EVENTUALLY("Eventually", 1), NEXT("Next", 1), UNTIL("Until", 2), SINCE("Since", 2);

        public final String keyword;
        public final int arity;

        TemporalOp(String keyword, int arity) {
            this.keyword = keyword;
            this.arity = arity;
        }
    }

    public enum DeonticOp {
        OBLIGATORY("Obligatory"), PERMITTED("Permitted"), FORBIDDEN("Forbidden");

        public final String keyword;

        DeonticOp(String keyword) {
            this.keyword = keyword;
        }
    }

    public enum CognitiveOp {
        BELIEVES("Believes"), KNOWS("Knows"), INTENDS("Intends"), DESIRES("Desires"),
        PERCEIVES("Perceives"), SAYS("Says"), COMMON_KNOWLEDGE("CommonKnowledge");

        public final String keyword;

        CognitiveOp(String keyword) {
            this.keyword = keyword;
        }
    }

    public static final class Pred extends Formula {
        public static final Set<String> COMPARISONS = Set.of("=", "<", ">", "<=", ">=");

        public final String symbol;
        public final List<Term> args;

        public Pred(String symbol, List<Term> args) {
            this.symbol = requireNonNull(symbol);
            this.args = List.copyOf(args);
        }

        public int arity() {
            return args.size();
        }

        public boolean comparison() {
            return args.size() == 2 && COMPARISONS.contains(symbol);
        }

        @Override
        public Object label() {
            return symbol;
        }

        @Override
        public List<Term> terms() {
            return args;
        }

        @Override
        protected Formula rebuild(List<Term> terms, List<Formula> children) {
            return new Pred(symbol, terms);
        }
    }

    public static final class Not extends Formula {
        public final Formula body;

        public Not(Formula body) {
            this.body = requireNonNull(body);
        }

        @Override
        public Object label() {
            return "not";
        }

        @Override
        public List<Formula> children() {
            return List.of(body);
        }

        @Override
        protected Formula rebuild(List<Term> terms, List<Formula> children) {
            return new Not(children.get(0));
        }
    }

    public static final class Bin extends Formula {
        public final Connective op;
        public final Formula left, right;

        public Bin(Connective op, Formula left, Formula right) {
            this.op = requireNonNull(op);
            this.left = requireNonNull(left);
            this.right = requireNonNull(right);
        }

        @Override
        public Object label() {
            return op;
        }

        @Override
        public List<Formula> children() {
            return List.of(left, right);
        }

        @Override
        protected Formula rebuild(List<Term> terms, List<Formula> children) {
            return new Bin(op, children.get(0), children.get(1));
        }

        /** Operands of the maximal same-connective chain rooted here. */
        public List<Formula> flatten() {
            var out = new ArrayList<Formula>();
            flatten(this, op, out);
            return out;
        }

        private static void flatten(Formula f, Connective op, List<Formula> out) {
            if (f instanceof Bin b && b.op == op) {
                flatten(b.left, op, out);
                flatten(b.right, op, out);
            } else out.add(f);
        }
    }

    public static final class Quant extends Formula {
        public final Quantifier kind;
        public final String var;
        public final Formula body;

        public Quant(Quantifier kind, String var, Formula body) {
            this.kind = requireNonNull(kind);
            this.var = requireNonNull(var);
            this.body = requireNonNull(body);
        }

        /** Opens the binder, substituting {@code t} (a term closed under binders) for the bound variable. */
        public Formula instantiate(Term t) {
            return body.mapTerms((term, depth) -> Term.replaceVars(term, v -> {
                if (v.isFree() || v.index() < depth) return v;
                if (v.index() == depth) return Term.shift(t, depth);
                return Term.Var.bound(v.name(), v.index() - 1);
            }));
        }

        @Override
        public Object label() {
            return kind;
        }

        @Override
        public List<Formula> children() {
            return List.of(body);
        }

        @Override
        protected Formula rebuild(List<Term> terms, List<Formula> children) {
            return new Quant(kind, var, children.get(0));
        }
    }

    public static final class Modal extends Formula {
        public final ModalOp op;
        public final Formula body;

        public Modal(ModalOp op, Formula body) {
            this.op = requireNonNull(op);
            this.body = requireNonNull(body);
        }

        @Override
        public Object label() {
            return op;
        }

        @Override
        public List<Formula> children() {
            return List.of(body);
        }

        @Override
        protected Formula rebuild(List<Term> terms, List<Formula> children) {
            return new Modal(op, children.get(0));
        }
    }

    public static final class Temporal extends Formula {
        public final TemporalOp op;
        public final Formula body;
        public final @Nullable Formula body2;

        public Temporal(TemporalOp op, Formula body, @Nullable Formula body2) {
            this.op = requireNonNull(op);
            this.body = requireNonNull(body);
            if ((op.arity == 2) != (body2 != null))
                throw new IllegalArgumentException(op.keyword + " takes " + op.arity + " operand(s)");
            this.body2 = body2;
        }

        @Override
        public Object label() {
            return op;
        }

        @Override
        public List<Formula> children() {
            return body2 == null ? List.of(body) : List.of(body, body2);
        }

        @Override
        protected Formula rebuild(List<Term> terms, List<Formula> children) {
            return new Temporal(op, children.get(0), children.size() > 1 ? children.get(1) : null);
        }
    }

    public static final class Deontic extends Formula {
        public final DeonticOp op;
        public final Term agent;
        public final Formula action;

        public Deontic(DeonticOp op, Term agent, Formula action) {
            this.op = requireNonNull(op);
            this.agent = requireNonNull(agent);
            this.action = requireNonNull(action);
        }

        @Override
        public Object label() {
            return op;
        }

        @Override
        public List<Term> terms() {
            return List.of(agent);
        }

        @Override
        public List<Formula> children() {
            return List.of(action);
        }

        @Override
        protected Formula rebuild(List<Term> terms, List<Formula> children) {
            return new Deontic(op, terms.get(0), children.get(0));
        }
    }

    public static final class Cognitive extends Formula {
        public final CognitiveOp op;
        public final Term agent;
        public final Formula body;

        public Cognitive(CognitiveOp op, Term agent, Formula body) {
            this.op = requireNonNull(op);
            this.agent = requireNonNull(agent);
            this.body = requireNonNull(body);
        }

        @Override
        public Object label() {
            return op;
        }

        @Override
        public List<Term> terms() {
            return List.of(agent);
        }

        @Override
        public List<Formula> children() {
            return List.of(body);
        }

        @Override
        protected Formula rebuild(List<Term> terms, List<Formula> children) {
            return new Cognitive(op, terms.get(0), children.get(0));
        }
    }

    /** Formula metavariable; appears only in rule patterns. */
    public static final class Meta extends Formula {
        public final String name;

        public Meta(String name) {
            this.name = requireNonNull(name);
        }

        @Override
        public Object label() {
            return name;
        }

        @Override
        protected Formula rebuild(List<Term> terms, List<Formula> children) {
            return this;
        }
    }

    /** Renders formulas in the native TDFOL surface syntax. */
    static final class Printer {
        static final Set<String> RESERVED = Set.copyOf(Stream.of(
                        Stream.of("forall", "exists"),
                        Arrays.stream(ModalOp.values()).map(o -> o.keyword),
                        Arrays.stream(TemporalOp.values()).map(o -> o.keyword),
                        Arrays.stream(DeonticOp.values()).map(o -> o.keyword),
                        Arrays.stream(CognitiveOp.values()).map(o -> o.keyword))
                .flatMap(s -> s).toList());

        private final StringBuilder sb = new StringBuilder();
        private final List<String> scope = new ArrayList<>();

        static String print(Formula f) {
            var p = new Printer();
            p.formula(f, 0);
            return p.sb.toString();
        }

        static String print(Term t) {
            var p = new Printer();
            p.term(t);
            return p.sb.toString();
        }

        private void formula(Formula f, int prec) {
            if (f instanceof Pred p) pred(p);
            else if (f instanceof Not n) {
                var paren = prec > 5;
                if (paren) sb.append('(');
                sb.append('~');
                formula(n.body, 5);
                if (paren) sb.append(')');
            } else if (f instanceof Bin b) {
                var p = b.op.precedence;
                var paren = prec > p;
                if (paren) sb.append('(');
                formula(b.left, b.op == Connective.AND || b.op == Connective.OR ? p : p + 1);
                sb.append(' ').append(b.op.symbol).append(' ');
                formula(b.right, b.op == Connective.IMPLIES ? p : p + 1);
                if (paren) sb.append(')');
            } else if (f instanceof Quant q) {
                var paren = prec > 0;
                if (paren) sb.append('(');
                var name = freshName(q);
                sb.append(q.kind.keyword).append(' ').append(name).append(". ");
                scope.add(name);
                formula(q.body, 0);
                scope.remove(scope.size() - 1);
                if (paren) sb.append(')');
            } else if (f instanceof Modal m) {
                sb.append(m.op.keyword);
                args(m.body, null);
            } else if (f instanceof Temporal t) {
                sb.append(t.op.keyword);
                args(t.body, t.body2);
            } else if (f instanceof Deontic d) {
                sb.append(d.op.keyword);
                if (!d.agent.equals(defaultAgent(d.action))) agent(d.agent);
                args(d.action, null);
            } else if (f instanceof Cognitive c) {
                sb.append(c.op.keyword);
                if (c.op != CognitiveOp.COMMON_KNOWLEDGE) agent(c.agent);
                args(c.body, null);
            } else if (f instanceof Meta m) sb.append(m.name);
        }

        private void agent(Term t) {
            sb.append('[');
            term(t);
            sb.append(']');
        }

        private void args(Formula a, @Nullable Formula b) {
            sb.append('(');
            formula(a, 0);
            if (b != null) {
                sb.append(", ");
                formula(b, 0);
            }
            sb.append(')');
        }

        private void pred(Pred p) {
            if (p.comparison()) {
                term(p.args.get(0));
                sb.append(' ').append(p.symbol).append(' ');
                term(p.args.get(1));
                return;
            }
            symbol(p.symbol);
            if (!p.args.isEmpty()) termList(p.args);
        }

        private void termList(List<Term> ts) {
            sb.append('(');
            for (var i = 0; i < ts.size(); i++) {
                if (i > 0) sb.append(", ");
                term(ts.get(i));
            }
            sb.append(')');
        }

        private void term(Term t) {
            if (t instanceof Term.Var v) {
                if (v.isFree()) sb.append('?').append(v.name());
                else if (v.index() < scope.size()) sb.append(scope.get(scope.size() - 1 - v.index()));
                else sb.append(v.name());
            } else if (t instanceof Term.Const c) {
                if (c.numeric() || c.identifier()) sb.append(c.name());
                else quoted(c.name());
            } else if (t instanceof Term.Fn fn) {
                if (fn.arithmetic()) {
                    sb.append('(');
                    term(fn.args().get(0));
                    sb.append(' ').append(fn.symbol()).append(' ');
                    term(fn.args().get(1));
                    sb.append(')');
                } else {
                    symbol(fn.symbol());
                    termList(fn.args());
                }
            }
        }

        private void symbol(String s) {
            if (Term.IDENTIFIER.matcher(s).matches()) sb.append(s);
            else quoted(s);
        }

        private void quoted(String s) {
            sb.append('"').append(s.replace("\\", "\\\\").replace("\"", "\\\"")).append('"');
        }

        private String freshName(Quant q) {
            var constants = q.body.allTerms().filter(Term.Const.class::isInstance).map(t -> ((Term.Const) t).name()).collect(Collectors.toSet());
            var base = q.var;
            var name = base;
            var i = 1;
            while (scope.contains(name) || constants.contains(name) || RESERVED.contains(name) || !Term.IDENTIFIER.matcher(name).matches())
                name = (Term.IDENTIFIER.matcher(base).matches() ? base : "v") + i++;
            return name;
        }
    }
}
