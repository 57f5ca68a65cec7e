package dumb.cogproof.reason;

import dumb.cogproof.Formula;
import dumb.cogproof.Term;
import dumb.cogproof.ValidationException;
import dumb.cogproof.syntax.TdfolParser;

import java.util.ArrayList;
import java.util.List;

/** First-order rules whose conclusions depend on terms, not only on pattern bindings. */
final class QuantifierRules {

    /** Instantiation candidates tried per universal fact. */
    static final int MAX_INSTANCES = 12;

    private static final String OPEN_PREFIX = "#u";
    private static final String TARGET = "ω";

    private QuantifierRules() {
    }

    static List<InferenceRule> all() {
        return List.of(
                new Custom("universal_instantiation", false, "forall x. φ") {
                    @Override
                    public List<Formula> conclude(Bindings b, List<Formula> matched, RuleContext ctx) {
                        var q = (Formula.Quant) matched.get(0);
                        var out = new ArrayList<Formula>();
                        for (var t : ctx.groundTerms()) {
                            if (out.size() >= MAX_INSTANCES) break;
                            out.add(q.instantiate(t));
                        }
                        return out;
                    }
                },
                new Custom("universal_modus_ponens", false, "forall x. φ", "χ") {
                    @Override
                    public List<Formula> conclude(Bindings b, List<Formula> matched, RuleContext ctx) {
                        var body = open(matched.get(0));
                        if (!(body instanceof Formula.Bin imp) || imp.op != Formula.Connective.IMPLIES) return List.of();
                        var s = Unifier.match(imp.left, matched.get(1), Bindings.EMPTY);
                        return s == null ? List.of() : closed(Unifier.apply(imp.right, s));
                    }
                },
                new Custom("universal_modus_tollens", false, "forall x. φ", "~χ") {
                    @Override
                    public List<Formula> conclude(Bindings b, List<Formula> matched, RuleContext ctx) {
                        var body = open(matched.get(0));
                        if (!(body instanceof Formula.Bin imp) || imp.op != Formula.Connective.IMPLIES) return List.of();
                        var s = Unifier.match(imp.right, ((Formula.Not) matched.get(1)).body, Bindings.EMPTY);
                        return s == null ? List.of() : closed(Formula.not(Unifier.apply(imp.left, s)));
                    }
                },
                new Custom("existential_instantiation", false, "exists x. φ") {
                    @Override
                    public List<Formula> conclude(Bindings b, List<Formula> matched, RuleContext ctx) {
                        return List.of(Skolemizer.skolemize((Formula.Quant) matched.get(0)));
                    }
                },
                new Custom("existential_generalization", true, "χ") {
                    @Override
                    public List<Bindings> seeds(List<Formula> targets) {
                        var out = new ArrayList<Bindings>();
                        for (var t : targets)
                            if (t instanceof Formula.Quant q && q.kind == Formula.Quantifier.EXISTS) out.add(Bindings.EMPTY.with(TARGET, q, 0));
                        return out;
                    }

                    @Override
                    public List<Formula> conclude(Bindings b, List<Formula> matched, RuleContext ctx) {
                        var q = (Formula.Quant) b.formula(TARGET, 0);
                        if (q == null) return List.of();
                        var witness = Term.Var.free(OPEN_PREFIX + 0);
                        var s = Unifier.match(q.instantiate(witness), matched.get(0), Bindings.EMPTY);
                        return s != null && s.term(witness) != null ? List.of(q) : List.of();
                    }
                });
    }

    /** Strips leading universal binders, replacing each bound variable by a fresh matching variable. */
    static Formula open(Formula f) {
        var n = 0;
        while (f instanceof Formula.Quant q && q.kind == Formula.Quantifier.FORALL)
            f = q.instantiate(Term.Var.free(OPEN_PREFIX + n++));
        return f;
    }

    private static List<Formula> closed(Formula f) {
        return f.freeVars().stream().anyMatch(v -> v.name().startsWith(OPEN_PREFIX)) ? List.of() : List.of(f);
    }

    private abstract static class Custom implements InferenceRule {
        private final String name;
        private final boolean goalDirected;
        private final List<Formula> premises;

        Custom(String name, boolean goalDirected, String... premises) {
            this.name = name;
            this.goalDirected = goalDirected;
            var ps = new ArrayList<Formula>(premises.length);
            for (var p : premises) {
                try {
                    ps.add(TdfolParser.parsePattern(p));
                } catch (ValidationException e) {
                    throw new IllegalStateException("Bad premise pattern in rule " + name + ": " + p, e);
                }
            }
            this.premises = List.copyOf(ps);
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public RuleCategory category() {
            return RuleCategory.BASIC;
        }

        @Override
        public List<Formula> premises() {
            return premises;
        }

        @Override
        public boolean goalDirected() {
            return goalDirected;
        }

        @Override
        public List<Bindings> seeds(List<Formula> targets) {
            return List.of();
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
