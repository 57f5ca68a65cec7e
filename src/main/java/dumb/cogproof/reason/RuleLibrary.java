package dumb.cogproof.reason;

import dumb.cogproof.Formula;
import dumb.cogproof.Term;
import dumb.cogproof.ValidationException;
import dumb.cogproof.modal.ModalSystem;
import dumb.cogproof.syntax.TdfolParser;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

import static dumb.cogproof.modal.ModalSystem.D;
import static dumb.cogproof.modal.ModalSystem.S4;
import static dumb.cogproof.modal.ModalSystem.S5;
import static dumb.cogproof.modal.ModalSystem.T;
import static dumb.cogproof.reason.RuleCategory.BASIC;
import static dumb.cogproof.reason.RuleCategory.COGNITIVE;
import static dumb.cogproof.reason.RuleCategory.DEONTIC;
import static dumb.cogproof.reason.RuleCategory.TEMPORAL_MODAL;

/**
 * Registry of inference rules, indexed by name and by category. Rules are registered once, in the
 * order the prover tries them within a category.
 */
public final class RuleLibrary {

    private static volatile @Nullable RuleLibrary standard;

    private final List<InferenceRule> rules;
    private final Map<String, InferenceRule> byName;
    private final Map<RuleCategory, List<InferenceRule>> byCategory;

    private RuleLibrary(Collection<InferenceRule> rules) {
        this.rules = List.copyOf(rules);
        var names = new LinkedHashMap<String, InferenceRule>();
        var cats = new EnumMap<RuleCategory, List<InferenceRule>>(RuleCategory.class);
        for (var c : RuleCategory.values()) cats.put(c, new ArrayList<>());
        for (var r : this.rules) {
            if (names.putIfAbsent(r.name(), r) != null) throw new IllegalArgumentException("Duplicate rule name: " + r.name());
            cats.get(r.category()).add(r);
        }
        cats.replaceAll((c, l) -> List.copyOf(l));
        this.byName = Collections.unmodifiableMap(names);
        this.byCategory = Collections.unmodifiableMap(cats);
    }

    /** The full rule set: basic, cognitive, deontic and temporal/modal. */
    public static RuleLibrary standard() {
        var s = standard;
        if (s == null) {
            synchronized (RuleLibrary.class) {
                s = standard;
                if (s == null) standard = s = build();
            }
        }
        return s;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<InferenceRule> rules() {
        return rules;
    }

    public List<InferenceRule> rules(RuleCategory c) {
        return byCategory.get(c);
    }

    @Nullable
    public InferenceRule rule(String name) {
        return byName.get(name);
    }

    public int size() {
        return rules.size();
    }

    /** A library holding only the rules of the given categories. */
    public RuleLibrary restrict(Set<RuleCategory> categories) {
        return new RuleLibrary(rules.stream().filter(r -> categories.contains(r.category())).toList());
    }

    private static RuleLibrary build() {
        var b = builder();
        basic(b);
        cognitive(b);
        deontic(b);
        temporalModal(b);
        return b.build();
    }

    private static void basic(Builder b) {
        b.rule(BASIC, "modus_ponens", "ψ", "φ", "φ -> ψ");
        b.rule(BASIC, "modus_tollens", "~φ", "~ψ", "φ -> ψ");
        b.rule(BASIC, "hypothetical_syllogism", "φ -> χ", "φ -> ψ", "ψ -> χ");
        b.rule(BASIC, "disjunctive_syllogism", "ψ", "φ | ψ", "~φ");
        b.rule(BASIC, "disjunctive_syllogism_right", "φ", "φ | ψ", "~ψ");
        b.rule(BASIC, "conjunction_elimination_left", "φ", "φ & ψ");
        b.rule(BASIC, "conjunction_elimination_right", "ψ", "φ & ψ");
        b.intro(BASIC, "conjunction_introduction", "φ & ψ", "φ", "ψ");
        b.intro(BASIC, "disjunction_introduction_left", "φ | ψ", "φ");
        b.intro(BASIC, "disjunction_introduction_right", "φ | ψ", "ψ");
        b.rule(BASIC, "double_negation_elimination", "φ", "~~φ");
        b.intro(BASIC, "double_negation_introduction", "~~φ", "φ");
        b.rule(BASIC, "de_morgan_and", "~φ | ~ψ", "~(φ & ψ)");
        b.rule(BASIC, "de_morgan_or", "~φ & ~ψ", "~(φ | ψ)");
        b.intro(BASIC, "de_morgan_and_reverse", "~(φ & ψ)", "~φ | ~ψ");
        b.intro(BASIC, "de_morgan_or_reverse", "~(φ | ψ)", "~φ & ~ψ");
        b.intro(BASIC, "contraposition", "~ψ -> ~φ", "φ -> ψ");
        b.rule(BASIC, "biconditional_commutativity", "ψ <-> φ", "φ <-> ψ");
        b.rule(BASIC, "biconditional_elimination_left", "φ -> ψ", "φ <-> ψ");
        b.rule(BASIC, "biconditional_elimination_right", "ψ -> φ", "φ <-> ψ");
        b.intro(BASIC, "biconditional_introduction", "φ <-> ψ", "φ -> ψ", "ψ -> φ");
        b.rule(BASIC, "biconditional_modus_ponens", "ψ", "φ <-> ψ", "φ");
        b.rule(BASIC, "biconditional_modus_ponens_reverse", "φ", "φ <-> ψ", "ψ");
        b.rule(BASIC, "constructive_dilemma", "ψ | ω", "φ -> ψ", "χ -> ω", "φ | χ");
        b.rule(BASIC, "destructive_dilemma", "~φ | ~χ", "φ -> ψ", "χ -> ω", "~ψ | ~ω");
        b.rule(BASIC, "disjunction_elimination", "χ", "φ | ψ", "φ -> χ", "ψ -> χ");
        b.rule(BASIC, "resolution", "ψ | χ", "φ | ψ", "~φ | χ");
        b.rule(BASIC, "reductio_ad_absurdum", "~φ", "φ -> ψ", "φ -> ~ψ");
        b.intro(BASIC, "absorption", "φ -> (φ & ψ)", "φ -> ψ");
        b.rule(BASIC, "exportation", "φ -> (ψ -> χ)", "(φ & ψ) -> χ");
        b.rule(BASIC, "importation", "(φ & ψ) -> χ", "φ -> (ψ -> χ)");
        b.intro(BASIC, "material_implication", "~φ | ψ", "φ -> ψ");
        b.rule(BASIC, "material_implication_reverse", "φ -> ψ", "~φ | ψ");
        b.rule(BASIC, "negated_implication", "φ & ~ψ", "~(φ -> ψ)");
        b.intro(BASIC, "distribution_and_over_or", "(φ & ψ) | (φ & χ)", "φ & (ψ | χ)");
        b.intro(BASIC, "distribution_or_over_and", "(φ | ψ) & (φ | χ)", "φ | (ψ & χ)");
        b.intro(BASIC, "tautology_introduction", "φ | ~φ");
        QuantifierRules.all().forEach(b::add);
        b.rule(BASIC, "quantifier_negation_forall", "exists x. ~φ", "~(forall x. φ)");
        b.rule(BASIC, "quantifier_negation_exists", "forall x. ~φ", "~(exists x. φ)");
        b.rule(BASIC, "universal_conjunction_distribution", "(forall x. φ) & (forall x. ψ)", "forall x. (φ & ψ)");
        b.intro(BASIC, "universal_conjunction_introduction", "forall x. (φ & ψ)", "forall x. φ", "forall x. ψ");
        b.rule(BASIC, "existential_disjunction_distribution", "(exists x. φ) | (exists x. ψ)", "exists x. (φ | ψ)");
    }

    private static void cognitive(Builder b) {
        b.rule(COGNITIVE, "knowledge_implies_belief", "Believes[?a](φ)", "Knows[?a](φ)");
        b.rule(COGNITIVE, "knowledge_truth", "φ", "Knows[?a](φ)");
        b.rule(COGNITIVE, "belief_distribution", "Believes[?a](ψ)", "Believes[?a](φ -> ψ)", "Believes[?a](φ)");
        b.rule(COGNITIVE, "knowledge_distribution", "Knows[?a](ψ)", "Knows[?a](φ -> ψ)", "Knows[?a](φ)");
        b.intro(COGNITIVE, "belief_conjunction", "Believes[?a](φ & ψ)", "Believes[?a](φ)", "Believes[?a](ψ)");
        b.intro(COGNITIVE, "knowledge_conjunction", "Knows[?a](φ & ψ)", "Knows[?a](φ)", "Knows[?a](ψ)");
        b.rule(COGNITIVE, "belief_monotonicity_left", "Believes[?a](φ)", "Believes[?a](φ & ψ)");
        b.rule(COGNITIVE, "belief_monotonicity_right", "Believes[?a](ψ)", "Believes[?a](φ & ψ)");
        b.rule(COGNITIVE, "knowledge_monotonicity_left", "Knows[?a](φ)", "Knows[?a](φ & ψ)");
        b.rule(COGNITIVE, "knowledge_monotonicity_right", "Knows[?a](ψ)", "Knows[?a](φ & ψ)");
        b.rule(COGNITIVE, "belief_modus_ponens", "Believes[?a](ψ)", "Believes[?a](φ)", "φ -> ψ");
        b.rule(COGNITIVE, "knowledge_modus_ponens", "Knows[?a](ψ)", "Knows[?a](φ)", "φ -> ψ");
        b.intro(COGNITIVE, "positive_introspection", "Knows[?a](Knows[?a](φ))", "Knows[?a](φ)");
        b.intro(COGNITIVE, "negative_introspection", "Knows[?a](~Knows[?a](φ))", "~Knows[?a](φ)");
        b.intro(COGNITIVE, "belief_introspection", "Believes[?a](Believes[?a](φ))", "Believes[?a](φ)");
        b.rule(COGNITIVE, "perception_implies_knowledge", "Knows[?a](φ)", "Perceives[?a](φ)");
        b.rule(COGNITIVE, "perception_veridicality", "φ", "Perceives[?a](φ)");
        b.rule(COGNITIVE, "sincerity", "Believes[?a](φ)", "Says[?a](φ)");
        b.rule(COGNITIVE, "intention_commitment", "Believes[?a](Eventually(φ))", "Intends[?a](φ)");
        b.rule(COGNITIVE, "intention_means_end", "Intends[?a](φ)", "Intends[?a](ψ)", "Believes[?a](φ -> ψ)");
        b.rule(COGNITIVE, "intention_side_effect", "Believes[?a](Eventually(ψ))", "Intends[?a](φ)", "Knows[?a](φ -> ψ)");
        b.rule(COGNITIVE, "intention_implies_desire", "Desires[?a](φ)", "Intends[?a](φ)");
        b.rule(COGNITIVE, "belief_negation", "~Believes[?a](φ)", "Believes[?a](~φ)");
        b.rule(COGNITIVE, "belief_revision", "Believes[?a](~φ)", "Believes[?a](φ)", "Perceives[?a](~φ)");
        b.intro(COGNITIVE, "common_knowledge_implies_knowledge", "Knows[?a](φ)", "CommonKnowledge(φ)");
        b.rule(COGNITIVE, "common_knowledge_truth", "φ", "CommonKnowledge(φ)");
        b.rule(COGNITIVE, "common_knowledge_distribution", "CommonKnowledge(ψ)", "CommonKnowledge(φ -> ψ)", "CommonKnowledge(φ)");
        b.intro(COGNITIVE, "common_knowledge_conjunction", "CommonKnowledge(φ & ψ)", "CommonKnowledge(φ)", "CommonKnowledge(ψ)");
        b.rule(COGNITIVE, "common_knowledge_monotonicity", "CommonKnowledge(φ)", "CommonKnowledge(φ & ψ)");
        b.intro(COGNITIVE, "common_knowledge_transitivity", "Knows[?a](CommonKnowledge(φ))", "CommonKnowledge(φ)");
        b.intro(COGNITIVE, "common_knowledge_introspection", "CommonKnowledge(CommonKnowledge(φ))", "CommonKnowledge(φ)");
        b.rule(COGNITIVE, "common_knowledge_negation", "~CommonKnowledge(φ)", "CommonKnowledge(~φ)");
        b.intro(COGNITIVE, "common_knowledge_fixed_point", "Knows[?a](φ & CommonKnowledge(φ))", "CommonKnowledge(φ)");
        b.rule(COGNITIVE, "temporally_induced_common_knowledge", "Always(CommonKnowledge(φ))", "CommonKnowledge(Always(φ))");
    }

    private static void deontic(Builder b) {
        b.rule(DEONTIC, "deontic_k_axiom", "Obligatory[?a](ψ)", "Obligatory[?a](φ -> ψ)", "Obligatory[?a](φ)");
        b.rule(DEONTIC, "deontic_d_axiom", "Permitted[?a](φ)", "Obligatory[?a](φ)");
        b.rule(DEONTIC, "prohibition_equivalence", "Obligatory[?a](~φ)", "Forbidden[?a](φ)");
        b.rule(DEONTIC, "prohibition_from_obligation", "Forbidden[?a](φ)", "Obligatory[?a](~φ)");
        b.rule(DEONTIC, "permission_negation", "Forbidden[?a](φ)", "~Permitted[?a](φ)");
        b.intro(DEONTIC, "obligation_consistency", "~Obligatory[?a](~φ)", "Obligatory[?a](φ)");
        b.rule(DEONTIC, "permission_from_non_obligation", "Permitted[?a](φ)", "~Obligatory[?a](~φ)");
        b.rule(DEONTIC, "forbidden_to_not_obligatory", "~Obligatory[?a](φ)", "Forbidden[?a](φ)");
        b.rule(DEONTIC, "forbidden_to_not_permitted", "~Permitted[?a](φ)", "Forbidden[?a](φ)");
        b.rule(DEONTIC, "obligation_implies_not_forbidden", "~Forbidden[?a](φ)", "Obligatory[?a](φ)");
        b.rule(DEONTIC, "obligation_distribution", "Obligatory[?a](φ)", "Obligatory[?a](φ & ψ)");
        b.rule(DEONTIC, "obligation_distribution_right", "Obligatory[?a](ψ)", "Obligatory[?a](φ & ψ)");
        b.intro(DEONTIC, "obligation_conjunction", "Obligatory[?a](φ & ψ)", "Obligatory[?a](φ)", "Obligatory[?a](ψ)");
        b.rule(DEONTIC, "obligation_implication", "Obligatory[?a](ψ)", "Obligatory[?a](φ)", "φ -> ψ");
        b.rule(DEONTIC, "permission_distribution", "Permitted[?a](φ) | Permitted[?a](ψ)", "Permitted[?a](φ | ψ)");
        b.rule(DEONTIC, "permission_weakening", "Permitted[?a](φ)", "Permitted[?a](φ & ψ)");
        b.intro(DEONTIC, "permission_introduction", "Permitted[?a](φ | ψ)", "Permitted[?a](φ)");
        b.rule(DEONTIC, "temporal_obligation_persistence", "Obligatory[?a](φ)", "Always(Obligatory[?a](φ))");
        b.intro(DEONTIC, "deontic_temporal_introduction", "Obligatory[?a](Eventually(φ))", "Obligatory[?a](φ)");
        b.rule(DEONTIC, "until_obligation", "Obligatory[?a](φ)", "Until(Obligatory[?a](φ), ψ)", "~ψ");
        b.rule(DEONTIC, "always_permission", "Permitted[?a](φ)", "Always(Permitted[?a](φ))");
        b.rule(DEONTIC, "eventually_forbidden", "Always(Forbidden[?a](φ))", "Forbidden[?a](Eventually(φ))");
        b.rule(DEONTIC, "obligation_eventually", "Obligatory[?a](Eventually(φ))", "Obligatory[?a](Next(φ))");
        b.rule(DEONTIC, "obligation_always_distribution", "Always(Obligatory[?a](φ))", "Obligatory[?a](Always(φ))");
        b.intro(DEONTIC, "permission_temporal_weakening", "Permitted[?a](Eventually(φ))", "Permitted[?a](φ)");
    }

    private static void temporalModal(Builder b) {
        b.rule(TEMPORAL_MODAL, "temporal_k_axiom", "Always(ψ)", "Always(φ -> ψ)", "Always(φ)");
        b.rule(TEMPORAL_MODAL, "temporal_t_axiom", "φ", "Always(φ)");
        b.intro(TEMPORAL_MODAL, "temporal_4_axiom", "Always(Always(φ))", "Always(φ)");
        b.rule(TEMPORAL_MODAL, "always_idempotence", "Always(φ)", "Always(Always(φ))");
        b.intro(TEMPORAL_MODAL, "eventually_introduction", "Eventually(φ)", "φ");
        b.rule(TEMPORAL_MODAL, "eventually_from_always", "Eventually(φ)", "Always(φ)");
        b.rule(TEMPORAL_MODAL, "eventually_idempotence", "Eventually(φ)", "Eventually(Eventually(φ))");
        b.rule(TEMPORAL_MODAL, "always_distribution", "Always(φ)", "Always(φ & ψ)");
        b.rule(TEMPORAL_MODAL, "always_distribution_right", "Always(ψ)", "Always(φ & ψ)");
        b.intro(TEMPORAL_MODAL, "always_conjunction", "Always(φ & ψ)", "Always(φ)", "Always(ψ)");
        b.rule(TEMPORAL_MODAL, "always_implies_next", "Next(φ)", "Always(φ)");
        b.rule(TEMPORAL_MODAL, "always_induction", "Always(φ)", "φ", "Always(φ -> Next(φ))");
        b.rule(TEMPORAL_MODAL, "next_distribution", "Next(φ)", "Next(φ & ψ)");
        b.rule(TEMPORAL_MODAL, "next_implication", "Next(ψ)", "Next(φ -> ψ)", "Next(φ)");
        b.rule(TEMPORAL_MODAL, "next_negation", "~Next(φ)", "Next(~φ)");
        b.rule(TEMPORAL_MODAL, "eventually_distribution", "Eventually(φ) | Eventually(ψ)", "Eventually(φ | ψ)");
        b.rule(TEMPORAL_MODAL, "eventually_implication", "Eventually(ψ)", "Always(φ -> ψ)", "Eventually(φ)");
        b.rule(TEMPORAL_MODAL, "eventually_expansion", "Next(Eventually(φ))", "Eventually(φ)", "~φ");
        b.rule(TEMPORAL_MODAL, "always_expansion", "Next(Always(φ))", "Always(φ)");
        b.rule(TEMPORAL_MODAL, "until_unfolding", "φ & Next(Until(φ, ψ))", "Until(φ, ψ)", "~ψ");
        b.rule(TEMPORAL_MODAL, "until_eventuality", "Eventually(ψ)", "Until(φ, ψ)");
        b.rule(TEMPORAL_MODAL, "until_weakening", "φ", "Until(φ, ψ)", "~ψ");
        b.intro(TEMPORAL_MODAL, "until_introduction", "Until(φ, ψ)", "ψ");
        b.intro(TEMPORAL_MODAL, "since_introduction", "Since(φ, ψ)", "ψ");
        b.rule(TEMPORAL_MODAL, "temporal_negation_always", "Eventually(~φ)", "~Always(φ)");
        b.rule(TEMPORAL_MODAL, "temporal_negation_eventually", "Always(~φ)", "~Eventually(φ)");
        b.intro(TEMPORAL_MODAL, "temporal_duality", "~Eventually(φ)", "Always(~φ)");
        b.rule(TEMPORAL_MODAL, "modal_k_axiom", "Necessary(ψ)", "Necessary(φ -> ψ)", "Necessary(φ)");
        b.modal(EnumSet.of(T, S4, S5), false, "modal_t_axiom", "φ", "Necessary(φ)");
        b.modal(EnumSet.of(S4, S5), true, "modal_4_axiom", "Necessary(Necessary(φ))", "Necessary(φ)");
        b.modal(EnumSet.of(S5), true, "modal_5_axiom", "Necessary(Possible(φ))", "Possible(φ)");
        b.modal(EnumSet.of(S5), true, "modal_b_axiom", "Necessary(Possible(φ))", "φ");
        b.modal(EnumSet.of(D, T, S4, S5), false, "modal_d_axiom", "Possible(φ)", "Necessary(φ)");
        b.modal(EnumSet.of(T, S4, S5), true, "possibility_introduction", "Possible(φ)", "φ");
        b.rule(TEMPORAL_MODAL, "modal_duality_box", "Possible(~φ)", "~Necessary(φ)");
        b.rule(TEMPORAL_MODAL, "modal_duality_diamond", "Necessary(~φ)", "~Possible(φ)");
        b.rule(TEMPORAL_MODAL, "box_distribution", "Necessary(φ)", "Necessary(φ & ψ)");
        b.rule(TEMPORAL_MODAL, "box_distribution_right", "Necessary(ψ)", "Necessary(φ & ψ)");
        b.intro(TEMPORAL_MODAL, "box_conjunction", "Necessary(φ & ψ)", "Necessary(φ)", "Necessary(ψ)");
        b.rule(TEMPORAL_MODAL, "diamond_distribution", "Possible(φ) | Possible(ψ)", "Possible(φ | ψ)");
    }

    /** Metavariables and term variables a pattern mentions. */
    static Set<Object> variables(Formula pattern) {
        var out = new HashSet<Object>();
        pattern.subformulas().forEach(g -> {
            if (g instanceof Formula.Meta m) out.add(m.name);
        });
        out.addAll(Unifier.variables(pattern));
        return out;
    }

    public static final class Builder {
        private final List<InferenceRule> rules = new ArrayList<>();

        public Builder rule(RuleCategory c, String name, String conclusion, String... premises) {
            return add(c, name, conclusion, premises, false, Set.of(), null);
        }

        /** A goal-directed rule. */
        public Builder intro(RuleCategory c, String name, String conclusion, String... premises) {
            return add(c, name, conclusion, premises, true, Set.of(), null);
        }

        /** A modal axiom that holds only in the given systems. */
        public Builder modal(Set<ModalSystem> systems, boolean goalDirected, String name, String conclusion, String... premises) {
            return add(TEMPORAL_MODAL, name, conclusion, premises, goalDirected, systems, null);
        }

        public Builder when(RuleCategory c, String name, Predicate<Bindings> condition, String conclusion, String... premises) {
            return add(c, name, conclusion, premises, false, Set.of(), condition);
        }

        public Builder add(InferenceRule r) {
            rules.add(r);
            return this;
        }

        private Builder add(RuleCategory c, String name, String conclusion, String[] premises, boolean goalDirected,
                            Set<ModalSystem> systems, @Nullable Predicate<Bindings> condition) {
            var ps = new ArrayList<Formula>(premises.length);
            var bound = new HashSet<Object>();
            for (var p : premises) {
                var f = pattern(name, p);
                ps.add(f);
                bound.addAll(variables(f));
            }
            var concl = pattern(name, conclusion);
            // a conclusion that mentions variables no premise binds can only be instantiated from the goal
            var gd = goalDirected || !bound.containsAll(variables(concl));
            return add(new PatternRule(name, c, ps, concl, gd, systems, condition));
        }

        private static Formula pattern(String rule, String text) {
            try {
                return TdfolParser.parsePattern(text);
            } catch (ValidationException e) {
                throw new IllegalStateException("Bad pattern in rule " + rule + ": " + text, e);
            }
        }

        public RuleLibrary build() {
            return new RuleLibrary(rules);
        }
    }

    /** Ground terms of a problem, the goal's first, for instantiating universals. */
    static List<Term> groundTerms(Formula goal, Collection<Formula> facts) {
        var out = new LinkedHashMap<Term, Boolean>();
        goal.groundTerms().forEach(t -> out.put(t, true));
        for (var f : facts) f.groundTerms().forEach(t -> out.putIfAbsent(t, true));
        return List.copyOf(out.keySet());
    }
}
