package dumb.cogproof.reason;

import dumb.cogproof.Formula;
import dumb.cogproof.modal.ModalSystem;

import java.util.List;

/**
 * A rule of the native prover. The prover matches {@link #premises()} against facts under one
 * consistent {@link Bindings} and asks the rule for its conclusions.
 * <p>
 * Goal-directed rules build formulas larger than their premises (introductions, axiom schemas); they
 * only fire under the bindings returned by {@link #seeds}, i.e. when their conclusion already occurs
 * inside the goal or the axioms.
 */
public interface InferenceRule {

    String name();

    RuleCategory category();

    /** Premise patterns; empty for an axiom schema. */
    List<Formula> premises();

    boolean goalDirected();

    default boolean enabled(ModalSystem system) {
        return true;
    }

    /** Bindings under which this rule's conclusion matches one of the target sub-formulas. */
    List<Bindings> seeds(List<Formula> targets);

    /**
     * Conclusions for one match of every premise.
     *
     * @param matched the facts matched by each premise, in premise order
     */
    List<Formula> conclude(Bindings bindings, List<Formula> matched, RuleContext ctx);
}
