package dumb.cogproof.reason;

import dumb.cogproof.Formula;
import dumb.cogproof.Term;
import dumb.cogproof.modal.ModalSystem;

import java.util.List;

/**
 * What a rule may consult besides its bindings.
 *
 * @param targets     closed sub-formulas of the goal and the axioms, goal first; seeds goal-directed rules
 * @param groundTerms variable-free terms of the problem, goal first; instantiation candidates
 */
public record RuleContext(Formula goal, List<Formula> targets, List<Term> groundTerms, ModalSystem system) {

    public RuleContext {
        targets = List.copyOf(targets);
        groundTerms = List.copyOf(groundTerms);
    }
}
