package dumb.cogproof.analyze;

/** What a prover can handle, and what a problem needs. */
public enum Capability {
    PROPOSITIONAL, FOL, ARITHMETIC, MODAL, INTERACTIVE
}
