package dumb.cogproof.bridge;

/** The closed set of prover back ends the router can dispatch to. */
public enum BridgeKind {
    NATIVE, SMT, INTERACTIVE, NEURAL, MODAL_TABLEAUX, CEC
}
