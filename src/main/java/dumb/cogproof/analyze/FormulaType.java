package dumb.cogproof.analyze;

public enum FormulaType {
    PROPOSITIONAL,
    /** Quantifiers over monadic predicates only, no function symbols. */
    QUANTIFIED_PROPOSITIONAL,
    PURE_FOL,
    ARITHMETIC,
    MODAL,
    TEMPORAL,
    DEONTIC,
    COGNITIVE,
    /** More than one family of modal operators. */
    MIXED_MODAL;

    public boolean modalFamily() {
        return this == MODAL || this == TEMPORAL || this == DEONTIC || this == COGNITIVE || this == MIXED_MODAL;
    }
}
