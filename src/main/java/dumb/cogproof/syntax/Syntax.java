package dumb.cogproof.syntax;

/** Surface syntaxes the translation layer reads and writes. */
public enum Syntax {
    TDFOL, DCEC, MODAL, TPTP, LEAN, COQ, NATURAL_LANGUAGE
}
