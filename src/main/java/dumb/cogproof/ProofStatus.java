package dumb.cogproof;

public enum ProofStatus {
    PROVED, DISPROVED, TIMEOUT, UNKNOWN, ERROR;

    /** A definite answer: proved or disproved. */
    public boolean conclusive() {
        return this == PROVED || this == DISPROVED;
    }

    /** Whether a result with this status may be kept in the proof cache. */
    public boolean cacheable() {
        return this == PROVED || this == DISPROVED || this == UNKNOWN;
    }
}
