package dumb.cogproof.modal;

/** Normal modal systems, each named by the frame conditions its accessibility relation satisfies. */
public enum ModalSystem {
    K(Frame.BASIC),
    D(new Frame(false, true, false, false)),
    T(new Frame(true, true, false, false)),
    S4(new Frame(true, true, true, false)),
    S5(new Frame(true, true, true, true));

    public final Frame frame;

    ModalSystem(Frame frame) {
        this.frame = frame;
    }

    public boolean reflexive() {
        return frame.reflexive();
    }

    public boolean serial() {
        return frame.serial();
    }

    public boolean transitive() {
        return frame.transitive();
    }

    public boolean euclidean() {
        return frame.euclidean();
    }

    /**
     * Conditions on one accessibility relation. Reflexivity implies seriality; transitivity with
     * euclideanness over a reflexive relation gives an equivalence relation (S5).
     */
    public record Frame(boolean reflexive, boolean serial, boolean transitive, boolean euclidean) {
        public static final Frame BASIC = new Frame(false, false, false, false);

        /** KD4, used for belief. */
        public static final Frame BELIEF = new Frame(false, true, true, false);
    }
}
