package dumb.cogproof;

/** A construct that cannot be expressed in a target syntax. */
public class TranslationException extends Exception {
    private final String construct;

    public TranslationException(String message, String construct) {
        super(message);
        this.construct = construct;
    }

    public TranslationException(String message) {
        this(message, "");
    }

    public String construct() {
        return construct;
    }
}
