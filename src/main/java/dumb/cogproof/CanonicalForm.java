package dumb.cogproof;

import static java.util.Objects.requireNonNull;

/** A formula in canonical shape together with its deterministic serialization. */
public record CanonicalForm(Formula formula, String text) {
    public CanonicalForm {
        requireNonNull(formula);
        requireNonNull(text);
    }
}
