package dumb.cogproof;

import static java.util.Objects.requireNonNull;

/** Input that does not parse, or parses into an ill-formed formula. */
public class ValidationException extends Exception {
    private final Span span;
    private final String context;

    public ValidationException(String message) {
        this(message, Span.NONE, "");
    }

    public ValidationException(String message, Span span, String context) {
        super(message);
        this.span = requireNonNull(span);
        this.context = requireNonNull(context);
    }

    public Span span() {
        return span;
    }

    public String reason() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        var location = span.known() ? " at " + span : "";
        var snippet = context.isEmpty() ? "" : " near '" + context + "'";
        return super.getMessage() + location + snippet;
    }
}
