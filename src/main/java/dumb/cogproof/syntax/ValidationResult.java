package dumb.cogproof.syntax;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.cogproof.Formula;
import dumb.cogproof.Span;
import dumb.cogproof.ValidationException;
import org.jetbrains.annotations.Nullable;

/** Whether a text parses in a syntax; on failure, where and why. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationResult(@JsonProperty("syntax") Syntax syntax,
                               @JsonProperty("valid") boolean valid,
                               @JsonIgnore @Nullable Formula formula,
                               @JsonProperty("error") @Nullable String error,
                               @JsonProperty("span") @Nullable Span span) {

    static ValidationResult ok(Syntax syntax, Formula f) {
        return new ValidationResult(syntax, true, f, null, null);
    }

    static ValidationResult failed(Syntax syntax, ValidationException e) {
        return new ValidationResult(syntax, false, null, e.getMessage(), e.span().known() ? e.span() : null);
    }

    /** The parsed formula in native text, when valid. */
    @JsonProperty("parsed")
    public @Nullable String text() {
        return formula == null ? null : formula.text();
    }
}
