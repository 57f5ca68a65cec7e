package dumb.cogproof;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

/** One prover tried by the router, and how it ended. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Attempt(@JsonProperty("method") String method,
                      @JsonProperty("status") ProofStatus status,
                      @JsonProperty("elapsed_ms") long elapsedMs,
                      @JsonProperty("message") @Nullable String message) {

    public static Attempt of(ProofResult r) {
        return new Attempt(r.method(), r.status(), r.elapsedMs(), r.message());
    }
}
