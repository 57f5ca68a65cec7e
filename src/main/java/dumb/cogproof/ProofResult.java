package dumb.cogproof;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.cogproof.util.Json;
import org.jetbrains.annotations.Nullable;

import java.util.List;

import static java.util.Objects.requireNonNull;

/** Outcome of a proof request. Immutable; the {@code with*} methods return modified copies. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProofResult(@JsonProperty("status") ProofStatus status,
                          @JsonProperty("method") String method,
                          @JsonProperty("elapsed_ms") long elapsedMs,
                          @JsonProperty("steps") List<ProofStep> steps,
                          @JsonProperty("attempts") List<Attempt> attempts,
                          @JsonProperty("message") @Nullable String message,
                          @JsonProperty("countermodel") @Nullable String countermodel,
                          @JsonProperty("cached") boolean cached) {

    public ProofResult {
        requireNonNull(status);
        requireNonNull(method);
        steps = steps == null ? List.of() : List.copyOf(steps);
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    public static ProofResult proved(String method, long elapsedMs, List<ProofStep> steps) {
        return new ProofResult(ProofStatus.PROVED, method, elapsedMs, steps, List.of(), null, null, false);
    }

    public static ProofResult disproved(String method, long elapsedMs, @Nullable String countermodel) {
        return new ProofResult(ProofStatus.DISPROVED, method, elapsedMs, List.of(), List.of(), null, countermodel, false);
    }

    public static ProofResult unknown(String method, long elapsedMs, @Nullable String message) {
        return new ProofResult(ProofStatus.UNKNOWN, method, elapsedMs, List.of(), List.of(), message, null, false);
    }

    public static ProofResult timeout(String method, long elapsedMs) {
        return new ProofResult(ProofStatus.TIMEOUT, method, elapsedMs, List.of(), List.of(), "deadline exceeded", null, false);
    }

    /** Stopped by an interrupt before it could answer. Reported as TIMEOUT so that it is never cached. */
    public static ProofResult cancelled(String method, long elapsedMs, String why) {
        return new ProofResult(ProofStatus.TIMEOUT, method, elapsedMs, List.of(), List.of(), why, null, false);
    }

    public static ProofResult error(String method, long elapsedMs, String message) {
        return new ProofResult(ProofStatus.ERROR, method, elapsedMs, List.of(), List.of(), message, null, false);
    }

    public static ProofResult fromJson(String json) throws JsonProcessingException {
        return Json.obj(json, ProofResult.class);
    }

    public ProofResult withAttempts(List<Attempt> attempts) {
        return new ProofResult(status, method, elapsedMs, steps, attempts, message, countermodel, cached);
    }

    public ProofResult withElapsed(long elapsedMs) {
        return new ProofResult(status, method, elapsedMs, steps, attempts, message, countermodel, cached);
    }

    public ProofResult withMethod(String method) {
        return new ProofResult(status, method, elapsedMs, steps, attempts, message, countermodel, cached);
    }

    /** The copy handed out on a cache hit: no new attempts, the lookup time as elapsed time. */
    public ProofResult asCached(long lookupMs) {
        return new ProofResult(status, method, lookupMs, steps, List.of(), message, countermodel, true);
    }

    public String toJson() {
        return Json.str(this);
    }
}
