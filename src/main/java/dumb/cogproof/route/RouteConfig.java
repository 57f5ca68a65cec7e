package dumb.cogproof.route;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.cogproof.modal.ModalSystem;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Options for one routed proof request.
 *
 * @param timeoutMs  budget for each prover attempt
 * @param method     when set, only the candidate with this method name is tried
 * @param race       run the best {@code raceWidth} candidates at once and keep the first conclusive answer
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RouteConfig(@JsonProperty("max_depth") int maxDepth,
                          @JsonProperty("timeout_ms") long timeoutMs,
                          @JsonProperty("modal_system") ModalSystem modalSystem,
                          @JsonProperty("method") @Nullable String method,
                          @JsonProperty("race") boolean race,
                          @JsonProperty("race_width") int raceWidth) {

    public static final RouteConfig DEFAULT = new RouteConfig(10, 5000, ModalSystem.K, null, false, 2);

    public RouteConfig {
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must not be negative");
        if (timeoutMs <= 0) throw new IllegalArgumentException("timeoutMs must be positive");
        requireNonNull(modalSystem);
        if (raceWidth < 1) throw new IllegalArgumentException("raceWidth must be at least 1");
    }

    public RouteConfig withDepth(int maxDepth) {
        return new RouteConfig(maxDepth, timeoutMs, modalSystem, method, race, raceWidth);
    }

    public RouteConfig withTimeout(long timeoutMs) {
        return new RouteConfig(maxDepth, timeoutMs, modalSystem, method, race, raceWidth);
    }

    public RouteConfig withSystem(ModalSystem modalSystem) {
        return new RouteConfig(maxDepth, timeoutMs, modalSystem, method, race, raceWidth);
    }

    public RouteConfig withMethod(@Nullable String method) {
        return new RouteConfig(maxDepth, timeoutMs, modalSystem, method, race, raceWidth);
    }

    public RouteConfig racing(int raceWidth) {
        return new RouteConfig(maxDepth, timeoutMs, modalSystem, method, true, raceWidth);
    }

    /**
     * The part of the configuration that can change a conclusive answer. The timeout is left out: timed-out
     * results are never cached, and a longer budget does not overturn a stored answer.
     */
    public String fingerprint() {
        return "d" + maxDepth + "-" + modalSystem;
    }
}
