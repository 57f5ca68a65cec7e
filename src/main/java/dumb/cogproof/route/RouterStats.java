package dumb.cogproof.route;

import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.cogproof.cache.CacheStats;

import java.util.Map;

/** Counters of a {@link ProverRouter}: requests served, and attempts and wins per method. */
public record RouterStats(@JsonProperty("requests") long requests,
                          @JsonProperty("attempts") Map<String, Long> attempts,
                          @JsonProperty("wins") Map<String, Long> wins,
                          @JsonProperty("cache") CacheStats cache) {

    public RouterStats {
        attempts = Map.copyOf(attempts);
        wins = Map.copyOf(wins);
    }
}
