package dumb.cogproof.cache;

import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.cogproof.ProofResult;

import java.time.Instant;

import static java.util.Objects.requireNonNull;

public record CacheEntry(@JsonProperty("key") CacheKey key,
                         @JsonProperty("result") ProofResult result,
                         @JsonProperty("created_at") Instant createdAt) {

    public CacheEntry {
        requireNonNull(key);
        requireNonNull(result);
        requireNonNull(createdAt);
    }
}
