package dumb.cogproof.cache;

import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.cogproof.ContentHash;
import dumb.cogproof.Formula;

import java.util.Collection;

import static java.util.Objects.requireNonNull;

/**
 * Identity of a proof obligation: the goal, the axiom set (order and duplicates ignored), the
 * method asked for and everything in the configuration that can change the answer.
 */
public record CacheKey(@JsonProperty("goal") ContentHash goalHash,
                       @JsonProperty("axioms") ContentHash axiomSetHash,
                       @JsonProperty("method") String method,
                       @JsonProperty("config") String configFingerprint) {

    public CacheKey {
        requireNonNull(goalHash);
        requireNonNull(axiomSetHash);
        requireNonNull(method);
        requireNonNull(configFingerprint);
    }

    public static CacheKey of(Formula goal, Collection<? extends Formula> axioms, String method, String configFingerprint) {
        return new CacheKey(goal.hash(), ContentHash.ofSet(axioms.stream().map(Formula::hash).toList()), method, configFingerprint);
    }

    /** Flat string form, used as the persistence key. */
    public String key() {
        return goalHash.hex() + ':' + axiomSetHash.hex() + ':' + method + ':' + configFingerprint;
    }

    @Override
    public String toString() {
        return goalHash.shortHex() + ':' + axiomSetHash.shortHex() + ':' + method + ':' + configFingerprint;
    }
}
