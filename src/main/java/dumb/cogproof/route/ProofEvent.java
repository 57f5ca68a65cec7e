package dumb.cogproof.route;

import dumb.cogproof.Attempt;
import dumb.cogproof.ProofResult;
import dumb.cogproof.cache.CacheKey;

/** Published on the router's event bus. */
public sealed interface ProofEvent {

    record AttemptCompleted(CacheKey key, Attempt attempt) implements ProofEvent {
    }

    record CacheHit(CacheKey key, ProofResult result) implements ProofEvent {
    }

    record RouteCompleted(CacheKey key, ProofResult result) implements ProofEvent {
    }
}
