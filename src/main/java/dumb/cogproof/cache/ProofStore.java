package dumb.cogproof.cache;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;

/** Durable backing for a {@link ProofCache}, keyed by {@link CacheKey#key()}. */
public interface ProofStore {

    @Nullable
    CacheEntry load(CacheKey key) throws IOException;

    void save(CacheEntry entry) throws IOException;

    void clear() throws IOException;
}
