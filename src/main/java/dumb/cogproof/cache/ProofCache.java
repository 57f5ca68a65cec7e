package dumb.cogproof.cache;

import dumb.cogproof.ProofResult;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import static dumb.cogproof.util.Log.debug;
import static dumb.cogproof.util.Log.warning;

/**
 * Content-addressed LRU cache of proof results with single-flight computation: while one caller
 * computes a key, later callers for the same key wait for that result instead of computing again.
 * <p>
 * Only {@link dumb.cogproof.ProofStatus#cacheable() cacheable} results are kept. Timeouts and errors
 * reach every waiter but are not stored, so a retry with a larger budget computes afresh.
 */
public class ProofCache {

    public static final int DEFAULT_CAPACITY = 1024;

    private final int capacity;
    private final @Nullable ProofStore store;
    private final Map<CacheKey, CacheEntry> lru;
    private final Map<CacheKey, CompletableFuture<ProofResult>> inflight = new LinkedHashMap<>();
    private final ReentrantLock inflightLock = new ReentrantLock();

    private final AtomicLong hits = new AtomicLong(), misses = new AtomicLong(),
            evictions = new AtomicLong(), coalesced = new AtomicLong();

    public ProofCache() {
        this(DEFAULT_CAPACITY, null);
    }

    public ProofCache(int capacity, @Nullable ProofStore store) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive");
        this.capacity = capacity;
        this.store = store;
        this.lru = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<CacheKey, CacheEntry> eldest) {
                var evict = size() > ProofCache.this.capacity;
                if (evict) evictions.incrementAndGet();
                return evict;
            }
        };
    }

    /**
     * The stored result for {@code key}, marked cached and timed by the lookup; otherwise the result
     * of {@code compute}, run at most once across concurrent callers of the same key.
     */
    public ProofResult getOrCompute(CacheKey key, Supplier<ProofResult> compute) {
        var start = System.nanoTime();
        var hit = lookup(key);
        if (hit != null) return hit.result().asCached((System.nanoTime() - start) / 1_000_000);

        CompletableFuture<ProofResult> mine = null, theirs;
        inflightLock.lock();
        try {
            theirs = inflight.get(key);
            if (theirs == null) {
                // a computation may have finished since the lookup above
                hit = peek(key);
                if (hit == null) inflight.put(key, mine = new CompletableFuture<>());
            }
        } finally {
            inflightLock.unlock();
        }
        if (hit != null) {
            hits.incrementAndGet();
            return hit.result().asCached((System.nanoTime() - start) / 1_000_000);
        }
        if (theirs != null) {
            coalesced.incrementAndGet();
            debug("Waiting on in-flight proof " + key);
            return await(theirs);
        }

        misses.incrementAndGet();
        try {
            var r = compute.get();
            if (r.status().cacheable()) put(key, r);
            mine.complete(r);
            return r;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inflightLock.lock();
            try {
                inflight.remove(key, mine);
            } finally {
                inflightLock.unlock();
            }
        }
    }

    /** The stored entry, counting a hit when found; consults the store when memory has none. */
    @Nullable
    public CacheEntry get(CacheKey key) {
        return lookup(key);
    }

    private @Nullable CacheEntry lookup(CacheKey key) {
        var e = peek(key);
        if (e == null && store != null) {
            try {
                e = store.load(key);
            } catch (IOException ex) {
                warning("Proof store read failed for " + key + ": " + ex.getMessage());
            }
            if (e != null) {
                synchronized (lru) {
                    lru.put(key, e);
                }
            }
        }
        if (e != null) hits.incrementAndGet();
        return e;
    }

    private @Nullable CacheEntry peek(CacheKey key) {
        synchronized (lru) {
            return lru.get(key);
        }
    }

    public void put(CacheKey key, ProofResult result) {
        if (!result.status().cacheable())
            throw new IllegalArgumentException(result.status() + " results are not cached");
        var entry = new CacheEntry(key, result, Instant.now());
        synchronized (lru) {
            lru.put(key, entry);
        }
        if (store != null) {
            try {
                store.save(entry);
            } catch (IOException e) {
                warning("Proof store write failed for " + key + ": " + e.getMessage());
            }
        }
    }

    public int size() {
        synchronized (lru) {
            return lru.size();
        }
    }

    public void clear() {
        synchronized (lru) {
            lru.clear();
        }
        if (store != null) {
            try {
                store.clear();
            } catch (IOException e) {
                warning("Proof store clear failed: " + e.getMessage());
            }
        }
    }

    public CacheStats stats() {
        return new CacheStats(hits.get(), misses.get(), evictions.get(), coalesced.get(), size());
    }

    private static ProofResult await(CompletableFuture<ProofResult> f) {
        try {
            return f.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw e;
        }
    }
}
