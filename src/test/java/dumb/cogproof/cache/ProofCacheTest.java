package dumb.cogproof.cache;

import dumb.cogproof.AbstractProverTest;
import dumb.cogproof.ProofResult;
import dumb.cogproof.ProofStatus;
import dumb.cogproof.ProofStep;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProofCacheTest extends AbstractProverTest {

    private static CacheKey key(String goal) {
        return CacheKey.of(parse(goal), parseAll("p", "p -> q"), "native", "d10-K");
    }

    private static ProofResult proved() {
        return ProofResult.proved("native", 12, List.of(ProofStep.of("modus_ponens", parseAll("p", "p -> q"), parse("q"))));
    }

    @Test
    void keysIgnoreAxiomOrderAndDuplicates() {
        var goal = parse("q");
        var a = CacheKey.of(goal, parseAll("p", "p -> q"), "native", "d10-K");
        var b = CacheKey.of(goal, parseAll("p -> q", "p", "p"), "native", "d10-K");
        assertEquals(a, b);
        assertEquals(a.key(), b.key());
        assertNotEquals(a, CacheKey.of(goal, parseAll("p"), "native", "d10-K"));
        assertNotEquals(a, CacheKey.of(goal, parseAll("p", "p -> q"), "z3", "d10-K"));
        assertNotEquals(a, CacheKey.of(goal, parseAll("p", "p -> q"), "native", "d10-T"));
    }

    @Test
    void secondRequestIsServedFromCache() {
        var cache = new ProofCache();
        var calls = new AtomicInteger();
        var first = cache.getOrCompute(key("q"), () -> {
            calls.incrementAndGet();
            return proved();
        });
        var second = cache.getOrCompute(key("q"), () -> {
            calls.incrementAndGet();
            return proved();
        });
        assertEquals(1, calls.get());
        assertFalse(first.cached());
        assertTrue(second.cached());
        assertTrue(second.attempts().isEmpty());
        assertEquals(first.steps(), second.steps());
        var stats = cache.stats();
        assertEquals(1, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(1, stats.size());
    }

    @Test
    void timeoutsAreNotStored() {
        var cache = new ProofCache();
        var calls = new AtomicInteger();
        for (var i = 0; i < 2; i++) {
            var r = cache.getOrCompute(key("q"), () -> {
                calls.incrementAndGet();
                return ProofResult.timeout("native", 5000);
            });
            assertEquals(ProofStatus.TIMEOUT, r.status());
        }
        assertEquals(2, calls.get());
        assertEquals(0, cache.size());
        assertThrows(IllegalArgumentException.class, () -> cache.put(key("q"), ProofResult.error("z3", 1, "boom")));
    }

    @Test
    void unknownIsStored() {
        var cache = new ProofCache();
        cache.getOrCompute(key("r"), () -> ProofResult.unknown("native", 3, "saturated"));
        var e = cache.get(key("r"));
        assertNotNull(e);
        assertEquals(ProofStatus.UNKNOWN, e.result().status());
    }

    @Test
    void evictsLeastRecentlyUsed() {
        var cache = new ProofCache(2, null);
        cache.put(key("a"), proved());
        cache.put(key("b"), proved());
        assertNotNull(cache.get(key("a")));
        cache.put(key("c"), proved());
        assertNull(cache.get(key("b")));
        assertNotNull(cache.get(key("a")));
        assertNotNull(cache.get(key("c")));
        assertEquals(1, cache.stats().evictions());
        assertEquals(2, cache.size());
    }

    @Test
    void failedComputationReachesCallerAndIsRetried() {
        var cache = new ProofCache();
        assertThrows(IllegalStateException.class, () -> cache.getOrCompute(key("q"), () -> {
            throw new IllegalStateException("prover crashed");
        }));
        assertEquals(ProofStatus.PROVED, cache.getOrCompute(key("q"), ProofCacheTest::proved).status());
    }

    @Test
    void concurrentRequestsComputeOnce() throws Exception {
        var cache = new ProofCache();
        var calls = new AtomicInteger();
        var release = new CountDownLatch(1);
        var threads = 8;
        var exe = Executors.newFixedThreadPool(threads);
        try {
            var futures = new ArrayList<Future<ProofResult>>();
            for (var i = 0; i < threads; i++) {
                futures.add(exe.submit(() -> cache.getOrCompute(key("q"), () -> {
                    calls.incrementAndGet();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return proved();
                })));
            }
            Thread.sleep(100);
            release.countDown();
            for (var f : futures) assertEquals(ProofStatus.PROVED, f.get(5, TimeUnit.SECONDS).status());
        } finally {
            exe.shutdownNow();
        }
        assertEquals(1, calls.get());
        var stats = cache.stats();
        assertEquals(threads - 1, stats.hits() + stats.coalesced());
    }

    @Test
    void clearEmptiesTheCache() {
        var cache = new ProofCache();
        cache.put(key("q"), proved());
        cache.clear();
        assertEquals(0, cache.size());
        assertNull(cache.get(key("q")));
    }
}
