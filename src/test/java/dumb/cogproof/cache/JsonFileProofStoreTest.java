package dumb.cogproof.cache;

import dumb.cogproof.AbstractProverTest;
import dumb.cogproof.ProofResult;
import dumb.cogproof.ProofStatus;
import dumb.cogproof.ProofStep;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonFileProofStoreTest extends AbstractProverTest {

    @TempDir
    Path dir;

    @Test
    void resultsSurviveARestart() throws Exception {
        var file = dir.resolve("cache").resolve("proofs.json");
        var key = CacheKey.of(parse("q"), parseAll("p", "p -> q"), "native", "d10-K");
        var result = ProofResult.proved("native", 4, List.of(ProofStep.of("modus_ponens", parseAll("p", "p -> q"), parse("q"))));

        new ProofCache(16, new JsonFileProofStore(file)).put(key, result);
        assertTrue(Files.exists(file));

        var store = new JsonFileProofStore(file);
        assertEquals(1, store.size());
        var restarted = new ProofCache(16, store);
        var entry = restarted.get(key);
        assertNotNull(entry);
        assertEquals(key, entry.key());
        assertEquals(ProofStatus.PROVED, entry.result().status());
        assertEquals(result.steps(), entry.result().steps());

        var served = restarted.getOrCompute(key, () -> {
            throw new AssertionError("should be served from the store");
        });
        assertTrue(served.cached());
    }

    @Test
    void missingFileIsEmpty() throws Exception {
        var store = new JsonFileProofStore(dir.resolve("none.json"));
        assertEquals(0, store.size());
        assertNull(store.load(CacheKey.of(parse("p"), List.of(), "native", "d10-K")));
    }

    @Test
    void clearRemovesTheFile() throws Exception {
        var file = dir.resolve("proofs.json");
        var store = new JsonFileProofStore(file);
        var cache = new ProofCache(16, store);
        cache.put(CacheKey.of(parse("p"), List.of(), "native", "d10-K"), ProofResult.disproved("modal_tableaux", 2, "w0: ~p"));
        assertTrue(Files.exists(file));
        cache.clear();
        assertFalse(Files.exists(file));
        assertEquals(0, store.size());
    }
}
