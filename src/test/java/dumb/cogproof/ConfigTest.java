package dumb.cogproof;

import dumb.cogproof.cache.ProofCache;
import dumb.cogproof.modal.ModalSystem;
import dumb.cogproof.route.RouteConfig;
import dumb.cogproof.util.Json;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

class ConfigTest {

    @TempDir
    Path dir;

    @Test
    void missingFileGivesDefaults() throws IOException {
        var c = Config.load(dir.resolve("absent.json"));
        assertEquals(new Config(), c);
        assertEquals(ProofCache.DEFAULT_CAPACITY, c.cacheCapacity());
        assertEquals(RouteConfig.DEFAULT, c.route());
        assertNull(c.z3());
        assertFalse(c.neural());
    }

    @Test
    void partialFileKeepsOtherDefaults() throws IOException {
        var file = dir.resolve("cogproof.json");
        Files.writeString(file, "{\"maxDepth\": 4, \"modalSystem\": \"S4\", \"z3\": \"/usr/bin/z3\"}");
        var c = Config.load(file);
        assertEquals(4, c.maxDepth());
        assertEquals(ModalSystem.S4, c.modalSystem());
        assertEquals("/usr/bin/z3", c.z3());
        assertEquals(RouteConfig.DEFAULT.timeoutMs(), c.timeoutMs());
        assertEquals(Config.DEFAULT_LLM_URL, c.llmApiUrl());
        assertNull(c.coq());
        assertEquals("d4-S4", c.route().fingerprint());
    }

    @Test
    void survivesWriteAndLoad() throws IOException {
        var file = dir.resolve("written.json");
        var c = new Config(64, null, 3, 1000, ModalSystem.T, true, 3, 16, "z3", null, "lean", null, false,
                Config.DEFAULT_LLM_URL, Config.DEFAULT_LLM_MODEL);
        Json.write(file, c);
        assertEquals(c, Config.load(file));
        assertEquals(RouteConfig.DEFAULT.withDepth(3).withTimeout(1000).withSystem(ModalSystem.T).racing(3), c.route());
    }
}
