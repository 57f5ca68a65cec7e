package dumb.cogproof.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import dumb.cogproof.util.Json;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static dumb.cogproof.util.Log.message;
import static java.util.Objects.requireNonNull;

/** Keeps every entry in one JSON object file, rewritten atomically on each save. */
public class JsonFileProofStore implements ProofStore {

    private static final TypeReference<LinkedHashMap<String, CacheEntry>> ENTRIES = new TypeReference<>() {
    };

    private final Path file;
    private @Nullable Map<String, CacheEntry> entries;

    public JsonFileProofStore(Path file) {
        this.file = requireNonNull(file);
    }

    public Path file() {
        return file;
    }

    @Override
    public synchronized @Nullable CacheEntry load(CacheKey key) throws IOException {
        return entries().get(key.key());
    }

    @Override
    public synchronized void save(CacheEntry entry) throws IOException {
        entries().put(entry.key().key(), entry);
        Json.write(file, entries);
    }

    @Override
    public synchronized void clear() throws IOException {
        entries = new LinkedHashMap<>();
        Files.deleteIfExists(file);
    }

    public synchronized int size() throws IOException {
        return entries().size();
    }

    private Map<String, CacheEntry> entries() throws IOException {
        var e = entries;
        if (e == null) {
            if (Files.isReadable(file)) {
                e = Json.the.readValue(file.toFile(), ENTRIES);
                message("Loaded " + e.size() + " cached proofs from " + file);
            } else e = new LinkedHashMap<>();
            entries = e;
        }
        return e;
    }
}
