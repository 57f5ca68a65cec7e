package dumb.cogproof;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;

import static java.util.Objects.requireNonNull;

/** SHA-256 digest of a canonical text, in lowercase hex. */
public record ContentHash(String hex) implements Comparable<ContentHash> {

    public ContentHash {
        requireNonNull(hex);
        if (hex.length() != 64) throw new IllegalArgumentException("Not a SHA-256 hex digest: " + hex);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ContentHash parse(String hex) {
        return new ContentHash(hex.toLowerCase());
    }

    public static ContentHash of(String text) {
        return new ContentHash(HexFormat.of().formatHex(sha256().digest(text.getBytes(StandardCharsets.UTF_8))));
    }

    /** Order- and duplicate-insensitive digest of a set of hashes. */
    public static ContentHash ofSet(Collection<ContentHash> hashes) {
        var md = sha256();
        hashes.stream().distinct().sorted().forEach(h -> md.update(h.hex.getBytes(StandardCharsets.US_ASCII)));
        return new ContentHash(HexFormat.of().formatHex(md.digest()));
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public String shortHex() {
        return hex.substring(0, 12);
    }

    @Override
    public int compareTo(ContentHash o) {
        return hex.compareTo(o.hex);
    }

    @JsonValue
    @Override
    public String toString() {
        return hex;
    }
}
