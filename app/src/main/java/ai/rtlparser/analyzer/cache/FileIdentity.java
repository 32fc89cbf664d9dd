package ai.rtlparser.analyzer.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Cache key for one parsed file: its path plus a SHA-256 over the source and its CST dump.
 */
public record FileIdentity(String path, String contentHash) {

    public FileIdentity {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(contentHash, "contentHash");
    }

    public static FileIdentity of(String path, String sourceText, String treeText) {
        MessageDigest digest = sha256();
        digest.update(sourceText.getBytes(StandardCharsets.UTF_8));
        digest.update((byte) 0);
        digest.update(treeText.getBytes(StandardCharsets.UTF_8));
        return new FileIdentity(path, HexFormat.of().formatHex(digest.digest()));
    }

    static String hashOf(String text) {
        return HexFormat.of().formatHex(sha256().digest(text.getBytes(StandardCharsets.UTF_8)));
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }
}
