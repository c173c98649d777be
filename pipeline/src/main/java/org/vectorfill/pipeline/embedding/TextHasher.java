package org.vectorfill.pipeline.embedding;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 of the text that is (or was) embedded. Stored next to the embedding so that a changed
 * text can be told apart from an unchanged one without calling the model.
 */
public final class TextHasher {

    private TextHasher() {}

    public static String hash(String text) {
        var normalized = text == null ? "" : text.strip();
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(normalized.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
