package com.tonindexer.ingestion.normalizer.filler;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Text comment rendering shared by transfer fillers. Plain comments never keep NUL characters.
 */
final class Comments {

    private Comments() {
    }

    static String stripNul(String comment) {
        return comment.replace("\u0000", "");
    }

    /**
     * Encrypted comments are kept as base64 of the raw bytes; plain ones are decoded as UTF-8.
     */
    static String render(byte[] comment, boolean encrypted) {
        if (comment == null) {
            return null;
        }
        if (encrypted) {
            return Base64.getEncoder().encodeToString(comment);
        }
        return stripNul(new String(comment, StandardCharsets.UTF_8));
    }
}
