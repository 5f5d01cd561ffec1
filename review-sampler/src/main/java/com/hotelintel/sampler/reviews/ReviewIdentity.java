package com.hotelintel.sampler.reviews;

import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;

/**
 * Content-addressed review identifiers.
 *
 * The id depends only on (itemId, normalised content, author), so a review fetched
 * again through another pool or on a later run maps to the same row.
 */
public final class ReviewIdentity {

    private static final char SEPARATOR = '\u001f';
    private static final int HASH_LENGTH = 16;

    private ReviewIdentity() {
    }

    public static String of(String itemId, String content, String author) {
        if (itemId == null || itemId.isBlank()) {
            throw new IllegalArgumentException("itemId is required for a review id");
        }
        String key = itemId + SEPARATOR + normalize(content) + SEPARATOR + normalize(author);
        String digest = DigestUtils.md5DigestAsHex(key.getBytes(StandardCharsets.UTF_8));
        return itemId + "_" + digest.substring(0, HASH_LENGTH);
    }

    /** Whitespace-insensitive form used for hashing; null becomes empty. */
    static String normalize(String text) {
        if (text == null) return "";
        return text.strip().replaceAll("\\s+", " ");
    }
}
