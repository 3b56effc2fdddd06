package com.querytuner.util;

import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Content hash of query text. Lower-case SHA-256 hex over the UTF-8 bytes, no
 * normalization: a single changed space is a different query.
 */
public final class QueryHasher {

    private QueryHasher() {
    }

    public static String hash(String query) {
        return Hashing.sha256()
                .hashString(query == null ? "" : query, StandardCharsets.UTF_8)
                .toString();
    }
}
