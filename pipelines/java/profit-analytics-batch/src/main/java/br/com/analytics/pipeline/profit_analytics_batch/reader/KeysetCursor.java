package br.com.analytics.pipeline.profit_analytics_batch.reader;

import org.jspecify.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Opaque continuation token: the sort key and id of the last row a page returned.
 */
public record KeysetCursor(
        String sortKey,
        String id
) {

    private static final String SEPARATOR = "\n";

    public String encode() {
        String raw = sortKey + SEPARATOR + id;
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    public static @Nullable KeysetCursor decode(@Nullable String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        String raw;
        try {
            raw = new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Malformed page cursor: " + token, e);
        }
        int separator = raw.indexOf(SEPARATOR);
        if (separator < 0) {
            throw new IllegalArgumentException("Malformed page cursor: " + token);
        }
        return new KeysetCursor(raw.substring(0, separator), raw.substring(separator + 1));
    }
}
