package br.com.analytics.pipeline.profit_analytics_batch.model;

import org.jspecify.annotations.Nullable;

/**
 * Effective window of a cost record in epoch milliseconds. Missing bounds are open. A window whose end
 * lies before its start is malformed and never matches anything.
 */
public record EffectiveWindow(
        @Nullable Long from,
        @Nullable Long to
) {

    public static EffectiveWindow open() {
        return new EffectiveWindow(null, null);
    }

    public boolean isValid() {
        return from == null || to == null || to >= from;
    }

    public boolean contains(long timestamp) {
        if (!isValid()) {
            return false;
        }
        return (from == null || from <= timestamp) && (to == null || timestamp <= to);
    }

    /**
     * Whether the window touches [startInclusive, endExclusive).
     */
    public boolean overlaps(long startInclusive, long endExclusive) {
        if (!isValid()) {
            return false;
        }
        return (from == null || from < endExclusive) && (to == null || to >= startInclusive);
    }

    public boolean isClosed() {
        return from != null && to != null;
    }

    public long fromOrMin() {
        return from == null ? Long.MIN_VALUE : from;
    }
}
