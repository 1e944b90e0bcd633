package br.com.analytics.pipeline.profit_analytics_batch.reader;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One bounded fetch against a dataset.
 *
 * @param cursor where the next page starts, null or empty once the dataset is exhausted
 * @param done   the store's own end-of-data flag; informational only, the loader stops on a missing or repeated
 *               cursor and follows a fresh cursor even when this is set
 */
public record Page<T>(
        List<T> records,
        @Nullable String cursor,
        boolean done
) {

    public Page {
        records = records == null ? List.of() : List.copyOf(records);
    }
}
