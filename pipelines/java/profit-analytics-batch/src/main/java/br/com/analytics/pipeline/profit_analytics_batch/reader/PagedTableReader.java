package br.com.analytics.pipeline.profit_analytics_batch.reader;

import br.com.analytics.pipeline.profit_analytics_batch.model.AnalyticsDataset;
import br.com.analytics.pipeline.profit_analytics_batch.model.DateRange;
import br.com.analytics.pipeline.profit_analytics_batch.model.SourceRecord;
import org.jspecify.annotations.Nullable;

import java.util.Set;

/**
 * Cursor based access to the source store. Implementations throw {@link QuotaExceededException} when a
 * request would read more rows than the store allows in one call; any other failure is fatal to the caller.
 */
public interface PagedTableReader {

    OrderChunk fetchOrderChunk(String organizationId, DateRange range, Set<AnalyticsDataset> datasets,
                               @Nullable String cursor, int pageSize);

    Page<SourceRecord> fetchPage(String organizationId, DateRange range, AnalyticsDataset dataset,
                                 @Nullable String cursor, int pageSize);
}
