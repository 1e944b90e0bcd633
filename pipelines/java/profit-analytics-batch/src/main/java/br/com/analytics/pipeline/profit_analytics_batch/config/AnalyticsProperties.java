package br.com.analytics.pipeline.profit_analytics_batch.config;

import br.com.analytics.pipeline.profit_analytics_batch.model.AnalyticsDataset;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.ZoneId;

@ConfigurationProperties(prefix = "analytics")
public record AnalyticsProperties(
        @DefaultValue("UTC") String zoneId,
        @DefaultValue Loader loader
) {

    public static AnalyticsProperties defaults() {
        return new AnalyticsProperties("UTC", Loader.defaults());
    }

    public ZoneId zone() {
        return ZoneId.of(zoneId);
    }

    /**
     * Page sizes for the chunked loader. The floors are the smallest size a quota failure may shrink a page to.
     */
    public record Loader(
            @DefaultValue("20") int orderPageSize,
            @DefaultValue("1") int orderPageFloor,
            @DefaultValue("400") int supplementalPageSize,
            @DefaultValue("200") int secondaryPageSize,
            @DefaultValue("25") int supplementalPageFloor,
            @DefaultValue("4096") int maxReadsPerRequest,
            @DefaultValue("true") boolean concurrentSupplementalFetch
    ) {

        public static Loader defaults() {
            return new Loader(20, 1, 400, 200, 25, 4096, true);
        }

        public int initialPageSize(AnalyticsDataset dataset) {
            if (!dataset.isSupplemental()) {
                return orderPageSize;
            }
            return dataset.isSecondary() ? secondaryPageSize : supplementalPageSize;
        }

        public int pageFloor(AnalyticsDataset dataset) {
            return dataset.isSupplemental() ? supplementalPageFloor : orderPageFloor;
        }
    }
}
