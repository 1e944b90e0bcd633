package br.com.analytics.pipeline.profit_analytics_batch.model;

import br.com.analytics.pipeline.profit_analytics_batch.support.SafeNumbers;

import java.math.BigDecimal;
import java.time.LocalDate;

public record AdInsight(
        String id,
        LocalDate date,
        String platform,
        BigDecimal spend,
        long impressions,
        long clicks,
        long conversions,
        BigDecimal conversionValue,
        long reach,
        long videoViews,
        long video3SecViews
) implements SourceRecord {

    public AdInsight {
        spend = SafeNumbers.money(spend);
        conversionValue = SafeNumbers.money(conversionValue);
    }
}
