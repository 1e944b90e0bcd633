package br.com.analytics.pipeline.profit_analytics_batch.model;

/**
 * Any row read from the source store. The id is stable across pages and is what de-duplication keys on.
 */
public interface SourceRecord {

    String id();
}
