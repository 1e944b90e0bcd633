package br.com.analytics.pipeline.profit_analytics_batch.reader;

import br.com.analytics.pipeline.profit_analytics_batch.model.AnalyticsDataset;

public class LoaderFatalException extends RuntimeException {

    private final AnalyticsDataset dataset;
    private final int pageSize;

    public LoaderFatalException(AnalyticsDataset dataset, int pageSize, Throwable cause) {
        super("Failed to load dataset " + dataset.key() + " at page size " + pageSize + ": " + cause.getMessage(),
                cause);
        this.dataset = dataset;
        this.pageSize = pageSize;
    }

    public AnalyticsDataset getDataset() {
        return dataset;
    }

    public int getPageSize() {
        return pageSize;
    }
}
