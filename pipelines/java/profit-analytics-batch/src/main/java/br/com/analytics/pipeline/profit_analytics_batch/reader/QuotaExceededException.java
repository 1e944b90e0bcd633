package br.com.analytics.pipeline.profit_analytics_batch.reader;

public class QuotaExceededException extends RuntimeException {

    public QuotaExceededException(String message) {
        super(message);
    }
}
