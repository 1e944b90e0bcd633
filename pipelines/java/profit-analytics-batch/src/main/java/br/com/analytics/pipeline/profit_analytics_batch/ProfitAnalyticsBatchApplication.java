package br.com.analytics.pipeline.profit_analytics_batch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProfitAnalyticsBatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProfitAnalyticsBatchApplication.class, args);
    }
}
