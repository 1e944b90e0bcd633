package br.com.analytics.pipeline.profit_analytics_batch.config;

import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.env.Environment;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;

import javax.sql.DataSource;

/**
 * Source and metric tables live in the app database; Spring Batch metadata in its own.
 */
@Configuration
public class DataSourceConfig {

    private final Environment env;

    public DataSourceConfig(Environment env) {
        this.env = env;
    }

    @Primary
    @Bean(name = "appDataSource")
    public DataSource appDataSource() {
        return hikari("spring.datasource.app", "analytics-app");
    }

    @Bean(name = "batchDataSource")
    public DataSource batchDataSource() {
        return hikari("spring.datasource.batch", "analytics-batch");
    }

    @Primary
    @Bean(name = "appTransactionManager")
    public DataSourceTransactionManager appTransactionManager(@Qualifier("appDataSource") DataSource appDataSource) {
        return new DataSourceTransactionManager(appDataSource);
    }

    @Bean(name = "batchTransactionManager")
    public DataSourceTransactionManager batchTransactionManager(@Qualifier("batchDataSource") DataSource batchDataSource) {
        return new DataSourceTransactionManager(batchDataSource);
    }

    private HikariDataSource hikari(String prefix, String poolName) {
        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setPoolName(poolName);
        dataSource.setDriverClassName(env.getProperty(prefix + ".driver-class-name"));
        dataSource.setJdbcUrl(env.getProperty(prefix + ".url"));
        dataSource.setUsername(env.getProperty(prefix + ".username"));
        dataSource.setPassword(env.getProperty(prefix + ".password"));
        dataSource.setMaximumPoolSize(env.getProperty(prefix + ".maximum-pool-size", Integer.class, 10));
        return dataSource;
    }
}
