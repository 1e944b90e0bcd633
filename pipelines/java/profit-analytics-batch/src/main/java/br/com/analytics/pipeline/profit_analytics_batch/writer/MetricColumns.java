package br.com.analytics.pipeline.profit_analytics_batch.writer;

import br.com.analytics.pipeline.profit_analytics_batch.model.DerivedMetrics;
import br.com.analytics.pipeline.profit_analytics_batch.model.MetricField;
import br.com.analytics.pipeline.profit_analytics_batch.model.MetricTotals;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Column layout shared by the daily_metrics and aggregate_metrics tables.
 */
final class MetricColumns {

    private MetricColumns() {
    }

    static List<String> valueColumns() {
        List<String> columns = new ArrayList<>();
        for (MetricField field : MetricField.values()) {
            columns.add(field.column());
        }
        columns.addAll(DerivedMetrics.zero().asColumns().keySet());
        return columns;
    }

    /**
     * INSERT ... ON CONFLICT (keys) DO UPDATE statement whose named parameters match the column names.
     */
    static String upsertSql(String table, List<String> keyColumns, List<String> extraColumns) {
        List<String> columns = new ArrayList<>(keyColumns);
        columns.addAll(extraColumns);
        columns.addAll(valueColumns());
        List<String> updated = new ArrayList<>(extraColumns);
        updated.addAll(valueColumns());
        return "INSERT INTO " + table + " (" + String.join(", ", columns) + ") " +
                "VALUES (" + columns.stream().map(column -> ":" + column).collect(Collectors.joining(", ")) + ") " +
                "ON CONFLICT (" + String.join(", ", keyColumns) + ") DO UPDATE SET " +
                updated.stream().map(column -> column + " = EXCLUDED." + column).collect(Collectors.joining(", "));
    }

    static void addValues(MapSqlParameterSource params, MetricTotals totals, DerivedMetrics derived) {
        for (MetricField field : MetricField.values()) {
            params.addValue(field.column(), totals.get(field));
        }
        for (Map.Entry<String, BigDecimal> column : derived.asColumns().entrySet()) {
            params.addValue(column.getKey(), column.getValue());
        }
    }

    static MetricTotals readTotals(ResultSet resultSet) throws SQLException {
        MetricTotals totals = new MetricTotals();
        for (MetricField field : MetricField.values()) {
            totals.set(field, resultSet.getBigDecimal(field.column()));
        }
        return totals.rounded();
    }
}
