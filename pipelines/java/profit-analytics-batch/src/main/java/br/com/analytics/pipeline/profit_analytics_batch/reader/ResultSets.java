package br.com.analytics.pipeline.profit_analytics_batch.reader;

import br.com.analytics.pipeline.profit_analytics_batch.model.EffectiveWindow;
import br.com.analytics.pipeline.profit_analytics_batch.support.SafeNumbers;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;

final class ResultSets {

    private ResultSets() {
    }

    static BigDecimal money(ResultSet resultSet, String column) throws SQLException {
        return SafeNumbers.money(resultSet.getObject(column));
    }

    static long count(ResultSet resultSet, String column) throws SQLException {
        return SafeNumbers.count(resultSet.getObject(column));
    }

    static Long nullableLong(ResultSet resultSet, String column) throws SQLException {
        long value = resultSet.getLong(column);
        return resultSet.wasNull() ? null : value;
    }

    static EffectiveWindow window(ResultSet resultSet) throws SQLException {
        return new EffectiveWindow(nullableLong(resultSet, "effectiveFrom"), nullableLong(resultSet, "effectiveTo"));
    }
}
