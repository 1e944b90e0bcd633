package br.com.analytics.pipeline.profit_analytics_batch.reader;

import br.com.analytics.pipeline.profit_analytics_batch.model.VariantCostComponent;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;

public class VariantCostComponentRowMapper implements RowMapper<VariantCostComponent> {

    @Override
    public VariantCostComponent mapRow(ResultSet resultSet, int rowNum) throws SQLException {
        return new VariantCostComponent(
                resultSet.getString("id"),
                resultSet.getString("variantId"),
                ResultSets.money(resultSet, "cogsPerUnit"),
                ResultSets.money(resultSet, "shippingPerUnit"),
                ResultSets.money(resultSet, "handlingPerUnit"),
                ResultSets.money(resultSet, "paymentFeePercent"),
                ResultSets.money(resultSet, "paymentFixedPerItem"),
                ResultSets.window(resultSet),
                resultSet.getBoolean("isActive")
        );
    }
}
