package br.com.analytics.pipeline.profit_analytics_batch.reader;

import br.com.analytics.pipeline.profit_analytics_batch.model.Order;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;

public class OrderRowMapper implements RowMapper<Order> {

    @Override
    public Order mapRow(ResultSet resultSet, int rowNum) throws SQLException {
        return new Order(
                resultSet.getString("id"),
                resultSet.getString("organizationId"),
                resultSet.getLong("createdAt"),
                ResultSets.money(resultSet, "totalPrice"),
                ResultSets.money(resultSet, "subtotalPrice"),
                ResultSets.money(resultSet, "totalDiscounts"),
                ResultSets.money(resultSet, "totalShippingPrice"),
                ResultSets.money(resultSet, "totalTax"),
                ResultSets.count(resultSet, "totalQuantity"),
                resultSet.getString("customerId"),
                resultSet.getString("financialStatus"),
                resultSet.getString("fulfillmentStatus")
        );
    }
}
