package br.com.analytics.pipeline.profit_analytics_batch.reader;

import br.com.analytics.pipeline.profit_analytics_batch.model.OrderLineItem;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;

public class OrderLineItemRowMapper implements RowMapper<OrderLineItem> {

    @Override
    public OrderLineItem mapRow(ResultSet resultSet, int rowNum) throws SQLException {
        return new OrderLineItem(
                resultSet.getString("id"),
                resultSet.getString("orderId"),
                resultSet.getString("variantId"),
                ResultSets.count(resultSet, "quantity"),
                ResultSets.money(resultSet, "unitPrice"),
                ResultSets.money(resultSet, "lineDiscount")
        );
    }
}
