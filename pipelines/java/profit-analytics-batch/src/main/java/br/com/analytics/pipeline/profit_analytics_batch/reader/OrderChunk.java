package br.com.analytics.pipeline.profit_analytics_batch.reader;

import br.com.analytics.pipeline.profit_analytics_batch.model.Customer;
import br.com.analytics.pipeline.profit_analytics_batch.model.Fulfillment;
import br.com.analytics.pipeline.profit_analytics_batch.model.Order;
import br.com.analytics.pipeline.profit_analytics_batch.model.OrderLineItem;
import br.com.analytics.pipeline.profit_analytics_batch.model.Product;
import br.com.analytics.pipeline.profit_analytics_batch.model.Refund;
import br.com.analytics.pipeline.profit_analytics_batch.model.Transaction;
import br.com.analytics.pipeline.profit_analytics_batch.model.Variant;
import br.com.analytics.pipeline.profit_analytics_batch.model.VariantCostComponent;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A page of orders together with every child row belonging to those orders. As with {@link Page}, {@code done}
 * is informational and paging follows the cursor.
 */
public record OrderChunk(
        List<Order> orders,
        List<OrderLineItem> orderItems,
        List<Transaction> transactions,
        List<Refund> refunds,
        List<Fulfillment> fulfillments,
        List<Customer> customers,
        List<Product> products,
        List<Variant> variants,
        List<VariantCostComponent> costComponents,
        @Nullable String cursor,
        boolean done
) {

    public static OrderChunk ofOrders(List<Order> orders, @Nullable String cursor, boolean done) {
        return new OrderChunk(orders, List.of(), List.of(), List.of(), List.of(), List.of(), List.of(),
                List.of(), List.of(), cursor, done);
    }
}
