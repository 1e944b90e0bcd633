package br.com.analytics.pipeline.profit_analytics_batch.model;

import br.com.analytics.pipeline.profit_analytics_batch.support.SafeNumbers;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

import static br.com.analytics.pipeline.profit_analytics_batch.model.MetricField.AD_SPEND;
import static br.com.analytics.pipeline.profit_analytics_batch.model.MetricField.CLICKS;
import static br.com.analytics.pipeline.profit_analytics_batch.model.MetricField.COGS;
import static br.com.analytics.pipeline.profit_analytics_batch.model.MetricField.CONVERSIONS;
import static br.com.analytics.pipeline.profit_analytics_batch.model.MetricField.DISCOUNTS;
import static br.com.analytics.pipeline.profit_analytics_batch.model.MetricField.GROSS_SALES;
import static br.com.analytics.pipeline.profit_analytics_batch.model.MetricField.HANDLING_FEES;
import static br.com.analytics.pipeline.profit_analytics_batch.model.MetricField.IMPRESSIONS;
import static br.com.analytics.pipeline.profit_analytics_batch.model.MetricField.MARKETING_COSTS;
import static br.com.analytics.pipeline.profit_analytics_batch.model.MetricField.NEW_CUSTOMERS;
import static br.com.analytics.pipeline.profit_analytics_batch.model.MetricField.OPERATIONAL_COSTS;
import static br.com.analytics.pipeline.profit_analytics_batch.model.MetricField.ORDERS;
import static br.com.analytics.pipeline.profit_analytics_batch.model.MetricField.OTHER_COSTS;
import static br.com.analytics.pipeline.profit_analytics_batch.model.MetricField.PLATFORM_CONVERSION_VALUE;
import static br.com.analytics.pipeline.profit_analytics_batch.model.MetricField.REFUNDS;
import static br.com.analytics.pipeline.profit_analytics_batch.model.MetricField.RETURNING_CUSTOMERS;
import static br.com.analytics.pipeline.profit_analytics_batch.model.MetricField.REVENUE;
import static br.com.analytics.pipeline.profit_analytics_batch.model.MetricField.SESSIONS;
import static br.com.analytics.pipeline.profit_analytics_batch.model.MetricField.SHIPPING_COSTS;
import static br.com.analytics.pipeline.profit_analytics_batch.model.MetricField.TAXES_PAID;
import static br.com.analytics.pipeline.profit_analytics_batch.model.MetricField.TOTAL_CUSTOMERS;
import static br.com.analytics.pipeline.profit_analytics_batch.model.MetricField.TRANSACTION_FEES;
import static br.com.analytics.pipeline.profit_analytics_batch.model.MetricField.UNITS_SOLD;

/**
 * Ratios and profit figures derived from finished totals. Always recomputed from sums, never averaged.
 */
public record DerivedMetrics(
        BigDecimal customCosts,
        BigDecimal totalCosts,
        BigDecimal grossProfit,
        BigDecimal netProfit,
        BigDecimal grossProfitMargin,
        BigDecimal netProfitMargin,
        BigDecimal contributionMargin,
        BigDecimal contributionMarginPercentage,
        BigDecimal discountRate,
        BigDecimal refundRate,
        BigDecimal avgOrderValue,
        BigDecimal avgOrderCost,
        BigDecimal avgOrderProfit,
        BigDecimal adSpendPerOrder,
        BigDecimal unitsPerOrder,
        BigDecimal repeatCustomerRate,
        BigDecimal customerAcquisitionCost,
        BigDecimal blendedRoas,
        BigDecimal platformRoas,
        BigDecimal blendedCtr,
        BigDecimal blendedCpc,
        BigDecimal blendedCpm,
        BigDecimal costPerConversion,
        BigDecimal conversionRate
) {

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    public static DerivedMetrics from(MetricTotals totals) {
        BigDecimal revenue = totals.get(REVENUE);
        BigDecimal grossSales = totals.get(GROSS_SALES);
        BigDecimal cogs = totals.get(COGS);
        BigDecimal adSpend = totals.get(AD_SPEND);
        BigDecimal shipping = totals.get(SHIPPING_COSTS);
        BigDecimal transactionFees = totals.get(TRANSACTION_FEES);
        BigDecimal orders = totals.get(ORDERS);

        BigDecimal customCosts = totals.get(MARKETING_COSTS)
                .add(totals.get(OPERATIONAL_COSTS))
                .add(totals.get(OTHER_COSTS));
        BigDecimal totalCosts = cogs
                .add(totals.get(HANDLING_FEES))
                .add(adSpend)
                .add(shipping)
                .add(customCosts)
                .add(transactionFees)
                .add(totals.get(TAXES_PAID));
        BigDecimal grossProfit = grossSales.subtract(cogs);
        BigDecimal netProfit = revenue.subtract(totalCosts);
        BigDecimal contributionMargin = revenue.subtract(cogs.add(adSpend).add(shipping).add(transactionFees));

        BigDecimal conversionValue = totals.get(PLATFORM_CONVERSION_VALUE);
        BigDecimal platformRevenue = conversionValue.signum() > 0 ? conversionValue : revenue;

        return new DerivedMetrics(
                customCosts,
                totalCosts,
                grossProfit,
                netProfit,
                SafeNumbers.ratioPercent(grossProfit, grossSales),
                SafeNumbers.ratioPercent(netProfit, revenue),
                contributionMargin,
                SafeNumbers.ratioPercent(contributionMargin, revenue),
                SafeNumbers.ratioPercent(totals.get(DISCOUNTS), grossSales),
                SafeNumbers.ratioPercent(totals.get(REFUNDS), revenue),
                SafeNumbers.divide(revenue, orders),
                SafeNumbers.divide(totalCosts, orders),
                SafeNumbers.divide(netProfit, orders),
                SafeNumbers.divide(adSpend, orders),
                SafeNumbers.divide(totals.get(UNITS_SOLD), orders),
                SafeNumbers.ratioPercent(totals.get(RETURNING_CUSTOMERS), totals.get(TOTAL_CUSTOMERS)),
                SafeNumbers.divide(adSpend, totals.get(NEW_CUSTOMERS)),
                SafeNumbers.divide(revenue, adSpend),
                SafeNumbers.divide(platformRevenue, adSpend),
                SafeNumbers.ratioPercent(totals.get(CLICKS), totals.get(IMPRESSIONS)),
                SafeNumbers.divide(adSpend, totals.get(CLICKS)),
                SafeNumbers.divide(adSpend, totals.get(IMPRESSIONS)).multiply(THOUSAND),
                SafeNumbers.divide(adSpend, totals.get(CONVERSIONS)),
                SafeNumbers.ratioPercent(orders, totals.get(SESSIONS))
        );
    }

    public static DerivedMetrics zero() {
        return from(MetricTotals.empty()).rounded();
    }

    public DerivedMetrics rounded() {
        return new DerivedMetrics(
                SafeNumbers.round(customCosts),
                SafeNumbers.round(totalCosts),
                SafeNumbers.round(grossProfit),
                SafeNumbers.round(netProfit),
                SafeNumbers.round(grossProfitMargin),
                SafeNumbers.round(netProfitMargin),
                SafeNumbers.round(contributionMargin),
                SafeNumbers.round(contributionMarginPercentage),
                SafeNumbers.round(discountRate),
                SafeNumbers.round(refundRate),
                SafeNumbers.round(avgOrderValue),
                SafeNumbers.round(avgOrderCost),
                SafeNumbers.round(avgOrderProfit),
                SafeNumbers.round(adSpendPerOrder),
                SafeNumbers.round(unitsPerOrder),
                SafeNumbers.round(repeatCustomerRate),
                SafeNumbers.round(customerAcquisitionCost),
                SafeNumbers.round(blendedRoas),
                SafeNumbers.round(platformRoas),
                SafeNumbers.round(blendedCtr),
                SafeNumbers.round(blendedCpc),
                SafeNumbers.round(blendedCpm),
                SafeNumbers.round(costPerConversion),
                SafeNumbers.round(conversionRate)
        );
    }

    public Map<String, BigDecimal> asColumns() {
        Map<String, BigDecimal> columns = new LinkedHashMap<>();
        columns.put("custom_costs", customCosts);
        columns.put("total_costs", totalCosts);
        columns.put("gross_profit", grossProfit);
        columns.put("net_profit", netProfit);
        columns.put("gross_profit_margin", grossProfitMargin);
        columns.put("net_profit_margin", netProfitMargin);
        columns.put("contribution_margin", contributionMargin);
        columns.put("contribution_margin_percentage", contributionMarginPercentage);
        columns.put("discount_rate", discountRate);
        columns.put("refund_rate", refundRate);
        columns.put("avg_order_value", avgOrderValue);
        columns.put("avg_order_cost", avgOrderCost);
        columns.put("avg_order_profit", avgOrderProfit);
        columns.put("ad_spend_per_order", adSpendPerOrder);
        columns.put("units_per_order", unitsPerOrder);
        columns.put("repeat_customer_rate", repeatCustomerRate);
        columns.put("customer_acquisition_cost", customerAcquisitionCost);
        columns.put("blended_roas", blendedRoas);
        columns.put("platform_roas", platformRoas);
        columns.put("blended_ctr", blendedCtr);
        columns.put("blended_cpc", blendedCpc);
        columns.put("blended_cpm", blendedCpm);
        columns.put("cost_per_conversion", costPerConversion);
        columns.put("conversion_rate", conversionRate);
        return columns;
    }
}
