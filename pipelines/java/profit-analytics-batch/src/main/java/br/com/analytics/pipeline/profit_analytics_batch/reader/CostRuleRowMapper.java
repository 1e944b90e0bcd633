package br.com.analytics.pipeline.profit_analytics_batch.reader;

import br.com.analytics.pipeline.profit_analytics_batch.model.CostCalculation;
import br.com.analytics.pipeline.profit_analytics_batch.model.CostFrequency;
import br.com.analytics.pipeline.profit_analytics_batch.model.CostRule;
import br.com.analytics.pipeline.profit_analytics_batch.model.CostRuleConfig;
import br.com.analytics.pipeline.profit_analytics_batch.model.CostType;
import org.springframework.jdbc.core.RowMapper;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;

public class CostRuleRowMapper implements RowMapper<CostRule> {

    @Override
    public CostRule mapRow(ResultSet resultSet, int rowNum) throws SQLException {
        CostType type = CostType.fromValue(resultSet.getString("type"));
        CostCalculation calculation = CostCalculation.fromValue(resultSet.getString("calculation"));

        Map<String, Object> rawConfig = new HashMap<>();
        BigDecimal fixedFee = resultSet.getBigDecimal("fixedFee");
        if (fixedFee != null) {
            rawConfig.put("fixedFee", fixedFee);
        }

        return new CostRule(
                resultSet.getString("id"),
                resultSet.getString("organizationId"),
                resultSet.getString("name"),
                type,
                calculation,
                CostFrequency.fromValue(resultSet.getString("frequency")),
                ResultSets.money(resultSet, "value"),
                CostRuleConfig.parse(type, calculation, rawConfig),
                ResultSets.window(resultSet),
                resultSet.getBoolean("isActive")
        );
    }
}
