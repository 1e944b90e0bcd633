package br.com.analytics.pipeline.profit_analytics_batch.reader;

import br.com.analytics.pipeline.profit_analytics_batch.model.AdInsight;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;

public class AdInsightRowMapper implements RowMapper<AdInsight> {

    @Override
    public AdInsight mapRow(ResultSet resultSet, int rowNum) throws SQLException {
        return new AdInsight(
                resultSet.getString("id"),
                resultSet.getObject("metricDate", LocalDate.class),
                resultSet.getString("platform"),
                ResultSets.money(resultSet, "spend"),
                ResultSets.count(resultSet, "impressions"),
                ResultSets.count(resultSet, "clicks"),
                ResultSets.count(resultSet, "conversions"),
                ResultSets.money(resultSet, "conversionValue"),
                ResultSets.count(resultSet, "reach"),
                ResultSets.count(resultSet, "videoViews"),
                ResultSets.count(resultSet, "video3SecViews")
        );
    }
}
