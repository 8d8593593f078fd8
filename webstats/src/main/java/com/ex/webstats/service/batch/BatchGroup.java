package com.ex.webstats.service.batch;

import java.util.List;
import java.util.Map;

import com.ex.webstats.data.chart.ChartDefinition;
import com.ex.webstats.data.query.FilterState;

/**
 * Charts served by one combined session scan.
 *
 * @param attributeByChart chart id → grouping attribute
 * @param attributes       union of attributes selected by {@link #combinedSql()}, first-seen order
 * @param siteTotalSql     distinct sessions of the whole site in the window, or {@code null}
 *                         unless the metric is proportion
 */
public record BatchGroup(
        List<ChartDefinition> charts,
        Map<String, String> attributeByChart,
        FilterState filters,
        List<String> attributes,
        String combinedSql,
        String siteTotalSql
) {
    public BatchGroup {
        charts = List.copyOf(charts);
        attributeByChart = Map.copyOf(attributeByChart);
        attributes = List.copyOf(attributes);
    }

    public String attributeOf(ChartDefinition chart) {
        return attributeByChart.get(chart.id());
    }
}
