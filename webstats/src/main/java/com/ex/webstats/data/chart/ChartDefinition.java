package com.ex.webstats.data.chart;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A chart on a dashboard. Read from configuration once and never mutated.
 *
 * @param sql               query template, absent for heading/score widgets
 * @param groupingDimension session attribute the chart groups by; when absent the
 *                          batch planner derives it from the template
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChartDefinition(
        String id,
        String title,
        @JsonProperty("type") ChartKind kind,
        String width,
        String sql,
        String groupingDimension
) {
    public boolean hasQuery() {
        return sql != null && !sql.isBlank();
    }

    public ChartDefinition withId(String newId) {
        return new ChartDefinition(newId, title, kind, width, sql, groupingDimension);
    }

    public ChartDefinition withSql(String newSql) {
        return new ChartDefinition(id, title, kind, width, newSql, groupingDimension);
    }
}
