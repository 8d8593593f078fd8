package com.ex.webstats.data.query;

import java.time.LocalDate;
import java.util.List;

/**
 * Query context of one dashboard request.
 *
 * @param urlFilters      url paths to restrict to; empty means the default path {@code /}
 * @param pathOperator    how the paths are matched
 * @param dateRange       preset key ({@code last_7_days}, {@code last_month}, ...) or {@code custom}
 * @param customStartDate first day for {@code custom}
 * @param customEndDate   last day (inclusive) for {@code custom}
 * @param metricType      traffic unit to count
 */
public record FilterState(
        List<String> urlFilters,
        PathOperator pathOperator,
        String dateRange,
        LocalDate customStartDate,
        LocalDate customEndDate,
        MetricType metricType
) {
    public FilterState {
        urlFilters = urlFilters == null ? List.of() : List.copyOf(urlFilters);
        pathOperator = pathOperator == null ? PathOperator.EQUALS : pathOperator;
        metricType = metricType == null ? MetricType.VISITORS : metricType;
    }

    public static FilterState of(List<String> urlFilters, PathOperator op, String dateRange, MetricType metric) {
        return new FilterState(urlFilters, op, dateRange, null, null, metric);
    }

    public boolean hasUrlFilters() {
        return !urlFilters.isEmpty();
    }
}
