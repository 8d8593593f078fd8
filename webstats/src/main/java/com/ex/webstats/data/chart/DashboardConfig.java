package com.ex.webstats.data.chart;

import java.util.List;

public record DashboardConfig(String title, String description, List<ChartDefinition> charts) {
    public DashboardConfig {
        charts = charts == null ? List.of() : List.copyOf(charts);
    }
}
