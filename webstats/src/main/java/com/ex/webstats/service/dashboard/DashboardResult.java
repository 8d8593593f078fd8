package com.ex.webstats.service.dashboard;

import java.util.List;

public record DashboardResult(String dashboardId, String title, List<ChartResult> charts, long totalBytesProcessed) {
    public DashboardResult {
        charts = List.copyOf(charts);
    }
}
