package com.ex.webstats.service.dashboard;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Rows of one chart. {@code bytesProcessed} is the chart's share of the combined scan
 * when {@code batched}; {@code error} is set instead of {@code data} when the chart failed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChartResult(
        String id,
        String title,
        List<Map<String, Object>> data,
        long bytesProcessed,
        boolean batched,
        String error
) {
    public static ChartResult individual(String id, String title, List<Map<String, Object>> data, long bytes) {
        return new ChartResult(id, title, data, bytes, false, null);
    }

    public static ChartResult batched(String id, String title, List<Map<String, Object>> data, long bytes) {
        return new ChartResult(id, title, data, bytes, true, null);
    }

    public static ChartResult failed(String id, String title, String error) {
        return new ChartResult(id, title, null, 0L, false, error);
    }

    public boolean failed() {
        return error != null;
    }
}
