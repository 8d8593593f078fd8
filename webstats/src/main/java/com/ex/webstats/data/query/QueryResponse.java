package com.ex.webstats.data.query;

import java.util.List;
import java.util.Map;

// queryStats is null when the dry run failed
public record QueryResponse(
        boolean success,
        List<Map<String, Object>> data,
        int rowCount,
        QueryStats queryStats
) {
    public static QueryResponse of(List<Map<String, Object>> rows, QueryStats stats) {
        return new QueryResponse(true, rows, rows.size(), stats);
    }
}
