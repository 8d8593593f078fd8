package com.ex.webstats.service.warehouse;

import java.util.List;
import java.util.Map;

import com.ex.webstats.data.query.QueryRequest;

/**
 * Blocking request/response access to the warehouse. Timeouts and retries are the
 * implementation's business; callers only see {@link WarehouseException}.
 */
public interface WarehouseClient {

    /** Runs the query and returns its rows, column name → value, in schema order. */
    List<Map<String, Object>> execute(QueryRequest request);

    /** Submits the query as a dry run; no rows, no billing. */
    DryRunStatistics dryRun(QueryRequest request);

    record DryRunStatistics(long totalBytesProcessed, Long totalBytesBilled, boolean cacheHit) {
        public long billedOrProcessed() {
            return totalBytesBilled != null ? totalBytesBilled : totalBytesProcessed;
        }
    }
}
