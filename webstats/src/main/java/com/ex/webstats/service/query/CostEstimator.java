package com.ex.webstats.service.query;

import java.math.BigDecimal;
import java.math.RoundingMode;

import org.springframework.stereotype.Service;

import com.ex.webstats.WarehouseProps;
import com.ex.webstats.data.query.EstimateResponse;
import com.ex.webstats.data.query.QueryRequest;
import com.ex.webstats.data.query.QueryStats;
import com.ex.webstats.service.audit.AuditAnnotator;
import com.ex.webstats.service.warehouse.WarehouseClient;
import com.ex.webstats.service.warehouse.WarehouseClient.DryRunStatistics;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Dry-run based cost estimate. GB = bytes / 2^30, cost = bytes / 2^40 × price per TB.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CostEstimator {

    static final BigDecimal BYTES_PER_MB = BigDecimal.valueOf(1L << 20);
    static final BigDecimal BYTES_PER_GB = BigDecimal.valueOf(1L << 30);
    static final BigDecimal BYTES_PER_TB = BigDecimal.valueOf(1L << 40);

    private final WarehouseClient warehouse;
    private final AuditAnnotator auditAnnotator;
    private final WarehouseProps props;

    /**
     * Advisory estimate for an already resolved request. The request itself is not touched;
     * a dry-run copy is annotated and submitted.
     *
     * @return stats, or {@code null} when the dry run fails
     */
    public QueryStats estimate(QueryRequest resolved, String navIdent, String analysisType) {
        try {
            QueryRequest dry = auditAnnotator.annotate(resolved.copy(true), navIdent, analysisType);
            DryRunStatistics stats = warehouse.dryRun(dry);
            return toStats(stats.totalBytesProcessed());
        } catch (RuntimeException e) {
            log.warn("[Cost] Dry run failed, continuing without stats: {}", e.getMessage());
            return null;
        }
    }

    /** Estimate endpoint variant: failure is the caller's error. Cost is computed on billed bytes. */
    public EstimateResponse estimateDetailed(QueryRequest resolved, String navIdent, String analysisType) {
        QueryRequest dry = auditAnnotator.annotate(resolved.copy(true), navIdent, analysisType);
        DryRunStatistics stats = warehouse.dryRun(dry);

        long processed = stats.totalBytesProcessed();
        long billed = stats.billedOrProcessed();
        log.info("[Cost] Dry run: {} bytes processed, {} billed, cacheHit={}", processed, billed, stats.cacheHit());

        return new EstimateResponse(
                true,
                processed,
                billed,
                divide(processed, BYTES_PER_MB, 2),
                divide(processed, BYTES_PER_GB, 2),
                cost(billed),
                stats.cacheHit());
    }

    public QueryStats toStats(long bytesProcessed) {
        return new QueryStats(bytesProcessed, divide(bytesProcessed, BYTES_PER_GB, 2), cost(bytesProcessed));
    }

    BigDecimal cost(long bytes) {
        return BigDecimal.valueOf(bytes)
                .multiply(BigDecimal.valueOf(props.getPricePerTerabyte()))
                .divide(BYTES_PER_TB, 3, RoundingMode.HALF_UP);
    }

    private static BigDecimal divide(long bytes, BigDecimal unit, int scale) {
        return BigDecimal.valueOf(bytes).divide(unit, scale, RoundingMode.HALF_UP);
    }
}
