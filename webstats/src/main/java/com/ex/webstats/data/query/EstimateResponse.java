package com.ex.webstats.data.query;

import java.math.BigDecimal;

public record EstimateResponse(
        boolean success,
        long totalBytesProcessed,
        long totalBytesBilled,
        BigDecimal totalBytesProcessedMB,
        BigDecimal totalBytesProcessedGB,
        BigDecimal estimatedCostUSD,
        boolean cacheHit
) {}
