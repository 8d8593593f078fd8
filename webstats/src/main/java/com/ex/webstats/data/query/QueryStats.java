package com.ex.webstats.data.query;

import java.math.BigDecimal;

public record QueryStats(
        long totalBytesProcessed,
        BigDecimal totalBytesProcessedGB,
        BigDecimal estimatedCostUSD
) {}
