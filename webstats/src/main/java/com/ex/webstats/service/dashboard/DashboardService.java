package com.ex.webstats.service.dashboard;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

import org.springframework.stereotype.Service;

import com.ex.webstats.WarehouseProps;
import com.ex.webstats.data.chart.ChartDefinition;
import com.ex.webstats.data.chart.DashboardConfig;
import com.ex.webstats.data.query.FilterState;
import com.ex.webstats.data.query.QueryRequest;
import com.ex.webstats.data.query.QueryStats;
import com.ex.webstats.service.batch.BatchGroup;
import com.ex.webstats.service.batch.BatchPlan;
import com.ex.webstats.service.batch.BatchPlanner;
import com.ex.webstats.service.batch.ClientSideAggregator;
import com.ex.webstats.service.query.CostEstimator;
import com.ex.webstats.service.query.QueryExecutionException;
import com.ex.webstats.service.query.QueryExecutionService;
import com.ex.webstats.sql.TemplateResolver;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads every data chart of a dashboard: the combined session scan and each individual
 * chart run side by side on the dashboard executor. A failed chart is reported on its
 * own result; a failed combined scan sends its charts back to individual execution.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DashboardService {

    private final DashboardRegistry registry;
    private final TemplateResolver templateResolver;
    private final BatchPlanner batchPlanner;
    private final ClientSideAggregator aggregator;
    private final QueryExecutionService queryService;
    private final CostEstimator costEstimator;
    private final WarehouseProps props;
    private final Executor dashboardExecutor;

    public DashboardConfig config(String dashboardId) {
        return registry.get(dashboardId);
    }

    public DashboardResult load(String dashboardId, String websiteId, FilterState filters,
                                String navIdent, String analysisType) {
        DashboardConfig config = registry.get(dashboardId);
        ZonedDateTime now = ZonedDateTime.now(props.zone());
        BatchPlan plan = batchPlanner.plan(config.charts(), websiteId, filters, now);

        List<CompletableFuture<Map<String, ChartResult>>> tasks = new ArrayList<>();
        for (BatchGroup group : plan.groups()) {
            tasks.add(submit(() -> runGroup(group, websiteId, now, navIdent, analysisType)));
        }
        for (ChartDefinition chart : plan.individual()) {
            tasks.add(submit(() -> Map.of(chart.id(), runChart(chart, websiteId, filters, now, navIdent, analysisType))));
        }

        Map<String, ChartResult> byId = new LinkedHashMap<>();
        tasks.forEach(t -> byId.putAll(t.join()));

        // dashboard order
        List<ChartResult> results = new ArrayList<>();
        long total = 0;
        for (ChartDefinition chart : config.charts()) {
            ChartResult r = byId.get(chart.id());
            if (r == null) continue;
            results.add(r);
            total += r.bytesProcessed();
        }
        return new DashboardResult(dashboardId, config.title(), results, total);
    }

    // saturated pool → run on the request thread
    private CompletableFuture<Map<String, ChartResult>> submit(Supplier<Map<String, ChartResult>> task) {
        try {
            return CompletableFuture.supplyAsync(task, dashboardExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Dashboard executor saturated, running chart on caller thread");
            return CompletableFuture.completedFuture(task.get());
        }
    }

    /* ===== combined scan ===== */

    Map<String, ChartResult> runGroup(BatchGroup group, String websiteId, ZonedDateTime now,
                                      String navIdent, String analysisType) {
        Map<String, ChartResult> out = new LinkedHashMap<>();
        try {
            log.info("[QueryBatcher] Executing combined session query for: {}", group.attributes());
            QueryRequest combined = queryService.newRequest(group.combinedSql(), null);
            List<Map<String, Object>> rows = queryService.execute(combined, navIdent, analysisType);
            QueryStats stats = costEstimator.estimate(combined, navIdent, analysisType);
            long batchBytes = stats == null ? 0L : stats.totalBytesProcessed();

            Long siteTotal = group.siteTotalSql() == null ? null : siteTotal(group.siteTotalSql(), navIdent, analysisType);

            long[] shares = ClientSideAggregator.apportionBytes(batchBytes, group.charts().size());
            for (int i = 0; i < group.charts().size(); i++) {
                ChartDefinition chart = group.charts().get(i);
                List<Map<String, Object>> data = aggregator.aggregate(
                        rows, group.attributeOf(chart), group.filters().metricType(), siteTotal);
                out.put(chart.id(), ChartResult.batched(chart.id(), chart.title(), data, shares[i]));
            }
            log.info("[QueryBatcher] Batched query processed {} bytes for {} charts", batchBytes, group.charts().size());
            return out;
        } catch (RuntimeException e) {
            log.warn("[QueryBatcher] Batched fetch failed, falling back to individual: {}", e.getMessage());
            out.clear();
            for (ChartDefinition chart : group.charts()) {
                out.put(chart.id(), runChart(chart, websiteId, group.filters(), now, navIdent, analysisType));
            }
            return out;
        }
    }

    // proportion denominator; null → aggregator counts sessions in the combined rows
    private Long siteTotal(String sql, String navIdent, String analysisType) {
        try {
            List<Map<String, Object>> rows = queryService.execute(queryService.newRequest(sql, null), navIdent, analysisType);
            if (!rows.isEmpty() && rows.get(0).get("total") instanceof Number n && n.longValue() > 0) {
                log.info("[QueryBatcher] Total site visitors for proportion: {}", n.longValue());
                return n.longValue();
            }
            return null;
        } catch (RuntimeException e) {
            log.warn("[QueryBatcher] Failed to fetch total site visitors: {}", e.getMessage());
            return null;
        }
    }

    /* ===== single chart ===== */

    ChartResult runChart(ChartDefinition chart, String websiteId, FilterState filters, ZonedDateTime now,
                         String navIdent, String analysisType) {
        try {
            String sql = templateResolver.resolve(chart.sql(), websiteId, filters, now);
            QueryRequest request = queryService.newRequest(sql, null);
            List<Map<String, Object>> rows = queryService.execute(request, navIdent, analysisType);
            QueryStats stats = costEstimator.estimate(request, navIdent, analysisType);
            return ChartResult.individual(chart.id(), chart.title(), rows, stats == null ? 0L : stats.totalBytesProcessed());
        } catch (QueryExecutionException e) {
            return ChartResult.failed(chart.id(), chart.title(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Chart {} failed: {}", chart.id(), e.getMessage(), e);
            return ChartResult.failed(chart.id(), chart.title(), e.getMessage());
        }
    }
}
