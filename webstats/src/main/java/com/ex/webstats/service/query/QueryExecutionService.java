package com.ex.webstats.service.query;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.ex.webstats.WarehouseProps;
import com.ex.webstats.data.query.QueryRequest;
import com.ex.webstats.data.query.QueryResponse;
import com.ex.webstats.data.query.QueryStats;
import com.ex.webstats.service.audit.AuditAnnotator;
import com.ex.webstats.service.warehouse.WarehouseClient;
import com.ex.webstats.service.warehouse.WarehouseException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class QueryExecutionService {

    private final WarehouseClient warehouse;
    private final AuditAnnotator auditAnnotator;
    private final CostEstimator costEstimator;
    private final WarehouseProps props;

    public QueryRequest newRequest(String sql, Map<String, Object> params) {
        return QueryRequest.builder()
                .sql(sql)
                .location(props.getLocation())
                .params(params == null ? new LinkedHashMap<>() : new LinkedHashMap<>(params))
                .build();
    }

    /** Executes, then dry-runs for stats. Only the execution can fail the call. */
    public QueryResponse run(String sql, Map<String, Object> params, String navIdent, String analysisType) {
        QueryRequest base = newRequest(sql, params);
        List<Map<String, Object>> rows = execute(base, navIdent, analysisType);
        QueryStats stats = costEstimator.estimate(base, navIdent, analysisType);
        return QueryResponse.of(rows, stats);
    }

    /** Annotated real execution of a copy of {@code base}. */
    public List<Map<String, Object>> execute(QueryRequest base, String navIdent, String analysisType) {
        QueryRequest request = auditAnnotator.annotate(base.copy(false), navIdent, analysisType);
        log.info("[BigQuery] Submitting query for {} ({})", request.getLabels().get("nav_ident"),
                request.getLabels().getOrDefault("analysis_type", "-"));
        try {
            return warehouse.execute(request);
        } catch (WarehouseException e) {
            log.error("[BigQuery] Query failed: {}", e.getMessage(), e);
            throw new QueryExecutionException(e.getMessage(), e);
        }
    }
}
