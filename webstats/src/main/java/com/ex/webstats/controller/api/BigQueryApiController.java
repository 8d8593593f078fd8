package com.ex.webstats.controller.api;

import java.security.Principal;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.ex.webstats.data.query.EstimateResponse;
import com.ex.webstats.data.query.QueryResponse;
import com.ex.webstats.service.audit.AnalysisTypes;
import com.ex.webstats.service.audit.AuditAnnotator;
import com.ex.webstats.service.query.CostEstimator;
import com.ex.webstats.service.query.QueryExecutionException;
import com.ex.webstats.service.query.QueryExecutionService;
import com.ex.webstats.service.warehouse.WarehouseException;
import com.ex.webstats.sql.ParameterInliner;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/bigquery")
public class BigQueryApiController {

    private final QueryExecutionService queryService;
    private final CostEstimator costEstimator;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> query(@RequestBody QueryBody req, Principal principal,
                                   @RequestHeader(value = HttpHeaders.REFERER, required = false) String referer) {
        if (req.isBlank()) return queryRequired();

        log.info("[BigQuery API] Request received");
        QueryResponse res = queryService.run(req.query(), req.params(),
                AuditAnnotator.identOf(principal), analysisType(req, referer));
        return ResponseEntity.ok(res);
    }

    @PostMapping(value = "/estimate", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> estimate(@RequestBody QueryBody req, Principal principal,
                                      @RequestHeader(value = HttpHeaders.REFERER, required = false) String referer) {
        if (req.isBlank()) return queryRequired();

        EstimateResponse res = costEstimator.estimateDetailed(
                queryService.newRequest(req.query(), req.params()),
                AuditAnnotator.identOf(principal), analysisType(req, referer));
        return ResponseEntity.ok(res);
    }

    /** Bound values written into the query text, for display and copy/paste. */
    @PostMapping(value = "/preview", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> preview(@RequestBody QueryBody req) {
        if (req.isBlank()) return queryRequired();
        return ResponseEntity.ok(new PreviewResult(ParameterInliner.inline(req.query(), req.params())));
    }

    /* ===== DTO ===== */
    public record QueryBody(String query, String analysisType, Map<String, Object> params) {
        boolean isBlank() {
            return query == null || query.isBlank();
        }
    }
    public record PreviewResult(String sql) {}

    /* ===== error handlers ===== */

    @ExceptionHandler(QueryExecutionException.class)
    public ResponseEntity<?> handleExecution(QueryExecutionException ex) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error(ex, "Failed to execute query"));
    }

    @ExceptionHandler(WarehouseException.class)
    public ResponseEntity<?> handleWarehouse(WarehouseException ex) {
        log.error("[BigQuery API] Dry run failed: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error(ex, "Failed to estimate query cost"));
    }

    /* ===== helpers ===== */

    private static String analysisType(QueryBody req, String referer) {
        String fallback = req.analysisType() == null || req.analysisType().isBlank()
                ? AnalysisTypes.SQL_TOOL
                : req.analysisType();
        return AnalysisTypes.override(referer, fallback);
    }

    private static ResponseEntity<?> queryRequired() {
        return ResponseEntity.badRequest().body(Map.of("error", "Query is required"));
    }

    private static Map<String, Object> error(RuntimeException ex, String fallback) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("error", ex.getMessage() != null ? ex.getMessage() : fallback);
        m.put("details", String.valueOf(ex.getCause() != null ? ex.getCause() : ex));
        return m;
    }
}
