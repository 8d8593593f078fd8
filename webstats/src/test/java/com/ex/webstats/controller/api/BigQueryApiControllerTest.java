package com.ex.webstats.controller.api;

import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.ex.webstats.data.query.EstimateResponse;
import com.ex.webstats.data.query.QueryResponse;
import com.ex.webstats.service.query.CostEstimator;
import com.ex.webstats.service.query.QueryExecutionException;
import com.ex.webstats.service.query.QueryExecutionService;
import com.ex.webstats.service.warehouse.WarehouseException;

@WebMvcTest(BigQueryApiController.class)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class BigQueryApiControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private QueryExecutionService queryService;
    @MockBean
    private CostEstimator costEstimator;

    @Test
    void should_reject_missing_query() throws Exception {
        mvc.perform(post("/api/bigquery").contentType(MediaType.APPLICATION_JSON).content("{\"query\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Query is required"));

        verifyNoInteractions(queryService);
    }

    @Test
    void should_return_rows_with_null_stats() throws Exception {
        when(queryService.run(eq("SELECT 1 AS n"), any(), eq("UNKNOWN"), eq("Sqlverktoy")))
                .thenReturn(QueryResponse.of(List.of(Map.of("n", 1)), null));

        mvc.perform(post("/api/bigquery").contentType(MediaType.APPLICATION_JSON).content("{\"query\":\"SELECT 1 AS n\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.rowCount").value(1))
                .andExpect(jsonPath("$.data[0].n").value(1))
                .andExpect(jsonPath("$.queryStats").value(nullValue()));
    }

    @Test
    void should_label_queries_from_analysis_pages() throws Exception {
        when(queryService.run(any(), any(), any(), any())).thenReturn(QueryResponse.of(List.of(), null));

        mvc.perform(post("/api/bigquery")
                        .header(HttpHeaders.REFERER, "https://stats.example.no/trafikkanalyse")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"SELECT 1\",\"analysisType\":\"Custom\"}"))
                .andExpect(status().isOk());

        verify(queryService).run(eq("SELECT 1"), any(), eq("UNKNOWN"), eq("trafikkanalyse"));
    }

    @Test
    void should_map_execution_failure_to_server_error() throws Exception {
        when(queryService.run(any(), any(), any(), any()))
                .thenThrow(new QueryExecutionException("Table not found", new WarehouseException("Table not found")));

        mvc.perform(post("/api/bigquery").contentType(MediaType.APPLICATION_JSON).content("{\"query\":\"SELECT * FROM x\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Table not found"))
                .andExpect(jsonPath("$.details").exists());
    }

    @Test
    void should_return_estimate() throws Exception {
        when(costEstimator.estimateDetailed(any(), eq("UNKNOWN"), eq("Sqlverktoy"))).thenReturn(new EstimateResponse(
                true, 1L << 30, 1L << 30, new BigDecimal("1024.00"), new BigDecimal("1.00"), new BigDecimal("0.006"), false));

        mvc.perform(post("/api/bigquery/estimate").contentType(MediaType.APPLICATION_JSON).content("{\"query\":\"SELECT 1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalBytesProcessed").value(1L << 30))
                .andExpect(jsonPath("$.totalBytesProcessedGB").value(1.0))
                .andExpect(jsonPath("$.cacheHit").value(false));
    }

    @Test
    void should_map_failed_estimate_to_server_error() throws Exception {
        when(costEstimator.estimateDetailed(any(), any(), any())).thenThrow(new WarehouseException("Syntax error"));

        mvc.perform(post("/api/bigquery/estimate").contentType(MediaType.APPLICATION_JSON).content("{\"query\":\"SELEC 1\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Syntax error"));
    }

    @Test
    void should_inline_parameters_for_preview() throws Exception {
        mvc.perform(post("/api/bigquery/preview").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"SELECT * FROM t WHERE a = @name AND b = @n\",\"params\":{\"name\":\"O'Brien\",\"n\":5}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sql").value("SELECT * FROM t WHERE a = 'O\\'Brien' AND b = 5"));
    }
}
