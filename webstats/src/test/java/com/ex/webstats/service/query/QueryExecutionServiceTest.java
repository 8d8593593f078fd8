package com.ex.webstats.service.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.ex.webstats.WarehouseProps;
import com.ex.webstats.WarehousePropsFixture;
import com.ex.webstats.data.query.QueryRequest;
import com.ex.webstats.data.query.QueryResponse;
import com.ex.webstats.service.audit.AuditAnnotator;
import com.ex.webstats.service.warehouse.WarehouseClient;
import com.ex.webstats.service.warehouse.WarehouseClient.DryRunStatistics;
import com.ex.webstats.service.warehouse.WarehouseException;

@ExtendWith(MockitoExtension.class)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class QueryExecutionServiceTest {

    @Mock
    private WarehouseClient warehouse;

    private QueryExecutionService service;

    @BeforeEach
    void setUp() {
        WarehouseProps props = WarehousePropsFixture.props();
        AuditAnnotator annotator = new AuditAnnotator();
        service = new QueryExecutionService(warehouse, annotator, new CostEstimator(warehouse, annotator, props), props);
    }

    @Test
    void should_return_rows_without_stats_when_dry_run_fails() {
        when(warehouse.execute(any())).thenReturn(List.of(Map.of("n", 1L)));
        when(warehouse.dryRun(any())).thenThrow(new WarehouseException("dry run unavailable"));

        QueryResponse res = service.run("SELECT 1 AS n", null, "A1", "Sqlverktoy");

        assertTrue(res.success());
        assertEquals(1, res.rowCount());
        assertEquals(List.of(Map.of("n", 1L)), res.data());
        assertNull(res.queryStats());
    }

    @Test
    void should_keep_rows_when_dry_run_throws_an_unexpected_error() {
        when(warehouse.execute(any())).thenReturn(List.of(Map.of("n", 1L)));
        when(warehouse.dryRun(any())).thenThrow(new IllegalStateException("transport closed"));

        QueryResponse res = service.run("SELECT 1 AS n", null, "A1", "Sqlverktoy");

        assertTrue(res.success());
        assertEquals(List.of(Map.of("n", 1L)), res.data());
        assertNull(res.queryStats());
    }

    @Test
    void should_execute_before_estimating() {
        when(warehouse.execute(any())).thenReturn(List.of());
        when(warehouse.dryRun(any())).thenReturn(new DryRunStatistics(2048, null, false));

        QueryResponse res = service.run("SELECT 1", null, "A1", null);

        InOrder order = inOrder(warehouse);
        order.verify(warehouse).execute(any());
        order.verify(warehouse).dryRun(any());
        assertEquals(2048, res.queryStats().totalBytesProcessed());
        assertEquals(0, res.rowCount());
    }

    @Test
    void should_surface_execution_failure_without_estimating() {
        when(warehouse.execute(any())).thenThrow(new WarehouseException("Table not found"));

        QueryExecutionException ex = assertThrows(QueryExecutionException.class,
                () -> service.run("SELECT * FROM missing", null, "A1", null));

        assertEquals("Table not found", ex.getMessage());
        verify(warehouse, never()).dryRun(any());
    }

    @Test
    void should_submit_annotated_execution_in_configured_location() {
        when(warehouse.execute(any())).thenReturn(List.of());
        when(warehouse.dryRun(any())).thenReturn(new DryRunStatistics(0, null, false));

        service.run("SELECT @n", Map.of("n", 3), "A1", "Sqlverktoy");

        ArgumentCaptor<QueryRequest> sent = ArgumentCaptor.forClass(QueryRequest.class);
        verify(warehouse).execute(sent.capture());
        QueryRequest req = sent.getValue();
        assertEquals("europe-north1", req.getLocation());
        assertEquals("execution", req.getLabels().get("job_mode"));
        assertEquals("sqlverktoy", req.getLabels().get("analysis_type"));
        assertEquals(3, req.getParams().get("n"));
        assertTrue(req.getSql().startsWith("-- Nav ident: A1\n"));
    }
}
