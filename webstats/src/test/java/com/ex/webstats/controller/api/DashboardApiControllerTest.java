package com.ex.webstats.controller.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.ex.webstats.data.chart.ChartDefinition;
import com.ex.webstats.data.chart.ChartKind;
import com.ex.webstats.data.chart.DashboardConfig;
import com.ex.webstats.data.query.FilterState;
import com.ex.webstats.data.query.MetricType;
import com.ex.webstats.data.query.PathOperator;
import com.ex.webstats.service.dashboard.ChartResult;
import com.ex.webstats.service.dashboard.DashboardResult;
import com.ex.webstats.service.dashboard.DashboardService;

@WebMvcTest(DashboardApiController.class)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class DashboardApiControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private DashboardService dashboardService;

    @Test
    void should_return_dashboard_config() throws Exception {
        when(dashboardService.config("standard")).thenReturn(new DashboardConfig("Webstatistikk", null, List.of(
                new ChartDefinition("auto-id-0-table", "Land", ChartKind.TABLE, "50", "SELECT 1", null))));

        mvc.perform(get("/api/dashboards/standard"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("Webstatistikk"))
                .andExpect(jsonPath("$.charts[0].type").value("table"))
                .andExpect(jsonPath("$.charts[0].id").value("auto-id-0-table"))
                .andExpect(jsonPath("$.charts[0].groupingDimension").doesNotExist());
    }

    @Test
    void should_load_chart_data_with_request_filters() throws Exception {
        when(dashboardService.load(eq("standard"), eq("site-1"), any(), eq("UNKNOWN"), eq("Dashboard")))
                .thenReturn(new DashboardResult("standard", "Webstatistikk", List.of(
                        ChartResult.batched("c1", "Land", List.of(Map.of("country", "NO", "Unike_besokende", 2)), 450)), 450));

        mvc.perform(post("/api/dashboards/standard/data").contentType(MediaType.APPLICATION_JSON).content("""
                        {"websiteId":"site-1","filters":{"urlFilters":["/a","/b"],"pathOperator":"starts-with",
                         "dateRange":"custom","customStartDate":"2024-01-01","customEndDate":"2024-01-31",
                         "metricType":"pageviews"}}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalBytesProcessed").value(450))
                .andExpect(jsonPath("$.charts[0].batched").value(true))
                .andExpect(jsonPath("$.charts[0].data[0].country").value("NO"))
                .andExpect(jsonPath("$.charts[0].error").doesNotExist());

        ArgumentCaptor<FilterState> filters = ArgumentCaptor.forClass(FilterState.class);
        verify(dashboardService).load(eq("standard"), eq("site-1"), filters.capture(), eq("UNKNOWN"), eq("Dashboard"));
        assertThat(filters.getValue().urlFilters()).containsExactly("/a", "/b");
        assertThat(filters.getValue().pathOperator()).isEqualTo(PathOperator.STARTS_WITH);
        assertThat(filters.getValue().metricType()).isEqualTo(MetricType.PAGEVIEWS);
        assertThat(filters.getValue().customStartDate()).isEqualTo(LocalDate.of(2024, 1, 1));
    }

    @Test
    void should_default_filters_when_absent() throws Exception {
        when(dashboardService.load(any(), any(), any(), any(), any()))
                .thenReturn(new DashboardResult("standard", "Webstatistikk", List.of(), 0));

        mvc.perform(post("/api/dashboards/standard/data").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"websiteId\":\"site-1\"}"))
                .andExpect(status().isOk());

        ArgumentCaptor<FilterState> filters = ArgumentCaptor.forClass(FilterState.class);
        verify(dashboardService).load(eq("standard"), eq("site-1"), filters.capture(), any(), any());
        assertThat(filters.getValue().urlFilters()).isEmpty();
        assertThat(filters.getValue().metricType()).isEqualTo(MetricType.VISITORS);
    }

    @Test
    void should_reject_unsafe_website_id() throws Exception {
        mvc.perform(post("/api/dashboards/standard/data").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"websiteId\":\"x' OR '1'='1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());

        verifyNoInteractions(dashboardService);
    }
}
