package com.ex.webstats.controller.api;

import java.security.Principal;
import java.util.Map;
import java.util.regex.Pattern;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.ex.webstats.data.chart.DashboardConfig;
import com.ex.webstats.data.query.FilterState;
import com.ex.webstats.service.audit.AnalysisTypes;
import com.ex.webstats.service.audit.AuditAnnotator;
import com.ex.webstats.service.dashboard.DashboardResult;
import com.ex.webstats.service.dashboard.DashboardService;

import lombok.RequiredArgsConstructor;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/dashboards")
public class DashboardApiController {

    // website ids are spliced into template literals
    private static final Pattern WEBSITE_ID = Pattern.compile("^[A-Za-z0-9-]+$");

    private final DashboardService dashboardService;

    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public DashboardConfig config(@PathVariable("id") String id) {
        return dashboardService.config(id);
    }

    @PostMapping(value = "/{id}/data", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public DashboardResult data(@PathVariable("id") String id, @RequestBody DataBody req, Principal principal,
                                @RequestHeader(value = HttpHeaders.REFERER, required = false) String referer) {
        if (req.websiteId() == null || req.websiteId().isBlank()) {
            throw new IllegalArgumentException("websiteId is required");
        }
        if (!WEBSITE_ID.matcher(req.websiteId()).matches()) {
            throw new IllegalArgumentException("Invalid websiteId: " + req.websiteId());
        }
        FilterState filters = req.filters() != null
                ? req.filters()
                : new FilterState(null, null, null, null, null, null);
        return dashboardService.load(id, req.websiteId(), filters,
                AuditAnnotator.identOf(principal), AnalysisTypes.override(referer, AnalysisTypes.DASHBOARD));
    }

    /* ===== DTO ===== */
    public record DataBody(String websiteId, FilterState filters) {}

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<?> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(Map.of("error", ex.getMessage()));
    }
}
