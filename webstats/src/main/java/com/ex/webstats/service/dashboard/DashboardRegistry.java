package com.ex.webstats.service.dashboard;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import com.ex.webstats.WarehouseProps;
import com.ex.webstats.data.chart.ChartDefinition;
import com.ex.webstats.data.chart.DashboardConfig;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Dashboards from {@code classpath:dashboards/*.json}, keyed by file name. Read once at
 * startup; {@code ${project}} and {@code ${dataset}} in chart templates are replaced by
 * the configured warehouse.
 */
@Slf4j
@Component
public class DashboardRegistry {

    public static final String DEFAULT_DASHBOARD = "standard";
    static final String LOCATION = "classpath:dashboards/*.json";

    private final Map<String, DashboardConfig> dashboards;

    public DashboardRegistry(ObjectMapper objectMapper, WarehouseProps props) {
        this(objectMapper, props, LOCATION);
    }

    DashboardRegistry(ObjectMapper objectMapper, WarehouseProps props, String location) {
        Map<String, DashboardConfig> loaded = new LinkedHashMap<>();
        try {
            Resource[] resources = new PathMatchingResourcePatternResolver().getResources(location);
            for (Resource res : resources) {
                String name = res.getFilename();
                if (name == null || !name.endsWith(".json")) continue;

                try (InputStream in = res.getInputStream()) {
                    DashboardConfig raw = objectMapper.readValue(in, DashboardConfig.class);
                    loaded.put(name.substring(0, name.length() - ".json".length()), prepare(raw, props));
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Could not load dashboards from " + location, e);
        }
        if (!loaded.containsKey(DEFAULT_DASHBOARD)) {
            throw new IllegalStateException("Missing default dashboard '" + DEFAULT_DASHBOARD + "' in " + location);
        }
        this.dashboards = Map.copyOf(loaded);
        log.info("Loaded dashboards: {}", loaded.keySet());
    }

    /** Unknown or missing id → the default dashboard. */
    public DashboardConfig get(String id) {
        DashboardConfig config = id == null ? null : dashboards.get(id);
        return config != null ? config : dashboards.get(DEFAULT_DASHBOARD);
    }

    public Set<String> ids() {
        return dashboards.keySet();
    }

    static DashboardConfig prepare(DashboardConfig raw, WarehouseProps props) {
        List<ChartDefinition> charts = new ArrayList<>();
        for (int i = 0; i < raw.charts().size(); i++) {
            ChartDefinition chart = raw.charts().get(i);
            if (chart.id() == null || chart.id().isBlank()) {
                chart = chart.withId("auto-id-" + i + "-" + chart.kind().value());
            }
            if (chart.sql() != null) {
                chart = chart.withSql(chart.sql()
                        .replace("${project}", props.getProjectId())
                        .replace("${dataset}", props.getDataset()));
            }
            charts.add(chart);
        }
        return new DashboardConfig(raw.title(), raw.description(), charts);
    }
}
