package com.ex.webstats.service.batch;

import java.util.List;

import com.ex.webstats.data.chart.ChartDefinition;

// individual: charts to run through their own resolved template, in dashboard order
public record BatchPlan(List<BatchGroup> groups, List<ChartDefinition> individual) {

    public BatchPlan {
        groups = List.copyOf(groups);
        individual = List.copyOf(individual);
    }

    public static BatchPlan unbatched(List<ChartDefinition> charts) {
        return new BatchPlan(List.of(), charts);
    }

    public boolean hasGroups() {
        return !groups.isEmpty();
    }
}
