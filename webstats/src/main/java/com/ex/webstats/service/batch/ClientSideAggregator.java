package com.ex.webstats.service.batch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.ex.webstats.WarehouseProps;
import com.ex.webstats.data.query.MetricType;
import com.ex.webstats.service.batch.AttributeRules.Rule;

import lombok.RequiredArgsConstructor;

/**
 * Rebuilds one chart's grouped result from the raw rows of a combined scan, in the
 * shape the chart's own template would have returned: {@code <attribute>} plus the
 * metric column, sorted by the metric descending.
 */
@Component
@RequiredArgsConstructor
public class ClientSideAggregator {

    private final WarehouseProps props;

    /**
     * @param siteTotal distinct sessions of the whole site, only used for proportion;
     *                  {@code null} → distinct sessions in {@code rows}
     */
    public List<Map<String, Object>> aggregate(List<Map<String, Object>> rows, String attribute,
                                               MetricType metric, Long siteTotal) {
        Map<String, Set<Object>> distinct = new LinkedHashMap<>();
        Map<String, Long> counts = new LinkedHashMap<>();
        Set<Object> allSessions = new HashSet<>();
        Rule rule = AttributeRules.forAttribute(attribute).orElse(Rule.keepAll(attribute));

        for (Map<String, Object> row : rows) {
            allSessions.add(row.get("session_id"));
            Object raw = row.get(attribute);
            if (!rule.keep().test(raw == null ? null : String.valueOf(raw))) continue;
            String key = keyOf(raw);
            switch (metric) {
                case PAGEVIEWS -> counts.merge(key, 1L, Long::sum);
                case VISITS -> {
                    Set<Object> visits = distinct.computeIfAbsent(key, k -> new HashSet<>());
                    Object visitId = row.get("visit_id");
                    if (visitId != null) visits.add(visitId);
                }
                case VISITORS, PROPORTION -> distinct.computeIfAbsent(key, k -> new HashSet<>()).add(row.get("session_id"));
            }
        }
        if (metric != MetricType.PAGEVIEWS) {
            distinct.forEach((k, v) -> counts.put(k, (long) v.size()));
        }

        List<Map.Entry<String, Long>> sorted = new ArrayList<>(counts.entrySet());
        sorted.sort(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()));

        long denominator = siteTotal != null ? siteTotal : allSessions.size();

        List<Map<String, Object>> out = new ArrayList<>();
        for (Map.Entry<String, Long> e : sorted) {
            if (out.size() >= props.getAggregateRowCap()) break;

            Map<String, Object> row = new LinkedHashMap<>();
            row.put(attribute, e.getKey());
            row.put(metric.columnAlias(), metric == MetricType.PROPORTION
                    ? percent(e.getValue(), denominator)
                    : e.getValue());
            out.add(row);
        }
        return out;
    }

    /**
     * Even split of the combined scan's bytes; the remainder goes to the first charts.
     * The warehouse reports bytes per job, not per column, so this is an approximation.
     */
    public static long[] apportionBytes(long totalBytes, int charts) {
        if (charts <= 0) return new long[0];
        long[] out = new long[charts];
        long share = totalBytes / charts;
        long rest = totalBytes % charts;
        for (int i = 0; i < charts; i++) {
            out[i] = share + (i < rest ? 1 : 0);
        }
        return out;
    }

    static String keyOf(Object value) {
        if (value == null) return AttributeRules.UNKNOWN_VALUE;
        String s = String.valueOf(value);
        return s.isEmpty() ? AttributeRules.UNKNOWN_VALUE : s;
    }

    static String percent(long part, long total) {
        double pct = total > 0 ? part * 100.0 / total : 0.0;
        return String.format(Locale.ROOT, "%.1f%%", pct);
    }
}
