package com.ex.webstats.service.batch;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.ex.webstats.WarehouseProps;
import com.ex.webstats.data.chart.ChartDefinition;
import com.ex.webstats.data.query.FilterState;
import com.ex.webstats.data.query.MetricType;
import com.ex.webstats.sql.PeriodResolver;
import com.ex.webstats.sql.PeriodResolver.ResolvedPeriod;
import com.ex.webstats.sql.SqlFragments;
import com.ex.webstats.sql.TemplateResolver;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Splits a dashboard's charts into one combined session scan plus the charts that run
 * on their own.
 * <p>
 * A chart joins the scan when its template joins the session table, counts distinct
 * sessions as {@code Unike_besokende} and groups by exactly one {@code base_query.<attr>}
 * from {@link AttributeRules}. An explicit {@code groupingDimension} on the chart wins
 * over detection. Fewer than two such charts → nothing is combined.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchPlanner {

    static final int MIN_GROUP_SIZE = 2;

    // GROUP BY body up to the next clause
    private static final Pattern GROUP_BY = Pattern.compile(
            "\\bgroup\\s+by\\s+(.*?)(?=\\border\\s+by\\b|\\bhaving\\b|\\blimit\\b|\\bunion\\b|\\)|$)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern BASE_QUERY_COLUMN = Pattern.compile("\\bbase_query\\.(\\w+)", Pattern.CASE_INSENSITIVE);

    private final WarehouseProps props;

    public BatchPlan plan(List<ChartDefinition> charts, String websiteId, FilterState filters) {
        return plan(charts, websiteId, filters, ZonedDateTime.now(props.zone()));
    }

    public BatchPlan plan(List<ChartDefinition> charts, String websiteId, FilterState filters, ZonedDateTime now) {
        List<ChartDefinition> batchable = new ArrayList<>();
        List<ChartDefinition> individual = new ArrayList<>();
        Map<String, String> attributeByChart = new LinkedHashMap<>();
        Set<String> attributes = new LinkedHashSet<>();

        for (ChartDefinition chart : charts) {
            if (!chart.hasQuery()) continue;
            if (chart.kind() != null && !chart.kind().isDataKind()) continue;

            String attribute = groupingDimension(chart);
            if (attribute != null && chart.id() != null) {
                batchable.add(chart);
                attributeByChart.put(chart.id(), attribute);
                attributes.add(attribute);
            } else {
                individual.add(chart);
            }
        }

        log.info("[QueryBatcher] Found {} session charts to batch ({})", batchable.size(), String.join(", ", attributes));

        if (batchable.size() < MIN_GROUP_SIZE) {
            log.info("[QueryBatcher] {} charts will be fetched individually", individual.size() + batchable.size());
            return BatchPlan.unbatched(keepOrder(charts, individual, batchable));
        }

        ResolvedPeriod period = PeriodResolver.resolve(filters, now);
        List<String> fields = List.copyOf(attributes);
        String combined = combinedQuery(websiteId, filters, fields, period);
        String siteTotal = filters.metricType() == MetricType.PROPORTION ? siteTotalQuery(websiteId, period) : null;

        log.info("[QueryBatcher] {} charts will be fetched individually", individual.size());
        BatchGroup group = new BatchGroup(batchable, attributeByChart, filters, fields, combined, siteTotal);
        return new BatchPlan(List.of(group), individual);
    }

    /**
     * Session attribute the chart groups by, or {@code null} when the chart cannot be
     * served from a combined scan.
     */
    public String groupingDimension(ChartDefinition chart) {
        if (chart.groupingDimension() != null) {
            String explicit = chart.groupingDimension().toLowerCase(Locale.ROOT);
            return AttributeRules.isBatchable(explicit) ? explicit : null;
        }
        return detectGroupingDimension(chart.sql());
    }

    String detectGroupingDimension(String template) {
        if (template == null) return null;

        String sql = template.toLowerCase(Locale.ROOT);
        String sessionRef = props.getDataset().toLowerCase(Locale.ROOT) + ".session";
        if (!sql.contains(sessionRef) && !sql.contains("public_session")) return null;
        if (!TemplateResolver.hasSessionMetric(template)) return null;

        Matcher groupBy = GROUP_BY.matcher(sql);
        if (!groupBy.find()) return null;

        Matcher column = BASE_QUERY_COLUMN.matcher(groupBy.group(1));
        String attribute = column.find() ? column.group(1) : null;
        if (attribute == null || column.find()) return null;

        return AttributeRules.isBatchable(attribute) ? attribute : null;
    }

    /* ===== combined scan ===== */

    String combinedQuery(String websiteId, FilterState filters, List<String> fields, ResolvedPeriod period) {
        ZoneId zone = props.zone();
        String event = props.eventTable();
        String session = props.sessionTable();
        boolean distinct = filters.metricType() != MetricType.PAGEVIEWS;
        boolean withVisitId = filters.metricType() == MetricType.VISITS;

        StringBuilder sb = new StringBuilder();
        sb.append("WITH base_query AS (\n")
          .append("  SELECT\n")
          .append("    ").append(event).append(".session_id,\n");
        if (withVisitId) {
            sb.append("    ").append(event).append(".visit_id,\n");
        }
        for (int i = 0; i < fields.size(); i++) {
            sb.append("    ").append(session).append('.').append(fields.get(i))
              .append(i < fields.size() - 1 ? ",\n" : "\n");
        }
        sb.append("  FROM ").append(event).append('\n')
          .append("  LEFT JOIN ").append(session).append('\n')
          .append("    ON ").append(event).append(".session_id = ").append(session).append(".session_id\n")
          .append("  WHERE ").append(event).append(".website_id = ").append(SqlFragments.quote(websiteId)).append('\n')
          .append("  AND ").append(event).append(".event_type = 1\n")
          .append("  AND ").append(SqlFragments.urlPathCondition(event + ".url_path", filters)).append('\n')
          .append("  AND ").append(SqlFragments.between(event + ".created_at", period, zone)).append('\n')
          .append("  AND ").append(SqlFragments.between(session + ".created_at", period, zone)).append('\n')
          .append(")\n\n")
          .append(distinct ? "SELECT DISTINCT\n" : "SELECT\n")
          .append("  session_id,\n");
        if (withVisitId) {
            sb.append("  visit_id,\n");
        }
        sb.append("  ").append(String.join(",\n  ", fields)).append('\n')
          .append("FROM base_query\n")
          .append("LIMIT ").append(props.getBatchRowCap());
        return sb.toString();
    }

    String siteTotalQuery(String websiteId, ResolvedPeriod period) {
        return "SELECT COUNT(DISTINCT session_id) as total\n"
                + "FROM " + props.eventTable() + "\n"
                + "WHERE website_id = " + SqlFragments.quote(websiteId) + "\n"
                + "AND event_type = 1\n"
                + "AND " + SqlFragments.between("created_at", period, props.zone());
    }

    private static List<ChartDefinition> keepOrder(List<ChartDefinition> all, List<ChartDefinition> a, List<ChartDefinition> b) {
        Set<ChartDefinition> wanted = new LinkedHashSet<>(a);
        wanted.addAll(b);
        return all.stream().filter(wanted::contains).toList();
    }
}
