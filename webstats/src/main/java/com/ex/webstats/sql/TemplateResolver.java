package com.ex.webstats.sql;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.ex.webstats.WarehouseProps;
import com.ex.webstats.data.query.FilterState;
import com.ex.webstats.data.query.MetricType;
import com.ex.webstats.data.query.PathOperator;
import com.ex.webstats.sql.PeriodResolver.ResolvedPeriod;

import lombok.RequiredArgsConstructor;

/**
 * Dashboard template → concrete BigQuery SQL.
 * <ul>
 *   <li>{@code {{website_id}}} → website id</li>
 *   <li>{@code = [[ {{url_sti}} --]] '/'} → url filter ({@code =}, {@code IN}, {@code LIKE}, OR-ed {@code LIKE}s),
 *       or the default comparison when no filter is set</li>
 *   <li>{@code [[AND {{created_at}} ]]} → {@code AND <event>.created_at BETWEEN ...}</li>
 *   <li>{@code COUNT(DISTINCT session_id) as Unike_besokende} → metric aggregate for the chosen metric type</li>
 * </ul>
 * Fail-open: text that does not match a placeholder pattern is left as it is. The templates
 * are developer-authored, so this is a substitution pass and not a validator.
 */
@Component
@RequiredArgsConstructor
public class TemplateResolver {

    private final WarehouseProps props;

    private static final Pattern WEBSITE_ID = Pattern.compile("\\{\\{website_id\\}\\}");

    private static final String URL_MARKER_RE = "\\[\\[\\s*\\{\\{url_sti\\}\\}\\s*--\\s*\\]\\]";
    private static final Pattern URL_MARKER = Pattern.compile(URL_MARKER_RE + "\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern URL_ASSIGNMENT =
            Pattern.compile("=\\s*" + URL_MARKER_RE + "\\s*('[^']+')", Pattern.CASE_INSENSITIVE);
    // column before '=' is needed to repeat it in each LIKE term
    private static final Pattern URL_ASSIGNMENT_WITH_COLUMN =
            Pattern.compile("(\\S+)\\s*=\\s*" + URL_MARKER_RE + "\\s*('[^']+')", Pattern.CASE_INSENSITIVE);

    private static final Pattern CREATED_AT =
            Pattern.compile("\\[\\[\\s*AND\\s*\\{\\{created_at\\}\\}\\s*\\]\\]", Pattern.CASE_INSENSITIVE);

    private static final Pattern SESSION_METRIC = Pattern.compile(
            "COUNT\\s*\\(\\s*DISTINCT\\s+(?:([a-zA-Z_.]+)\\.)?session_id\\s*\\)\\s+as\\s+Unike_besokende",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern SESSION_ALIAS = Pattern.compile("\\bUnike_besokende\\b");

    public String resolve(String template, String websiteId, FilterState filters) {
        return resolve(template, websiteId, filters, ZonedDateTime.now(props.zone()));
    }

    public String resolve(String template, String websiteId, FilterState filters, ZonedDateTime now) {
        if (template == null) return null;

        ResolvedPeriod period = PeriodResolver.resolve(filters, now);
        String sql = template;

        if (websiteId != null) {
            sql = WEBSITE_ID.matcher(sql).replaceAll(Matcher.quoteReplacement(websiteId));
        }
        sql = substituteUrlPath(sql, filters);
        sql = substituteCreatedAt(sql, period);
        sql = substituteMetric(sql, websiteId, filters.metricType(), period);
        return sql;
    }

    /** True when the template counts distinct sessions under the canonical alias. */
    public static boolean hasSessionMetric(String template) {
        return template != null && SESSION_METRIC.matcher(template).find();
    }

    /* ===== url path ===== */

    private String substituteUrlPath(String sql, FilterState filters) {
        if (!filters.hasUrlFilters()) {
            // keeps "= '<default>'"
            return URL_MARKER.matcher(sql).replaceAll("");
        }

        var paths = filters.urlFilters();
        if (filters.pathOperator() == PathOperator.STARTS_WITH) {
            if (paths.size() == 1) {
                String like = "LIKE " + SqlFragments.quote(paths.get(0) + "%");
                return URL_ASSIGNMENT.matcher(sql).replaceAll(Matcher.quoteReplacement(like));
            }
            return replaceEach(URL_ASSIGNMENT_WITH_COLUMN, sql,
                    m -> "(" + SqlFragments.likeDisjunction(m.group(1), paths) + ")");
        }

        String replacement = paths.size() == 1
                ? "= " + SqlFragments.quote(paths.get(0))
                : "IN (" + SqlFragments.inList(paths) + ")";
        return URL_ASSIGNMENT.matcher(sql).replaceAll(Matcher.quoteReplacement(replacement));
    }

    /* ===== created_at ===== */

    private String substituteCreatedAt(String sql, ResolvedPeriod period) {
        // no window → the optional block simply disappears
        String clause = period == null
                ? ""
                : "AND " + SqlFragments.between(props.eventTable() + ".created_at", period, props.zone());
        return CREATED_AT.matcher(sql).replaceAll(Matcher.quoteReplacement(clause));
    }

    /* ===== metric ===== */

    private String substituteMetric(String sql, String websiteId, MetricType metric, ResolvedPeriod period) {
        return switch (metric) {
            case PAGEVIEWS -> renameMetric(sql, m -> "COUNT(*) as Sidevisninger", "Sidevisninger");
            case VISITS -> renameMetric(sql, m -> "COUNT(DISTINCT visit_id) as `Antall økter`", "`Antall økter`");
            case PROPORTION -> {
                String siteTotal = siteTotalSubquery(websiteId, period);
                yield renameMetric(sql, m -> {
                    String sessionRef = m.group(1) != null ? m.group(1) + ".session_id" : "session_id";
                    return "CONCAT(CAST(ROUND(COUNT(DISTINCT " + sessionRef + ") * 100.0 / " + siteTotal
                            + ", 1) AS STRING), '%') as Andel";
                }, "Andel");
            }
            case VISITORS -> sql;
        };
    }

    // Denominator ignores the url filter: share of all site traffic in the window
    String siteTotalSubquery(String websiteId, ResolvedPeriod period) {
        ZoneId zone = props.zone();
        return "(SELECT COUNT(DISTINCT session_id) FROM " + props.eventTable()
                + " WHERE website_id = " + SqlFragments.quote(websiteId)
                + " AND event_type = 1 AND " + SqlFragments.between("created_at", period, zone) + ")";
    }

    private static String renameMetric(String sql, Function<Matcher, String> aggregate, String newAlias) {
        String out = replaceEach(SESSION_METRIC, sql, aggregate);
        return SESSION_ALIAS.matcher(out).replaceAll(Matcher.quoteReplacement(newAlias));
    }

    private static String replaceEach(Pattern p, String sql, Function<Matcher, String> replacement) {
        Matcher m = p.matcher(sql);
        StringBuffer sb = new StringBuffer();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement.apply(m)));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
