package com.ex.webstats.sql;

import java.time.ZoneId;
import java.util.List;
import java.util.stream.Collectors;

import com.ex.webstats.data.query.FilterState;
import com.ex.webstats.data.query.PathOperator;
import com.ex.webstats.sql.PeriodResolver.ResolvedPeriod;

/**
 * Small BigQuery SQL pieces shared by the template resolver and the batch planner.
 */
public final class SqlFragments {
    private SqlFragments(){}

    public static final String DEFAULT_URL_PATH = "/";

    /** BigQuery string literal; backslash and single quote are backslash-escaped. */
    public static String quote(String value) {
        String v = value == null ? "" : value;
        return "'" + v.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    public static String fromTimestamp(ResolvedPeriod period, ZoneId zone) {
        return "TIMESTAMP('" + period.start() + "', '" + zone.getId() + "')";
    }

    public static String toTimestamp(ResolvedPeriod period, ZoneId zone) {
        return "TIMESTAMP('" + period.end() + "T23:59:59', '" + zone.getId() + "')";
    }

    public static String between(String column, ResolvedPeriod period, ZoneId zone) {
        return column + " BETWEEN " + fromTimestamp(period, zone) + " AND " + toTimestamp(period, zone);
    }

    /**
     * Url-path predicate for {@code column}: {@code = '/'} without filters, otherwise
     * {@code =}/{@code IN} for equals and {@code LIKE}/{@code OR}-ed {@code LIKE}s for starts-with.
     */
    public static String urlPathCondition(String column, FilterState filters) {
        List<String> paths = filters.urlFilters();
        if (paths.isEmpty()) {
            return column + " = " + quote(DEFAULT_URL_PATH);
        }
        if (filters.pathOperator() == PathOperator.STARTS_WITH) {
            if (paths.size() == 1) return column + " LIKE " + quote(paths.get(0) + "%");
            return "(" + likeDisjunction(column, paths) + ")";
        }
        if (paths.size() == 1) return column + " = " + quote(paths.get(0));
        return column + " IN (" + inList(paths) + ")";
    }

    static String inList(List<String> paths) {
        return paths.stream().map(SqlFragments::quote).collect(Collectors.joining(", "));
    }

    static String likeDisjunction(String column, List<String> paths) {
        return paths.stream()
                .map(p -> column + " LIKE " + quote(p + "%"))
                .collect(Collectors.joining(" OR "));
    }
}
