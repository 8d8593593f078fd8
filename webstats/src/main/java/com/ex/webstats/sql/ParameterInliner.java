package com.ex.webstats.sql;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes bound {@code @name} parameter values back into a query so it can be shown or
 * copied into the BigQuery console. Display only: values are quoted and escaped but not sanitised.
 */
public final class ParameterInliner {
    private ParameterInliner(){}

    public static String inline(String sql, Map<String, ?> params) {
        if (sql == null || params == null || params.isEmpty()) return sql;

        // longest first so @url1 never eats the prefix of @url10
        List<String> keys = new ArrayList<>(params.keySet());
        keys.sort(Comparator.comparingInt(String::length).reversed());

        StringJoiner names = new StringJoiner("|");
        keys.forEach(k -> names.add(Pattern.quote(k)));
        Matcher m = Pattern.compile("@(" + names + ")\\b").matcher(sql);

        // one pass: inlined values are never rescanned
        StringBuffer sb = new StringBuffer();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(literal(params.get(m.group(1)))));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    static String literal(Object value) {
        if (value == null) return "NULL";
        if (value instanceof CharSequence s) {
            return "'" + s.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
        }
        if (value instanceof Date d) {
            return "'" + d.toInstant() + "'";
        }
        if (value instanceof TemporalAccessor) {
            return "'" + value + "'";
        }
        return String.valueOf(value);
    }
}
