package com.ex.webstats.data.query;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Unit of traffic a dashboard counts. The column alias is what the resolved
 * template (and the client-side aggregate) names the metric column.
 */
public enum MetricType {
    VISITORS("visitors", "Unike_besokende"),
    VISITS("visits", "Antall økter"),
    PAGEVIEWS("pageviews", "Sidevisninger"),
    PROPORTION("proportion", "Andel");

    private final String value;
    private final String columnAlias;

    MetricType(String value, String columnAlias) {
        this.value = value;
        this.columnAlias = columnAlias;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public String columnAlias() {
        return columnAlias;
    }

    // unknown values count visitors
    @JsonCreator
    public static MetricType fromValue(String raw) {
        if (raw == null) return VISITORS;
        String v = raw.trim().toLowerCase(Locale.ROOT);
        for (MetricType t : values()) {
            if (t.value.equals(v)) return t;
        }
        return VISITORS;
    }
}
