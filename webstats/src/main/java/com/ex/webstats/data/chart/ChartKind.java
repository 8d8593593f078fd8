package com.ex.webstats.data.chart;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ChartKind {
    LINE("line"),
    BAR("bar"),
    PIE("pie"),
    TABLE("table"),
    TITLE("title"),
    SITEIMPROVE("siteimprove");

    private final String value;

    ChartKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Section headings and the embedded score widget carry no query. */
    public boolean isDataKind() {
        return this != TITLE && this != SITEIMPROVE;
    }

    @JsonCreator
    public static ChartKind fromValue(String raw) {
        if (raw == null) throw new IllegalArgumentException("chart type is required");
        String v = raw.trim().toLowerCase(Locale.ROOT);
        for (ChartKind k : values()) {
            if (k.value.equals(v)) return k;
        }
        throw new IllegalArgumentException("unknown chart type: " + raw);
    }
}
