package com.ex.webstats.data.query;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PathOperator {
    EQUALS("equals"),
    STARTS_WITH("starts-with");

    private final String value;

    PathOperator(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static PathOperator fromValue(String raw) {
        if (raw != null && STARTS_WITH.value.equals(raw.trim().toLowerCase(Locale.ROOT))) {
            return STARTS_WITH;
        }
        return EQUALS;
    }
}
