package com.ex.webstats.data.query;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * One submission to the warehouse. Built fresh per call: the audit comment and
 * labels carry a timestamp and the caller, so a request is never resubmitted.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class QueryRequest {
    private String sql;
    private String location;

    @Builder.Default
    private Map<String, Object> params = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, String> labels = new LinkedHashMap<>();

    private boolean dryRun;

    /** Same sql/params/location, fresh label map, given dry-run flag. */
    public QueryRequest copy(boolean dryRun) {
        return QueryRequest.builder()
                .sql(sql)
                .location(location)
                .params(params == null ? new LinkedHashMap<>() : new LinkedHashMap<>(params))
                .labels(labels == null ? new LinkedHashMap<>() : new LinkedHashMap<>(labels))
                .dryRun(dryRun)
                .build();
    }
}
