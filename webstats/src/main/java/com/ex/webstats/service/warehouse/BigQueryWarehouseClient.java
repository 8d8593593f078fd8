package com.ex.webstats.service.warehouse;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.ex.webstats.data.query.QueryRequest;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.FieldList;
import com.google.cloud.bigquery.FieldValue;
import com.google.cloud.bigquery.FieldValueList;
import com.google.cloud.bigquery.Job;
import com.google.cloud.bigquery.JobException;
import com.google.cloud.bigquery.JobId;
import com.google.cloud.bigquery.JobInfo;
import com.google.cloud.bigquery.JobStatistics;
import com.google.cloud.bigquery.QueryJobConfiguration;
import com.google.cloud.bigquery.QueryParameterValue;
import com.google.cloud.bigquery.StandardSQLTypeName;
import com.google.cloud.bigquery.TableResult;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class BigQueryWarehouseClient implements WarehouseClient {

    private final BigQuery bigQuery;

    @Override
    public List<Map<String, Object>> execute(QueryRequest request) {
        QueryJobConfiguration config = toJobConfiguration(request, false);
        try {
            TableResult result = bigQuery.query(config, jobId(request));
            List<Map<String, Object>> rows = toRows(result);
            log.info("[BigQuery] Query successful, returned {} rows", rows.size());
            return rows;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WarehouseException("Interrupted while waiting for query results", e);
        } catch (JobException | BigQueryException e) {
            throw new WarehouseException(e.getMessage(), e);
        }
    }

    @Override
    public DryRunStatistics dryRun(QueryRequest request) {
        QueryJobConfiguration config = toJobConfiguration(request, true);
        try {
            Job job = bigQuery.create(JobInfo.newBuilder(config).setJobId(jobId(request)).build());
            JobStatistics.QueryStatistics stats = job.getStatistics();
            if (stats == null || stats.getTotalBytesProcessed() == null) {
                throw new WarehouseException("Dry run returned no statistics");
            }
            return new DryRunStatistics(
                    stats.getTotalBytesProcessed(),
                    stats.getTotalBytesBilled(),
                    Boolean.TRUE.equals(stats.getCacheHit()));
        } catch (BigQueryException e) {
            throw new WarehouseException(e.getMessage(), e);
        }
    }

    /* ===== mapping ===== */

    private static JobId jobId(QueryRequest request) {
        return JobId.newBuilder().setLocation(request.getLocation()).build();
    }

    static QueryJobConfiguration toJobConfiguration(QueryRequest request, boolean dryRun) {
        QueryJobConfiguration.Builder builder = QueryJobConfiguration.newBuilder(request.getSql())
                .setUseLegacySql(false)
                .setDryRun(dryRun);
        if (request.getLabels() != null && !request.getLabels().isEmpty()) {
            builder.setLabels(request.getLabels());
        }
        if (request.getParams() != null) {
            request.getParams().forEach((name, value) -> builder.addNamedParameter(name, toParameterValue(value)));
        }
        return builder.build();
    }

    static QueryParameterValue toParameterValue(Object value) {
        if (value == null) return QueryParameterValue.string(null);
        if (value instanceof String s) return QueryParameterValue.string(s);
        if (value instanceof Integer || value instanceof Long) return QueryParameterValue.int64(((Number) value).longValue());
        if (value instanceof Double || value instanceof Float) return QueryParameterValue.float64(((Number) value).doubleValue());
        if (value instanceof BigDecimal d) return QueryParameterValue.numeric(d);
        if (value instanceof Boolean b) return QueryParameterValue.bool(b);
        if (value instanceof Instant i) return QueryParameterValue.timestamp(i.toEpochMilli() * 1000L);
        if (value instanceof Date d) return QueryParameterValue.timestamp(d.getTime() * 1000L);
        if (value instanceof LocalDate d) return QueryParameterValue.date(d.toString());
        return QueryParameterValue.string(String.valueOf(value));
    }

    private static List<Map<String, Object>> toRows(TableResult result) {
        List<Map<String, Object>> out = new ArrayList<>();
        if (result == null || result.getSchema() == null) return out;

        FieldList fields = result.getSchema().getFields();
        for (FieldValueList row : result.iterateAll()) {
            Map<String, Object> m = new LinkedHashMap<>();
            for (int i = 0; i < fields.size(); i++) {
                Field field = fields.get(i);
                m.put(field.getName(), normalize(field, row.get(i)));
            }
            out.add(m);
        }
        return out;
    }

    // BigQuery cell → JSON-friendly java value
    private static Object normalize(Field field, FieldValue v) {
        if (v == null || v.isNull()) return null;
        if (v.getAttribute() != FieldValue.Attribute.PRIMITIVE) return String.valueOf(v.getValue());

        StandardSQLTypeName type = field.getType().getStandardType();
        return switch (type) {
            case INT64 -> v.getLongValue();
            case FLOAT64 -> v.getDoubleValue();
            case NUMERIC, BIGNUMERIC -> v.getNumericValue();
            case BOOL -> v.getBooleanValue();
            case TIMESTAMP -> Instant.ofEpochMilli(v.getTimestampValue() / 1000L).toString();
            default -> v.getStringValue();
        };
    }
}
