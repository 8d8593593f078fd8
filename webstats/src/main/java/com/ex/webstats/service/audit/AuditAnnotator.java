package com.ex.webstats.service.audit;

import java.security.Principal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.ex.webstats.data.query.QueryRequest;

/**
 * Stamps every outgoing query with who ran it and why: BigQuery job labels for
 * usage/cost queries over INFORMATION_SCHEMA, and a leading SQL comment for anyone
 * reading the job history. Both come from the same values.
 */
@Component
public class AuditAnnotator {

    public static final String UNKNOWN_IDENT = "UNKNOWN";
    public static final String USER_TYPE = "internal";

    // BigQuery label values: lowercase letters, digits, '_' and '-'
    private static final Pattern LABEL_ILLEGAL = Pattern.compile("[^a-z0-9_-]");

    public QueryRequest annotate(QueryRequest request, String navIdent, String analysisType) {
        String ident = (navIdent == null || navIdent.isBlank()) ? UNKNOWN_IDENT : navIdent;
        boolean dryRun = request.isDryRun();

        Map<String, String> labels = new LinkedHashMap<>();
        if (request.getLabels() != null) labels.putAll(request.getLabels());
        labels.put("nav_ident", sanitizeLabel(ident));
        labels.put("user_type", USER_TYPE);
        labels.put("job_mode", dryRun ? "dry_run" : "execution");
        if (analysisType != null && !analysisType.isBlank()) {
            labels.put("analysis_type", sanitizeLabel(analysisType));
        }
        request.setLabels(labels);

        if (request.getSql() != null && !request.getSql().isEmpty()) {
            StringBuilder comment = new StringBuilder()
                    .append("-- Nav ident: ").append(ident)
                    .append("\n-- Timestamp: ").append(Instant.now());
            if (dryRun) {
                comment.append("\n-- Mode: Dry Run");
            }
            if (analysisType != null && !analysisType.isBlank()) {
                comment.append("\n-- Analysis: ").append(analysisType);
            }
            request.setSql(comment.append('\n').append(request.getSql()).toString());
        }
        return request;
    }

    /** Idempotent; never returns an empty value. */
    public static String sanitizeLabel(String raw) {
        if (raw == null || raw.isEmpty()) return "unknown";
        return LABEL_ILLEGAL.matcher(raw.toLowerCase(Locale.ROOT)).replaceAll("_");
    }

    public static String identOf(Principal principal) {
        if (principal == null || principal.getName() == null || principal.getName().isBlank()) {
            return UNKNOWN_IDENT;
        }
        return principal.getName();
    }
}
