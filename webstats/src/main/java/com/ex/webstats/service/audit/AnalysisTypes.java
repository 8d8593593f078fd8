package com.ex.webstats.service.audit;

import java.net.URI;
import java.net.URISyntaxException;

import lombok.extern.slf4j.Slf4j;

/**
 * Analysis category recorded on a query. Endpoints pass their own default; the
 * traffic and marketing pages share endpoints, so the referring page wins when it
 * is one of them.
 */
@Slf4j
public final class AnalysisTypes {
    private AnalysisTypes(){}

    public static final String SQL_TOOL = "Sqlverktoy";
    public static final String DASHBOARD = "Dashboard";

    public static String override(String referer, String fallback) {
        if (referer == null || referer.isBlank()) return fallback;
        try {
            URI uri = new URI(referer);
            if (!uri.isAbsolute()) return fallback;
            String path = uri.getPath();
            if ("/trafikkanalyse".equals(path)) return "trafikkanalyse";
            if ("/markedsanalyse".equals(path)) return "markedsanalyse";
        } catch (URISyntaxException e) {
            log.debug("Ignoring unparsable referer '{}': {}", referer, e.getMessage());
        }
        return fallback;
    }
}
