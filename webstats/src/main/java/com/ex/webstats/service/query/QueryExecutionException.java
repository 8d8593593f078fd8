package com.ex.webstats.service.query;

/** A real (non dry-run) execution failed; the message is safe to show the user. */
public class QueryExecutionException extends RuntimeException {

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
