package com.sqlgrader.dto;

/**
 * Outcome of marker parsing: a {@link QuerySet}, or the reason the file is malformed.
 */
public class ParseResult {
    private final QuerySet querySet;
    private final String error;

    private ParseResult(QuerySet querySet, String error) {
        this.querySet = querySet;
        this.error = error;
    }

    public static ParseResult success(QuerySet querySet) {
        return new ParseResult(querySet, null);
    }

    public static ParseResult formatError(String error) {
        return new ParseResult(null, error);
    }

    public boolean isSuccess() {
        return querySet != null;
    }

    public QuerySet getQuerySet() {
        return querySet;
    }

    public String getError() {
        return error;
    }
}
