package com.invoice.chargemap.exception;

/**
 * A curated rule table cannot be used as loaded: a pattern does not compile,
 * a required column is blank or a key is duplicated. Classification must not
 * start (or a reload must not be published) with such a table.
 */
public class RuleTableException extends RuntimeException {

    private final String table;
    private final Long rowId;

    public RuleTableException(String table, Long rowId, String message) {
        this(table, rowId, message, null);
    }

    public RuleTableException(String table, Long rowId, String message, Throwable cause) {
        super(table + " row " + rowId + ": " + message, cause);
        this.table = table;
        this.rowId = rowId;
    }

    public String getTable() {
        return table;
    }

    public Long getRowId() {
        return rowId;
    }
}
