package com.sitely.ledger.exception;

/**
 * The backing store could not be reached or rejected DDL. Fatal: nothing else may run.
 */
public class SchemaException extends LedgerException {
    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
