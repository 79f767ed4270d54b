package com.sitely.ledger.exception;

/**
 * A write would break a foreign-key or enum-domain rule. Rejected, never coerced.
 */
public class LedgerConstraintException extends LedgerException {
    public LedgerConstraintException(String message) {
        super(message);
    }

    public LedgerConstraintException(String message, Throwable cause) {
        super(message, cause);
    }
}
