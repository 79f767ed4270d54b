package com.sitely.ledger.exception;

/**
 * Root of every failure the storage layer surfaces to its callers.
 */
public class LedgerException extends RuntimeException {
    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
