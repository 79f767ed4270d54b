package com.sitely.ledger.exception;

import lombok.Getter;

/**
 * One legacy record could not be converted or inserted. The migration engine
 * logs and counts these; they never abort the pass.
 */
@Getter
public class MigrationRecordException extends LedgerException {

    private final String legacyKey;
    private final String recordId;

    public MigrationRecordException(String legacyKey, String recordId, String message, Throwable cause) {
        super(String.format("%s record %s: %s", legacyKey, recordId, message), cause);
        this.legacyKey = legacyKey;
        this.recordId = recordId;
    }
}
