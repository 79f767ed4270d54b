package com.sitely.ledger.exception;

import lombok.Getter;

@Getter
public class RecordNotFoundException extends LedgerException {

    private final String table;
    private final String id;

    public RecordNotFoundException(String table, String id) {
        super(String.format("No row in %s with id %s", table, id));
        this.table = table;
        this.id = id;
    }
}
