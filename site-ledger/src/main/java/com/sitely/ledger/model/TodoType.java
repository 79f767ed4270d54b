package com.sitely.ledger.model;

import com.sitely.ledger.exception.LedgerConstraintException;

public enum TodoType {
    DAILY("daily"),
    MONTHLY("monthly");

    private final String code;

    TodoType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static TodoType fromCode(String code) {
        for (TodoType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new LedgerConstraintException("Unknown todo type: " + code);
    }
}
