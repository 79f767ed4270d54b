package com.sitely.ledger.model;

import com.sitely.ledger.exception.LedgerConstraintException;

public enum TodoPriority {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String code;

    TodoPriority(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static TodoPriority fromCode(String code) {
        if (code == null) {
            return MEDIUM;
        }
        for (TodoPriority priority : values()) {
            if (priority.code.equals(code)) {
                return priority;
            }
        }
        throw new LedgerConstraintException("Unknown todo priority: " + code);
    }
}
