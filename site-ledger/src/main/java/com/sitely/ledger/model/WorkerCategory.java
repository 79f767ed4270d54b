package com.sitely.ledger.model;

import com.sitely.ledger.exception.LedgerConstraintException;

/**
 * Exactly two categories. Stored codes are the site vocabulary: karigar (skilled
 * mason/craftsman) and majdur (unskilled labourer).
 */
public enum WorkerCategory {
    SKILLED("karigar"),
    UNSKILLED("majdur");

    private final String code;

    WorkerCategory(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static WorkerCategory fromCode(String code) {
        for (WorkerCategory category : values()) {
            if (category.code.equals(code)) {
                return category;
            }
        }
        throw new LedgerConstraintException("Worker category must be karigar or majdur, got: " + code);
    }
}
