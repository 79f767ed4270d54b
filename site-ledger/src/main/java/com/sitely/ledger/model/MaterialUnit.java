package com.sitely.ledger.model;

import com.sitely.ledger.exception.LedgerConstraintException;

import java.util.Locale;

public enum MaterialUnit {
    KG("kg"),
    BAG("bag"),
    PIECE("piece"),
    TON("ton"),
    LITRE("litre"),
    SQFT("sqft"),
    CFT("cft"),
    NOS("nos"),
    OTHER("other");

    private final String code;

    MaterialUnit(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static MaterialUnit fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new LedgerConstraintException("Material unit is required");
        }
        String normalised = code.trim().toLowerCase(Locale.ROOT);
        for (MaterialUnit unit : values()) {
            if (unit.code.equals(normalised)) {
                return unit;
            }
        }
        throw new LedgerConstraintException("Unknown material unit: " + code);
    }
}
