package com.sitely.ledger.model;

import com.sitely.ledger.exception.LedgerConstraintException;

import java.util.Locale;

public enum PaymentMethod {
    CASH("cash"),
    UPI("upi"),
    BANK("bank");

    private final String code;

    PaymentMethod(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /** Missing method means cash, matching rows written before the column existed. */
    public static PaymentMethod fromCode(String code) {
        if (code == null || code.isBlank()) {
            return CASH;
        }
        String normalised = code.trim().toLowerCase(Locale.ROOT);
        for (PaymentMethod method : values()) {
            if (method.code.equals(normalised)) {
                return method;
            }
        }
        throw new LedgerConstraintException("Unknown payment method: " + code);
    }
}
