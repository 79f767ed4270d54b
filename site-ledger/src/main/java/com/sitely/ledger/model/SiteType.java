package com.sitely.ledger.model;

import com.sitely.ledger.exception.LedgerConstraintException;

import java.util.Arrays;
import java.util.Locale;

public enum SiteType {
    RESIDENTIAL("residential"),
    COMMERCIAL("commercial"),
    ROW_HOUSE("rowhouse"),
    TENEMENT("tenament"),
    SHOP("shop"),
    OTHER("other");

    private final String code;

    SiteType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Resolves a stored code. Accepts the hyphenated and corrected spellings
     * ("row-house", "tenement") alongside the stored ones.
     */
    public static SiteType fromCode(String code) {
        if (code == null) {
            throw new LedgerConstraintException("Site type is required");
        }
        String normalised = code.trim().toLowerCase(Locale.ROOT).replace("-", "");
        if (normalised.equals("tenement")) {
            return TENEMENT;
        }
        return Arrays.stream(values())
                .filter(t -> t.code.equals(normalised))
                .findFirst()
                .orElseThrow(() -> new LedgerConstraintException("Unknown site type: " + code));
    }
}
