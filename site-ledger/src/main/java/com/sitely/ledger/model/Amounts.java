package com.sitely.ledger.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Scales of the stored decimal columns. Values are rounded to them before
 * anything is derived from them, so a computed total matches its stored inputs.
 */
public final class Amounts {

    public static final int MONEY_SCALE = 2;
    public static final int QUANTITY_SCALE = 3;

    private Amounts() {
    }

    public static BigDecimal money(BigDecimal value) {
        return value == null ? null : value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal quantity(BigDecimal value) {
        return value == null ? null : value.setScale(QUANTITY_SCALE, RoundingMode.HALF_UP);
    }
}
