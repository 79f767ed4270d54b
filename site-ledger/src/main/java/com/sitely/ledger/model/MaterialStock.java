package com.sitely.ledger.model;

import java.math.BigDecimal;

/**
 * Stock position of one material. rawRemaining goes negative when more was
 * logged as used than was bought; remaining is what gets shown.
 */
public record MaterialStock(String materialId, BigDecimal quantity, BigDecimal used) {

    public BigDecimal rawRemaining() {
        return quantity.subtract(used);
    }

    public BigDecimal remaining() {
        return rawRemaining().max(BigDecimal.ZERO);
    }

    public boolean overConsumed() {
        return rawRemaining().signum() < 0;
    }
}
