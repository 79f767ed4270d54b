package com.sitely.ledger.model;

import java.math.BigDecimal;

/**
 * Running sums for one worker on one site inside the retention window.
 * remaining = totalWage - totalExpense - totalPaid; negative means overpaid.
 */
public record WorkerTotals(BigDecimal totalWage, BigDecimal totalExpense, BigDecimal totalPaid) {

    public static final WorkerTotals ZERO = new WorkerTotals(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);

    public BigDecimal remaining() {
        return totalWage.subtract(totalExpense).subtract(totalPaid);
    }
}
