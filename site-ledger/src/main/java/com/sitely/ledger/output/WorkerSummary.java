package com.sitely.ledger.output;

import com.sitely.ledger.model.WorkerCategory;
import com.sitely.ledger.model.WorkerTotals;

import java.time.LocalDate;

/**
 * One line of a site report. lastPaymentDate is null when the worker was never paid.
 */
public record WorkerSummary(String workerId,
                            String workerName,
                            WorkerCategory category,
                            WorkerTotals totals,
                            LocalDate lastPaymentDate) {
}
