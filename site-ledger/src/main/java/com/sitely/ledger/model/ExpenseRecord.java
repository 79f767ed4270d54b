package com.sitely.ledger.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Money advanced against a worker's earnings.
 */
@Data
@Builder(toBuilder = true)
public class ExpenseRecord {

    private String id;
    private String siteId;
    private String workerId;
    private String workerName;
    private WorkerCategory workerCategory;
    private String description;
    private BigDecimal amount;
    private LocalDate date;
    private String time;
}
