package com.sitely.ledger.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One day's attendance (hajari) for a worker.
 * workerName/workerCategory are a snapshot taken when the row was written.
 */
@Data
@Builder(toBuilder = true)
public class WageRecord {

    private String id;
    private String siteId;
    private String workerId;
    private String workerName;
    private WorkerCategory workerCategory;
    private BigDecimal amount;
    private BigDecimal overtime;
    private LocalDate date;
    private String time;
}
