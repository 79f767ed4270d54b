package com.sitely.ledger.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Money actually handed over to a worker.
 */
@Data
@Builder(toBuilder = true)
public class PaymentRecord {

    private String id;
    private String siteId;
    private String workerId;
    private String workerName;
    private WorkerCategory workerCategory;
    private BigDecimal amount;
    private PaymentMethod method;
    private LocalDate date;
    private String time;
}
