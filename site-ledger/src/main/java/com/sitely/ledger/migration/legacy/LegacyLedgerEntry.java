package com.sitely.ledger.migration.legacy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.math.BigDecimal;

/**
 * Shared shape of the "@hajari", "@expenses" and "@payments" arrays.
 * overtime, description and method only appear on some of them.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class LegacyLedgerEntry {

    private String id;
    private String siteId;
    private String workerId;
    private String workerName;
    private String workerCategory;
    private BigDecimal amount;
    private BigDecimal overtime;
    private String description;
    private String method;
    private String date;
    private String time;
}
