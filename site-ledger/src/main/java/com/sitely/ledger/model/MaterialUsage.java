package com.sitely.ledger.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder(toBuilder = true)
public class MaterialUsage {

    private String id;
    private String materialId;
    private String siteId;
    private BigDecimal quantityUsed;
    private String description;
    private LocalDate date;
}
