package com.sitely.ledger.migration.legacy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.math.BigDecimal;

/**
 * Element of a "sitely_usage_{siteId}_{materialId}" array.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class LegacyMaterialUsage {

    private String id;
    private String materialId;
    private String siteId;
    private String description;
    private BigDecimal quantityUsed;
    private String date;
}
