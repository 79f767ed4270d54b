package com.sitely.ledger.migration.legacy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.math.BigDecimal;

/**
 * Element of a per-site "sitely_materials_{siteId}" array.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class LegacyMaterial {

    private String id;
    private String siteId;
    private String name;
    private String vendorName;
    private String vendorPhone;
    private BigDecimal quantity;
    private String unit;
    private BigDecimal ratePerUnit;
    private BigDecimal totalAmount;
    private BigDecimal amountPaid;
    private String billPhotoUrl;
    private String purchasedAt;
}
