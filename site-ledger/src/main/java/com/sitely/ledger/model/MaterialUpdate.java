package com.sitely.ledger.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class MaterialUpdate {

    private String name;
    private String vendorName;
    private String vendorPhone;
    private BigDecimal quantity;
    private MaterialUnit unit;
    private BigDecimal ratePerUnit;
    private BigDecimal amountPaid;
    private String billPhotoUri;
}
