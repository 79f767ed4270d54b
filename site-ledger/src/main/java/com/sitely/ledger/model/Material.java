package com.sitely.ledger.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A purchase of building material. totalAmount is quantity x ratePerUnit,
 * computed when the row is written and stored as is.
 */
@Data
@Builder(toBuilder = true)
public class Material {

    private String id;
    private String siteId;
    private String name;
    private String vendorName;
    private String vendorPhone;
    private BigDecimal quantity;
    private MaterialUnit unit;
    private BigDecimal ratePerUnit;
    private BigDecimal totalAmount;
    private BigDecimal amountPaid;
    private String billPhotoUri;
    private Instant purchasedAt;

    public static BigDecimal totalFor(BigDecimal quantity, BigDecimal ratePerUnit) {
        if (quantity == null || ratePerUnit == null) {
            return BigDecimal.ZERO.setScale(Amounts.MONEY_SCALE);
        }
        return Amounts.money(Amounts.quantity(quantity).multiply(Amounts.money(ratePerUnit)));
    }

    public BigDecimal getAmountDue() {
        BigDecimal total = totalAmount == null ? BigDecimal.ZERO : totalAmount;
        BigDecimal paid = amountPaid == null ? BigDecimal.ZERO : amountPaid;
        return total.subtract(paid);
    }
}
