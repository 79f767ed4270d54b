package com.sitely.ledger.repository;

import com.sitely.ledger.model.Material;
import com.sitely.ledger.model.MaterialUnit;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

@Repository
public class MaterialRepository extends JdbcRepositorySupport {

    private static final RowMapper<Material> ROW_MAPPER = (rs, rowNum) -> Material.builder()
            .id(rs.getString("id"))
            .siteId(rs.getString("site_id"))
            .name(rs.getString("name"))
            .vendorName(rs.getString("vendor_name"))
            .vendorPhone(rs.getString("vendor_phone"))
            .quantity(rs.getBigDecimal("quantity"))
            .unit(MaterialUnit.fromCode(rs.getString("unit")))
            .ratePerUnit(rs.getBigDecimal("rate_per_unit"))
            .totalAmount(rs.getBigDecimal("total_amount"))
            .amountPaid(rs.getBigDecimal("amount_paid"))
            .billPhotoUri(rs.getString("bill_photo_uri"))
            .purchasedAt(instant(rs, "purchased_at"))
            .build();

    public MaterialRepository(JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate, "materials");
    }

    public void insert(Material m) {
        jdbcTemplate.update("""
                INSERT INTO materials
                (id, site_id, name, vendor_name, vendor_phone, quantity, unit,
                 rate_per_unit, total_amount, amount_paid, bill_photo_uri, purchased_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                m.getId(),
                m.getSiteId(),
                m.getName(),
                text(m.getVendorName()),
                text(m.getVendorPhone()),
                money(m.getQuantity()),
                m.getUnit().code(),
                money(m.getRatePerUnit()),
                money(m.getTotalAmount()),
                money(m.getAmountPaid()),
                m.getBillPhotoUri(),
                sqlTimestamp(m.getPurchasedAt()));
    }

    public boolean insertIfAbsent(Material material) {
        if (existsById(material.getId())) {
            return false;
        }
        insert(material);
        return true;
    }

    public Optional<Material> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM materials WHERE id = ?", ROW_MAPPER, id)
                .stream().findFirst();
    }

    public List<Material> findBySiteId(String siteId) {
        return jdbcTemplate.query(
                "SELECT * FROM materials WHERE site_id = ? ORDER BY purchased_at DESC", ROW_MAPPER, siteId);
    }

    /**
     * Writes the supplied columns. The caller passes the recomputed total
     * whenever quantity or rate changes.
     */
    public int update(String id, Material changes, BigDecimal recomputedTotal) {
        return partialUpdate()
                .set("name", changes.getName())
                .set("vendor_name", changes.getVendorName())
                .set("vendor_phone", changes.getVendorPhone())
                .set("quantity", changes.getQuantity())
                .set("unit", changes.getUnit() == null ? null : changes.getUnit().code())
                .set("rate_per_unit", changes.getRatePerUnit())
                .set("total_amount", recomputedTotal)
                .set("amount_paid", changes.getAmountPaid())
                .set("bill_photo_uri", changes.getBillPhotoUri())
                .execute(jdbcTemplate, id);
    }
}
