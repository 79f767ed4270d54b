package com.sitely.ledger.repository;

import com.sitely.ledger.model.MaterialUsage;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;

@Repository
public class MaterialUsageRepository extends JdbcRepositorySupport {

    private static final RowMapper<MaterialUsage> ROW_MAPPER = (rs, rowNum) -> MaterialUsage.builder()
            .id(rs.getString("id"))
            .materialId(rs.getString("material_id"))
            .siteId(rs.getString("site_id"))
            .quantityUsed(rs.getBigDecimal("quantity_used"))
            .description(rs.getString("description"))
            .date(localDate(rs, "usage_date"))
            .build();

    public MaterialUsageRepository(JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate, "material_usages");
    }

    public void insert(MaterialUsage usage) {
        jdbcTemplate.update("""
                INSERT INTO material_usages (id, material_id, site_id, quantity_used, description, usage_date)
                VALUES (?, ?, ?, ?, ?, ?)
                """,
                usage.getId(),
                usage.getMaterialId(),
                usage.getSiteId(),
                usage.getQuantityUsed(),
                text(usage.getDescription()),
                sqlDate(usage.getDate()));
    }

    public boolean insertIfAbsent(MaterialUsage usage) {
        if (existsById(usage.getId())) {
            return false;
        }
        insert(usage);
        return true;
    }

    public List<MaterialUsage> findByMaterialId(String materialId) {
        return jdbcTemplate.query(
                "SELECT * FROM material_usages WHERE material_id = ? ORDER BY usage_date DESC, id",
                ROW_MAPPER, materialId);
    }

    public BigDecimal sumUsed(String materialId) {
        BigDecimal used = jdbcTemplate.queryForObject(
                "SELECT COALESCE(SUM(quantity_used), 0) FROM material_usages WHERE material_id = ?",
                BigDecimal.class, materialId);
        return used == null ? BigDecimal.ZERO : used;
    }
}
