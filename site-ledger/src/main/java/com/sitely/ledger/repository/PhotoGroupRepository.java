package com.sitely.ledger.repository;

import com.sitely.ledger.model.PhotoGroup;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class PhotoGroupRepository extends JdbcRepositorySupport {

    private static final RowMapper<PhotoGroup> ROW_MAPPER = (rs, rowNum) -> PhotoGroup.builder()
            .id(rs.getString("id"))
            .siteId(rs.getString("site_id"))
            .name(rs.getString("name"))
            .createdAt(instant(rs, "created_at"))
            .build();

    public PhotoGroupRepository(JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate, "photo_groups");
    }

    public void insert(PhotoGroup group) {
        jdbcTemplate.update("INSERT INTO photo_groups (id, site_id, name, created_at) VALUES (?, ?, ?, ?)",
                group.getId(), group.getSiteId(), group.getName(), sqlTimestamp(group.getCreatedAt()));
    }

    public Optional<PhotoGroup> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM photo_groups WHERE id = ?", ROW_MAPPER, id)
                .stream().findFirst();
    }

    public List<PhotoGroup> findBySiteId(String siteId) {
        return jdbcTemplate.query(
                "SELECT * FROM photo_groups WHERE site_id = ? ORDER BY created_at DESC", ROW_MAPPER, siteId);
    }

    public int rename(String id, String name) {
        return partialUpdate().set("name", name).execute(jdbcTemplate, id);
    }
}
