package com.sitely.ledger.repository;

import com.sitely.ledger.model.Photo;
import com.sitely.ledger.model.PhotoUpdate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class PhotoRepository extends JdbcRepositorySupport {

    private static final RowMapper<Photo> ROW_MAPPER = (rs, rowNum) -> Photo.builder()
            .id(rs.getString("id"))
            .siteId(rs.getString("site_id"))
            .groupId(rs.getString("group_id"))
            .uri(rs.getString("uri"))
            .description(rs.getString("description"))
            .date(localDate(rs, "record_date"))
            .time(rs.getString("record_time"))
            .build();

    public PhotoRepository(JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate, "photos");
    }

    public void insert(Photo photo) {
        jdbcTemplate.update("""
                INSERT INTO photos (id, site_id, uri, description, record_date, record_time, group_id)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """,
                photo.getId(),
                photo.getSiteId(),
                photo.getUri(),
                text(photo.getDescription()),
                sqlDate(photo.getDate()),
                text(photo.getTime()),
                photo.getGroupId());
    }

    public boolean insertIfAbsent(Photo photo) {
        if (existsById(photo.getId())) {
            return false;
        }
        insert(photo);
        return true;
    }

    public List<Photo> findBySiteId(String siteId) {
        return jdbcTemplate.query(
                "SELECT * FROM photos WHERE site_id = ? ORDER BY record_date DESC, record_time DESC",
                ROW_MAPPER, siteId);
    }

    public List<Photo> findByGroupId(String groupId) {
        return jdbcTemplate.query(
                "SELECT * FROM photos WHERE group_id = ? ORDER BY record_date DESC, record_time DESC",
                ROW_MAPPER, groupId);
    }

    public Optional<String> findSiteIdOf(String id) {
        return jdbcTemplate.queryForList("SELECT site_id FROM photos WHERE id = ?", String.class, id)
                .stream().findFirst();
    }

    public int update(String id, PhotoUpdate update) {
        PartialUpdate sql = partialUpdate().set("description", update.getDescription());
        if (update.isClearGroup()) {
            sql.setAlways("group_id", null);
        } else {
            sql.set("group_id", update.getGroupId());
        }
        return sql.execute(jdbcTemplate, id);
    }

    /** Photos outlive their group; they just become ungrouped. */
    public int ungroup(String groupId) {
        return jdbcTemplate.update("UPDATE photos SET group_id = NULL WHERE group_id = ?", groupId);
    }
}
