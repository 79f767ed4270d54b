package com.sitely.ledger.repository;

import com.sitely.ledger.model.Site;
import com.sitely.ledger.model.SiteType;
import com.sitely.ledger.model.SiteUpdate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class SiteRepository extends JdbcRepositorySupport {

    private static final RowMapper<Site> ROW_MAPPER = (rs, rowNum) -> Site.builder()
            .id(rs.getString("id"))
            .name(rs.getString("name"))
            .type(SiteType.fromCode(rs.getString("site_type")))
            .location(rs.getString("location"))
            .startDate(localDate(rs, "start_date"))
            .endDate(localDate(rs, "end_date"))
            .running(rs.getBoolean("is_running"))
            .ownerName(rs.getString("owner_name"))
            .contact(rs.getString("contact"))
            .siteCode(rs.getString("site_code"))
            .userId(rs.getString("user_id"))
            .createdAt(instant(rs, "created_at"))
            .build();

    public SiteRepository(JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate, "sites");
    }

    public void insert(Site site) {
        jdbcTemplate.update("""
                INSERT INTO sites
                (id, name, site_type, location, start_date, end_date, is_running,
                 owner_name, contact, site_code, user_id, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                site.getId(),
                site.getName(),
                site.getType().code(),
                text(site.getLocation()),
                sqlDate(site.getStartDate()),
                sqlDate(site.getEndDate()),
                site.isRunning(),
                text(site.getOwnerName()),
                text(site.getContact()),
                site.getSiteCode(),
                site.getUserId(),
                sqlTimestamp(site.getCreatedAt()));
    }

    /** @return true when the row was written, false when the id was already present */
    public boolean insertIfAbsent(Site site) {
        if (existsById(site.getId())) {
            return false;
        }
        insert(site);
        return true;
    }

    public Optional<Site> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM sites WHERE id = ?", ROW_MAPPER, id)
                .stream().findFirst();
    }

    public List<Site> findAll() {
        return jdbcTemplate.query("SELECT * FROM sites ORDER BY created_at DESC", ROW_MAPPER);
    }

    /**
     * Sites owned by the user plus sites that predate ownership (user_id IS NULL).
     */
    public List<Site> findVisibleTo(String userId) {
        return jdbcTemplate.query(
                "SELECT * FROM sites WHERE user_id = ? OR user_id IS NULL ORDER BY created_at DESC",
                ROW_MAPPER, userId);
    }

    public Optional<Site> findBySiteCode(String siteCode) {
        return jdbcTemplate.query("SELECT * FROM sites WHERE site_code = ?", ROW_MAPPER, siteCode)
                .stream().findFirst();
    }

    public boolean existsBySiteCode(String siteCode) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM sites WHERE site_code = ?", Integer.class, siteCode);
        return count != null && count > 0;
    }

    /**
     * Applies the non-null fields. Reopening a site (running = true) clears end_date.
     *
     * @return rows matched
     */
    public int update(String id, SiteUpdate update) {
        PartialUpdate sql = partialUpdate()
                .set("name", update.getName())
                .set("site_type", update.getType() == null ? null : update.getType().code())
                .set("location", update.getLocation())
                .set("start_date", sqlDate(update.getStartDate()))
                .set("owner_name", update.getOwnerName())
                .set("contact", update.getContact());
        if (Boolean.TRUE.equals(update.getRunning())) {
            sql.set("is_running", true).setAlways("end_date", null);
        } else {
            sql.set("is_running", update.getRunning())
                    .set("end_date", sqlDate(update.getEndDate()));
        }
        return sql.execute(jdbcTemplate, id);
    }
}
