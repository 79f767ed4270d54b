package com.sitely.ledger.repository;

import com.sitely.ledger.model.Worker;
import com.sitely.ledger.model.WorkerCategory;
import com.sitely.ledger.model.WorkerUpdate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class WorkerRepository extends JdbcRepositorySupport {

    private static final RowMapper<Worker> ROW_MAPPER = (rs, rowNum) -> Worker.builder()
            .id(rs.getString("id"))
            .siteId(rs.getString("site_id"))
            .name(rs.getString("name"))
            .age(rs.getString("age"))
            .contact(rs.getString("contact"))
            .village(rs.getString("village"))
            .category(WorkerCategory.fromCode(rs.getString("category")))
            .photoUri(rs.getString("photo_uri"))
            .joiningDate(localDate(rs, "joining_date"))
            .build();

    public WorkerRepository(JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate, "workers");
    }

    public void insert(Worker worker) {
        jdbcTemplate.update("""
                INSERT INTO workers
                (id, site_id, name, age, contact, village, category, photo_uri, joining_date)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                worker.getId(),
                worker.getSiteId(),
                worker.getName(),
                text(worker.getAge()),
                text(worker.getContact()),
                text(worker.getVillage()),
                worker.getCategory().code(),
                worker.getPhotoUri(),
                sqlDate(worker.getJoiningDate()));
    }

    public boolean insertIfAbsent(Worker worker) {
        if (existsById(worker.getId())) {
            return false;
        }
        insert(worker);
        return true;
    }

    public Optional<Worker> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM workers WHERE id = ?", ROW_MAPPER, id)
                .stream().findFirst();
    }

    public List<Worker> findBySiteId(String siteId) {
        return jdbcTemplate.query(
                "SELECT * FROM workers WHERE site_id = ? ORDER BY joining_date DESC, name ASC",
                ROW_MAPPER, siteId);
    }

    public int update(String id, WorkerUpdate update) {
        return partialUpdate()
                .set("name", update.getName())
                .set("age", update.getAge())
                .set("contact", update.getContact())
                .set("village", update.getVillage())
                .set("category", update.getCategory() == null ? null : update.getCategory().code())
                .set("photo_uri", update.getPhotoUri())
                .execute(jdbcTemplate, id);
    }
}
