package com.sitely.ledger.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.time.LocalDate;
import java.util.List;

/**
 * Common shape of the three append-only ledger tables (wages, expenses,
 * payments). Every read takes the retention cutoff: rows dated before it are
 * never returned, whether or not the sweep has removed them yet.
 */
public abstract class LedgerRowRepository<T> extends JdbcRepositorySupport {

    protected LedgerRowRepository(JdbcTemplate jdbcTemplate, String table) {
        super(jdbcTemplate, table);
    }

    protected abstract RowMapper<T> rowMapper();

    protected abstract String insertSql();

    protected abstract Object[] insertArgs(T row);

    protected abstract String idOf(T row);

    public void insert(T row) {
        jdbcTemplate.update(insertSql(), insertArgs(row));
    }

    public void insertAll(List<T> rows) {
        if (rows.isEmpty()) return;
        jdbcTemplate.batchUpdate(insertSql(), rows.stream().map(this::insertArgs).toList());
    }

    public boolean insertIfAbsent(T row) {
        if (existsById(idOf(row))) {
            return false;
        }
        insert(row);
        return true;
    }

    /** Newest first, rows dated on or after the cutoff only. */
    public List<T> findBySiteId(String siteId, LocalDate cutoff) {
        return jdbcTemplate.query(
                "SELECT * FROM " + table() + " WHERE site_id = ? AND record_date >= ?"
                        + " ORDER BY record_date DESC, record_time DESC",
                rowMapper(), siteId, sqlDate(cutoff));
    }

    public List<T> findBySiteIdAndWorkerId(String siteId, String workerId, LocalDate cutoff) {
        return jdbcTemplate.query(
                "SELECT * FROM " + table() + " WHERE site_id = ? AND worker_id = ? AND record_date >= ?"
                        + " ORDER BY record_date DESC, record_time DESC",
                rowMapper(), siteId, workerId, sqlDate(cutoff));
    }

    /** Hard delete of everything dated strictly before the cutoff. */
    public int deleteOlderThan(LocalDate cutoff) {
        return jdbcTemplate.update("DELETE FROM " + table() + " WHERE record_date < ?", sqlDate(cutoff));
    }
}
