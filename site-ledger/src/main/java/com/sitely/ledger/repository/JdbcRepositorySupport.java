package com.sitely.ledger.repository;

import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Shared plumbing for the table repositories: id lookups, deletes and the
 * java.time / java.sql conversions every row mapper needs.
 */
abstract class JdbcRepositorySupport {

    protected final JdbcTemplate jdbcTemplate;
    private final String table;

    protected JdbcRepositorySupport(JdbcTemplate jdbcTemplate, String table) {
        this.jdbcTemplate = jdbcTemplate;
        this.table = table;
    }

    public String table() {
        return table;
    }

    public boolean existsById(String id) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + table + " WHERE id = ?", Integer.class, id);
        return count != null && count > 0;
    }

    /** @return number of rows removed, 0 when the id is unknown */
    public int deleteById(String id) {
        return jdbcTemplate.update("DELETE FROM " + table + " WHERE id = ?", id);
    }

    public int count() {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return count == null ? 0 : count;
    }

    protected PartialUpdate partialUpdate() {
        return new PartialUpdate(table);
    }

    // ── Conversions ──────────────────────────────────────────────────────────

    static Date sqlDate(LocalDate date) {
        return date == null ? null : Date.valueOf(date);
    }

    static Timestamp sqlTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    static LocalDate localDate(ResultSet rs, String column) throws SQLException {
        Date date = rs.getDate(column);
        return date == null ? null : date.toLocalDate();
    }

    static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }

    static BigDecimal money(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    static String text(String value) {
        return value == null ? "" : value;
    }
}
