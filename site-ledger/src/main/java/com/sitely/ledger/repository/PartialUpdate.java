package com.sitely.ledger.repository;

import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds "UPDATE t SET a = ?, b = ? WHERE id = ?" from only the values a
 * caller actually supplied.
 */
final class PartialUpdate {

    private final String table;
    private final List<String> assignments = new ArrayList<>();
    private final List<Object> args = new ArrayList<>();

    PartialUpdate(String table) {
        this.table = table;
    }

    /** Adds the assignment only when value is non-null. */
    PartialUpdate set(String column, Object value) {
        if (value != null) {
            assignments.add(column + " = ?");
            args.add(value);
        }
        return this;
    }

    /** Adds the assignment even for null, for columns callers may clear. */
    PartialUpdate setAlways(String column, Object value) {
        assignments.add(column + " = ?");
        args.add(value);
        return this;
    }

    boolean isEmpty() {
        return assignments.isEmpty();
    }

    /**
     * @return rows matched; with nothing to assign, 1 if the row exists else 0
     */
    int execute(JdbcTemplate jdbcTemplate, String id) {
        if (isEmpty()) {
            Integer count = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM " + table + " WHERE id = ?", Integer.class, id);
            return count == null ? 0 : count;
        }
        List<Object> params = new ArrayList<>(args);
        params.add(id);
        String sql = "UPDATE " + table + " SET " + String.join(", ", assignments) + " WHERE id = ?";
        return jdbcTemplate.update(sql, params.toArray());
    }
}
