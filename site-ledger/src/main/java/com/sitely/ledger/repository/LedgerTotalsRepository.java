package com.sitely.ledger.repository;

import com.sitely.ledger.model.WorkerTotals;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Balance sums computed by the storage engine. Wage history grows without
 * bound per worker, so rows are never pulled back just to be added up.
 */
@Repository
@RequiredArgsConstructor
public class LedgerTotalsRepository {

    private final JdbcTemplate jdbcTemplate;

    public WorkerTotals workerTotals(String siteId, String workerId, LocalDate cutoff) {
        Date from = Date.valueOf(cutoff);
        WorkerTotals totals = jdbcTemplate.queryForObject("""
                SELECT
                    (SELECT COALESCE(SUM(amount + overtime), 0) FROM wage_records
                        WHERE site_id = ? AND worker_id = ? AND record_date >= ?) AS total_wage,
                    (SELECT COALESCE(SUM(amount), 0) FROM expense_records
                        WHERE site_id = ? AND worker_id = ? AND record_date >= ?) AS total_expense,
                    (SELECT COALESCE(SUM(amount), 0) FROM payment_records
                        WHERE site_id = ? AND worker_id = ? AND record_date >= ?) AS total_paid
                """,
                (rs, rowNum) -> new WorkerTotals(
                        rs.getBigDecimal("total_wage"),
                        rs.getBigDecimal("total_expense"),
                        rs.getBigDecimal("total_paid")),
                siteId, workerId, from,
                siteId, workerId, from,
                siteId, workerId, from);
        return totals == null ? WorkerTotals.ZERO : totals;
    }

    /**
     * One grouped pass over all three streams for a site.
     *
     * @return totals keyed by worker id; workers without rows are absent
     */
    public Map<String, WorkerTotals> totalsBySite(String siteId, LocalDate cutoff) {
        Date from = Date.valueOf(cutoff);
        Map<String, WorkerTotals> totals = new LinkedHashMap<>();
        jdbcTemplate.query("""
                SELECT worker_id,
                       SUM(wage) AS total_wage,
                       SUM(expense) AS total_expense,
                       SUM(paid) AS total_paid
                FROM (
                    SELECT worker_id, amount + overtime AS wage,
                           CAST(0 AS DECIMAL(19,2)) AS expense, CAST(0 AS DECIMAL(19,2)) AS paid
                    FROM wage_records WHERE site_id = ? AND record_date >= ?
                    UNION ALL
                    SELECT worker_id, CAST(0 AS DECIMAL(19,2)), amount, CAST(0 AS DECIMAL(19,2))
                    FROM expense_records WHERE site_id = ? AND record_date >= ?
                    UNION ALL
                    SELECT worker_id, CAST(0 AS DECIMAL(19,2)), CAST(0 AS DECIMAL(19,2)), amount
                    FROM payment_records WHERE site_id = ? AND record_date >= ?
                ) streams
                GROUP BY worker_id
                ORDER BY worker_id
                """,
                (RowCallbackHandler) rs -> totals.put(rs.getString("worker_id"), new WorkerTotals(
                        rs.getBigDecimal("total_wage"),
                        rs.getBigDecimal("total_expense"),
                        rs.getBigDecimal("total_paid"))),
                siteId, from, siteId, from, siteId, from);
        return totals;
    }
}
