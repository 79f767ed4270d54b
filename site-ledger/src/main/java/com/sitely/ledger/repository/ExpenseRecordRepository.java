package com.sitely.ledger.repository;

import com.sitely.ledger.model.ExpenseRecord;
import com.sitely.ledger.model.WorkerCategory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

@Repository
public class ExpenseRecordRepository extends LedgerRowRepository<ExpenseRecord> {

    private static final RowMapper<ExpenseRecord> ROW_MAPPER = (rs, rowNum) -> ExpenseRecord.builder()
            .id(rs.getString("id"))
            .siteId(rs.getString("site_id"))
            .workerId(rs.getString("worker_id"))
            .workerName(rs.getString("worker_name"))
            .workerCategory(WorkerCategory.fromCode(rs.getString("worker_category")))
            .description(rs.getString("description"))
            .amount(rs.getBigDecimal("amount"))
            .date(localDate(rs, "record_date"))
            .time(rs.getString("record_time"))
            .build();

    public ExpenseRecordRepository(JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate, "expense_records");
    }

    @Override
    protected RowMapper<ExpenseRecord> rowMapper() {
        return ROW_MAPPER;
    }

    @Override
    protected String insertSql() {
        return """
                INSERT INTO expense_records
                (id, site_id, worker_id, worker_name, worker_category, description, amount, record_date, record_time)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
    }

    @Override
    protected Object[] insertArgs(ExpenseRecord r) {
        return new Object[]{
                r.getId(),
                r.getSiteId(),
                r.getWorkerId(),
                r.getWorkerName(),
                r.getWorkerCategory().code(),
                text(r.getDescription()),
                r.getAmount(),
                sqlDate(r.getDate()),
                text(r.getTime())
        };
    }

    @Override
    protected String idOf(ExpenseRecord row) {
        return row.getId();
    }
}
