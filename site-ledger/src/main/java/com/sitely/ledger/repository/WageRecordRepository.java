package com.sitely.ledger.repository;

import com.sitely.ledger.model.WageRecord;
import com.sitely.ledger.model.WorkerCategory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

@Repository
public class WageRecordRepository extends LedgerRowRepository<WageRecord> {

    private static final RowMapper<WageRecord> ROW_MAPPER = (rs, rowNum) -> WageRecord.builder()
            .id(rs.getString("id"))
            .siteId(rs.getString("site_id"))
            .workerId(rs.getString("worker_id"))
            .workerName(rs.getString("worker_name"))
            .workerCategory(WorkerCategory.fromCode(rs.getString("worker_category")))
            .amount(rs.getBigDecimal("amount"))
            .overtime(rs.getBigDecimal("overtime"))
            .date(localDate(rs, "record_date"))
            .time(rs.getString("record_time"))
            .build();

    public WageRecordRepository(JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate, "wage_records");
    }

    @Override
    protected RowMapper<WageRecord> rowMapper() {
        return ROW_MAPPER;
    }

    @Override
    protected String insertSql() {
        return """
                INSERT INTO wage_records
                (id, site_id, worker_id, worker_name, worker_category, amount, overtime, record_date, record_time)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
    }

    @Override
    protected Object[] insertArgs(WageRecord r) {
        return new Object[]{
                r.getId(),
                r.getSiteId(),
                r.getWorkerId(),
                r.getWorkerName(),
                r.getWorkerCategory().code(),
                r.getAmount(),
                money(r.getOvertime()),
                sqlDate(r.getDate()),
                text(r.getTime())
        };
    }

    @Override
    protected String idOf(WageRecord row) {
        return row.getId();
    }
}
