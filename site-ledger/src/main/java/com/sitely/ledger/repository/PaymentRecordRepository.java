package com.sitely.ledger.repository;

import com.sitely.ledger.model.PaymentMethod;
import com.sitely.ledger.model.PaymentRecord;
import com.sitely.ledger.model.WorkerCategory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

@Repository
public class PaymentRecordRepository extends LedgerRowRepository<PaymentRecord> {

    private static final RowMapper<PaymentRecord> ROW_MAPPER = (rs, rowNum) -> PaymentRecord.builder()
            .id(rs.getString("id"))
            .siteId(rs.getString("site_id"))
            .workerId(rs.getString("worker_id"))
            .workerName(rs.getString("worker_name"))
            .workerCategory(WorkerCategory.fromCode(rs.getString("worker_category")))
            .amount(rs.getBigDecimal("amount"))
            .method(PaymentMethod.fromCode(rs.getString("method")))
            .date(localDate(rs, "record_date"))
            .time(rs.getString("record_time"))
            .build();

    public PaymentRecordRepository(JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate, "payment_records");
    }

    @Override
    protected RowMapper<PaymentRecord> rowMapper() {
        return ROW_MAPPER;
    }

    @Override
    protected String insertSql() {
        return """
                INSERT INTO payment_records
                (id, site_id, worker_id, worker_name, worker_category, amount, method, record_date, record_time)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
    }

    @Override
    protected Object[] insertArgs(PaymentRecord r) {
        return new Object[]{
                r.getId(),
                r.getSiteId(),
                r.getWorkerId(),
                r.getWorkerName(),
                r.getWorkerCategory().code(),
                r.getAmount(),
                (r.getMethod() == null ? PaymentMethod.CASH : r.getMethod()).code(),
                sqlDate(r.getDate()),
                text(r.getTime())
        };
    }

    @Override
    protected String idOf(PaymentRecord row) {
        return row.getId();
    }
}
