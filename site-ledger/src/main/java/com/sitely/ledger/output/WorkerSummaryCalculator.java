package com.sitely.ledger.output;

import com.sitely.ledger.model.ExpenseRecord;
import com.sitely.ledger.model.PaymentRecord;
import com.sitely.ledger.model.WageRecord;
import com.sitely.ledger.model.Worker;
import com.sitely.ledger.model.WorkerCategory;
import com.sitely.ledger.model.WorkerTotals;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds already-fetched ledger rows into per-worker summaries. No storage
 * access: callers pass the rows they listed.
 *
 * Workers come out in the order given. Rows whose worker is no longer in the
 * list (deleted workers) are summarised after them under the name and
 * category snapshotted on the rows.
 */
@Component
public class WorkerSummaryCalculator {

    public List<WorkerSummary> summarise(List<Worker> workers,
                                         List<WageRecord> wages,
                                         List<ExpenseRecord> expenses,
                                         List<PaymentRecord> payments) {
        Map<String, Accumulator> byWorker = new LinkedHashMap<>();
        for (Worker worker : workers) {
            byWorker.put(worker.getId(), new Accumulator(worker.getId(), worker.getName(), worker.getCategory()));
        }

        for (WageRecord wage : wages) {
            Accumulator acc = byWorker.computeIfAbsent(wage.getWorkerId(),
                    id -> new Accumulator(id, wage.getWorkerName(), wage.getWorkerCategory()));
            acc.wage = acc.wage.add(wage.getAmount()).add(orZero(wage.getOvertime()));
        }
        for (ExpenseRecord expense : expenses) {
            Accumulator acc = byWorker.computeIfAbsent(expense.getWorkerId(),
                    id -> new Accumulator(id, expense.getWorkerName(), expense.getWorkerCategory()));
            acc.expense = acc.expense.add(expense.getAmount());
        }
        for (PaymentRecord payment : payments) {
            Accumulator acc = byWorker.computeIfAbsent(payment.getWorkerId(),
                    id -> new Accumulator(id, payment.getWorkerName(), payment.getWorkerCategory()));
            acc.paid = acc.paid.add(payment.getAmount());
            if (acc.lastPayment == null || payment.getDate().isAfter(acc.lastPayment)) {
                acc.lastPayment = payment.getDate();
            }
        }

        List<WorkerSummary> summaries = new ArrayList<>(byWorker.size());
        for (Accumulator acc : byWorker.values()) {
            summaries.add(new WorkerSummary(acc.workerId, acc.name, acc.category,
                    new WorkerTotals(acc.wage, acc.expense, acc.paid), acc.lastPayment));
        }
        return summaries;
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    private static final class Accumulator {
        private final String workerId;
        private final String name;
        private final WorkerCategory category;
        private BigDecimal wage = BigDecimal.ZERO;
        private BigDecimal expense = BigDecimal.ZERO;
        private BigDecimal paid = BigDecimal.ZERO;
        private LocalDate lastPayment;

        private Accumulator(String workerId, String name, WorkerCategory category) {
            this.workerId = workerId;
            this.name = name;
            this.category = category;
        }
    }
}
