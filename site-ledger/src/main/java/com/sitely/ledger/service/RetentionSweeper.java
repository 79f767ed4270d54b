package com.sitely.ledger.service;

import com.sitely.ledger.repository.ExpenseRecordRepository;
import com.sitely.ledger.repository.PaymentRecordRepository;
import com.sitely.ledger.repository.WageRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

/**
 * Hard-deletes wage, expense and payment rows older than the retention
 * horizon. Nothing is archived; swept rows no longer count towards any
 * worker's totals.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RetentionSweeper {

    private final RetentionPolicy retentionPolicy;
    private final LedgerTransactions transactions;
    private final WageRecordRepository wageRecordRepository;
    private final ExpenseRecordRepository expenseRecordRepository;
    private final PaymentRecordRepository paymentRecordRepository;

    public SweepResult sweep() {
        LocalDate cutoff = retentionPolicy.cutoff();
        SweepResult result = transactions.write(() -> new SweepResult(
                cutoff,
                wageRecordRepository.deleteOlderThan(cutoff),
                expenseRecordRepository.deleteOlderThan(cutoff),
                paymentRecordRepository.deleteOlderThan(cutoff)));

        if (result.total() > 0) {
            log.info("Retention sweep before {}: removed {} wage, {} expense, {} payment row(s)",
                    cutoff, result.wages(), result.expenses(), result.payments());
        } else {
            log.debug("Retention sweep before {}: nothing to remove", cutoff);
        }
        return result;
    }

    public record SweepResult(LocalDate cutoff, int wages, int expenses, int payments) {

        public int total() {
            return wages + expenses + payments;
        }
    }
}
