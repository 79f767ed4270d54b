package com.sitely.ledger.service;

import com.sitely.ledger.exception.LedgerConstraintException;
import com.sitely.ledger.exception.RecordNotFoundException;
import com.sitely.ledger.model.Amounts;
import com.sitely.ledger.model.ExpenseRecord;
import com.sitely.ledger.model.PaymentMethod;
import com.sitely.ledger.model.PaymentRecord;
import com.sitely.ledger.model.Site;
import com.sitely.ledger.model.SiteUpdate;
import com.sitely.ledger.model.WageRecord;
import com.sitely.ledger.model.Worker;
import com.sitely.ledger.model.WorkerCategory;
import com.sitely.ledger.model.WorkerTotals;
import com.sitely.ledger.model.WorkerUpdate;
import com.sitely.ledger.repository.ExpenseRecordRepository;
import com.sitely.ledger.repository.LedgerTotalsRepository;
import com.sitely.ledger.repository.PaymentRecordRepository;
import com.sitely.ledger.repository.SiteRepository;
import com.sitely.ledger.repository.WageRecordRepository;
import com.sitely.ledger.repository.WorkerRepository;
import com.sitely.ledger.sync.CloudMirror;
import com.sitely.ledger.sync.MirroredEntity;
import com.sitely.ledger.sync.SavedSiteReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Sites, workers and the three ledger streams (wages, expenses, payments).
 *
 * Every call waits for storage initialization first. Each mutation commits
 * as one transaction through {@link LedgerTransactions}; the cloud mirror is
 * told afterwards and its failures only get logged.
 *
 * Ledger rows are append-only here. They carry a snapshot of the worker's
 * name and category taken when the row is written, so later edits to the
 * worker leave history alone.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LedgerStore {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private final StorageInitializer storageInitializer;
    private final LedgerTransactions transactions;
    private final RetentionPolicy retentionPolicy;
    private final SiteCodeGenerator siteCodeGenerator;
    private final CloudMirror cloudMirror;
    private final Clock clock;
    private final SiteRepository siteRepository;
    private final WorkerRepository workerRepository;
    private final WageRecordRepository wageRecordRepository;
    private final ExpenseRecordRepository expenseRecordRepository;
    private final PaymentRecordRepository paymentRecordRepository;
    private final LedgerTotalsRepository ledgerTotalsRepository;

    // ── Sites ────────────────────────────────────────────────────────────────

    /**
     * Stores a new site. A missing id, creation time or site code is filled
     * in; a supplied code is upper-cased and must be well formed and free.
     * A running site never keeps an end date.
     */
    public Site createSite(Site site) {
        requireText(site.getName(), "Site name");
        if (site.getType() == null) {
            throw new LedgerConstraintException("Site type is required");
        }
        storageInitializer.awaitReady();

        Site created = transactions.write(() -> {
            Site toInsert = site.toBuilder()
                    .id(site.getId() == null ? newId() : site.getId())
                    .createdAt(site.getCreatedAt() == null ? clock.instant() : site.getCreatedAt())
                    .endDate(site.isRunning() ? null : site.getEndDate())
                    .siteCode(site.getSiteCode() == null
                            ? siteCodeGenerator.generateUniqueSiteCode().value()
                            : siteCodeGenerator.claimSuppliedCode(site.getSiteCode()))
                    .build();
            siteRepository.insert(toInsert);
            return toInsert;
        });
        log.debug("Created site {} ({})", created.getId(), created.getSiteCode());
        mirror(MirroredEntity.SITE, created.getId(), created);
        return created;
    }

    /**
     * All sites when userId is null; otherwise the user's sites plus sites
     * with no owner. This is a filter, not an access check.
     */
    public List<Site> listSites(String userId) {
        storageInitializer.awaitReady();
        return userId == null ? siteRepository.findAll() : siteRepository.findVisibleTo(userId);
    }

    public Optional<Site> findSite(String siteId) {
        storageInitializer.awaitReady();
        return siteRepository.findById(siteId);
    }

    public Optional<Site> findSiteByCode(String siteCode) {
        if (siteCode == null || siteCode.isBlank()) {
            return Optional.empty();
        }
        storageInitializer.awaitReady();
        return siteRepository.findBySiteCode(siteCode.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * An end date is only accepted for a closed site or together with
     * running = false. Reopening (running = true) clears it.
     */
    public Site updateSite(String siteId, SiteUpdate update) {
        storageInitializer.awaitReady();
        Site updated = transactions.write(() -> {
            Site current = siteRepository.findById(siteId)
                    .orElseThrow(() -> new RecordNotFoundException(siteRepository.table(), siteId));
            if (update.getEndDate() != null && update.getRunning() == null && current.isRunning()) {
                throw new LedgerConstraintException("Site " + siteId + " is running; close it to set an end date");
            }
            siteRepository.update(siteId, update);
            return siteRepository.findById(siteId)
                    .orElseThrow(() -> new RecordNotFoundException(siteRepository.table(), siteId));
        });
        mirror(MirroredEntity.SITE, siteId, updated);
        return updated;
    }

    /**
     * Removes the site and, through the schema's cascades, its workers,
     * ledger rows, materials, material usages, photos and photo groups.
     */
    public void deleteSite(String siteId) {
        storageInitializer.awaitReady();
        transactions.run(() -> {
            if (siteRepository.deleteById(siteId) == 0) {
                throw new RecordNotFoundException(siteRepository.table(), siteId);
            }
        });
        log.info("Deleted site {} and its dependent rows", siteId);
    }

    // ── Workers ──────────────────────────────────────────────────────────────

    public Worker createWorker(Worker worker) {
        requireText(worker.getSiteId(), "Worker site");
        requireText(worker.getName(), "Worker name");
        if (worker.getCategory() == null) {
            throw new LedgerConstraintException("Worker category is required");
        }
        storageInitializer.awaitReady();

        Worker created = transactions.write(() -> {
            Worker toInsert = worker.toBuilder()
                    .id(worker.getId() == null ? newId() : worker.getId())
                    .joiningDate(worker.getJoiningDate() == null ? LocalDate.now(clock) : worker.getJoiningDate())
                    .build();
            workerRepository.insert(toInsert);
            return toInsert;
        });
        mirror(MirroredEntity.WORKER, created.getId(), created);
        return created;
    }

    public List<Worker> listWorkers(String siteId) {
        storageInitializer.awaitReady();
        return workerRepository.findBySiteId(siteId);
    }

    public Optional<Worker> findWorker(String workerId) {
        storageInitializer.awaitReady();
        return workerRepository.findById(workerId);
    }

    public Worker updateWorker(String workerId, WorkerUpdate update) {
        storageInitializer.awaitReady();
        Worker updated = transactions.write(() -> {
            if (workerRepository.update(workerId, update) == 0) {
                throw new RecordNotFoundException(workerRepository.table(), workerId);
            }
            return workerRepository.findById(workerId)
                    .orElseThrow(() -> new RecordNotFoundException(workerRepository.table(), workerId));
        });
        mirror(MirroredEntity.WORKER, workerId, updated);
        return updated;
    }

    /**
     * Ledger rows keep the worker's snapshot and stay after the worker is gone.
     */
    public void deleteWorker(String workerId) {
        storageInitializer.awaitReady();
        transactions.run(() -> {
            if (workerRepository.deleteById(workerId) == 0) {
                throw new RecordNotFoundException(workerRepository.table(), workerId);
            }
        });
    }

    // ── Ledger rows ──────────────────────────────────────────────────────────

    /**
     * Appends a batch of wage rows in one transaction: either all are stored or none.
     */
    public List<WageRecord> addWageRecords(List<WageRecord> records) {
        storageInitializer.awaitReady();
        List<WageRecord> stored = transactions.write(() -> {
            List<WageRecord> rows = records.stream().map(this::completeWage).toList();
            wageRecordRepository.insertAll(rows);
            return rows;
        });
        stored.forEach(row -> mirror(MirroredEntity.WAGE_RECORD, row.getId(), row));
        return stored;
    }

    public List<ExpenseRecord> addExpenseRecords(List<ExpenseRecord> records) {
        storageInitializer.awaitReady();
        List<ExpenseRecord> stored = transactions.write(() -> {
            List<ExpenseRecord> rows = records.stream().map(this::completeExpense).toList();
            expenseRecordRepository.insertAll(rows);
            return rows;
        });
        stored.forEach(row -> mirror(MirroredEntity.EXPENSE_RECORD, row.getId(), row));
        return stored;
    }

    public PaymentRecord addPayment(PaymentRecord record) {
        storageInitializer.awaitReady();
        PaymentRecord stored = transactions.write(() -> {
            PaymentRecord row = completePayment(record);
            paymentRecordRepository.insert(row);
            return row;
        });
        mirror(MirroredEntity.PAYMENT_RECORD, stored.getId(), stored);
        return stored;
    }

    public List<WageRecord> listWageRecords(String siteId) {
        storageInitializer.awaitReady();
        return wageRecordRepository.findBySiteId(siteId, retentionPolicy.cutoff());
    }

    public List<WageRecord> listWageRecords(String siteId, String workerId) {
        storageInitializer.awaitReady();
        return wageRecordRepository.findBySiteIdAndWorkerId(siteId, workerId, retentionPolicy.cutoff());
    }

    public List<ExpenseRecord> listExpenseRecords(String siteId) {
        storageInitializer.awaitReady();
        return expenseRecordRepository.findBySiteId(siteId, retentionPolicy.cutoff());
    }

    public List<ExpenseRecord> listExpenseRecords(String siteId, String workerId) {
        storageInitializer.awaitReady();
        return expenseRecordRepository.findBySiteIdAndWorkerId(siteId, workerId, retentionPolicy.cutoff());
    }

    public List<PaymentRecord> listPayments(String siteId) {
        storageInitializer.awaitReady();
        return paymentRecordRepository.findBySiteId(siteId, retentionPolicy.cutoff());
    }

    public List<PaymentRecord> listPayments(String siteId, String workerId) {
        storageInitializer.awaitReady();
        return paymentRecordRepository.findBySiteIdAndWorkerId(siteId, workerId, retentionPolicy.cutoff());
    }

    // ── Aggregation ──────────────────────────────────────────────────────────

    /**
     * Sums computed by the database over the retention window. A worker or
     * site with no rows, including a deleted one, yields zeroed totals.
     */
    public WorkerTotals workerTotals(String siteId, String workerId) {
        storageInitializer.awaitReady();
        return ledgerTotalsRepository.workerTotals(siteId, workerId, retentionPolicy.cutoff());
    }

    /** Totals for every worker with at least one live ledger row on the site, keyed by worker id. */
    public Map<String, WorkerTotals> workerTotalsForSite(String siteId) {
        storageInitializer.awaitReady();
        return ledgerTotalsRepository.totalsBySite(siteId, retentionPolicy.cutoff());
    }

    /**
     * Sites the user saved elsewhere, as known to the cloud mirror. Empty when
     * the mirror is unreachable.
     */
    public List<SavedSiteReference> savedSiteReferences(String userId) {
        try {
            return cloudMirror.fetchSavedSites(userId);
        } catch (RuntimeException e) {
            log.warn("Could not fetch saved sites for user {}: {}", userId, e.getMessage());
            return List.of();
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private WageRecord completeWage(WageRecord record) {
        requireAmount(record.getAmount(), "Wage amount");
        BigDecimal overtime = record.getOvertime() == null ? BigDecimal.ZERO : record.getOvertime();
        requireAmount(overtime, "Overtime");
        Snapshot snapshot = snapshot(record.getSiteId(), record.getWorkerId(),
                record.getWorkerName(), record.getWorkerCategory());
        return record.toBuilder()
                .id(record.getId() == null ? newId() : record.getId())
                .workerName(snapshot.name())
                .workerCategory(snapshot.category())
                .amount(Amounts.money(record.getAmount()))
                .overtime(Amounts.money(overtime))
                .date(record.getDate() == null ? LocalDate.now(clock) : record.getDate())
                .time(record.getTime() == null ? nowTime() : record.getTime())
                .build();
    }

    private ExpenseRecord completeExpense(ExpenseRecord record) {
        requireAmount(record.getAmount(), "Expense amount");
        Snapshot snapshot = snapshot(record.getSiteId(), record.getWorkerId(),
                record.getWorkerName(), record.getWorkerCategory());
        return record.toBuilder()
                .id(record.getId() == null ? newId() : record.getId())
                .workerName(snapshot.name())
                .workerCategory(snapshot.category())
                .amount(Amounts.money(record.getAmount()))
                .description(record.getDescription() == null ? "" : record.getDescription())
                .date(record.getDate() == null ? LocalDate.now(clock) : record.getDate())
                .time(record.getTime() == null ? nowTime() : record.getTime())
                .build();
    }

    private PaymentRecord completePayment(PaymentRecord record) {
        requireAmount(record.getAmount(), "Payment amount");
        Snapshot snapshot = snapshot(record.getSiteId(), record.getWorkerId(),
                record.getWorkerName(), record.getWorkerCategory());
        return record.toBuilder()
                .id(record.getId() == null ? newId() : record.getId())
                .workerName(snapshot.name())
                .workerCategory(snapshot.category())
                .amount(Amounts.money(record.getAmount()))
                .method(record.getMethod() == null ? PaymentMethod.CASH : record.getMethod())
                .date(record.getDate() == null ? LocalDate.now(clock) : record.getDate())
                .time(record.getTime() == null ? nowTime() : record.getTime())
                .build();
    }

    /**
     * The worker must exist on the row's site. The caller's name and category
     * win over the worker's current ones.
     */
    private Snapshot snapshot(String siteId, String workerId, String name, WorkerCategory category) {
        requireText(siteId, "Ledger row site");
        requireText(workerId, "Ledger row worker");
        Worker worker = workerRepository.findById(workerId)
                .filter(w -> siteId.equals(w.getSiteId()))
                .orElseThrow(() -> new LedgerConstraintException(
                        "Worker " + workerId + " not found on site " + siteId));
        return new Snapshot(name != null ? name : worker.getName(),
                category != null ? category : worker.getCategory());
    }

    private void mirror(MirroredEntity kind, String id, Object entity) {
        try {
            cloudMirror.upsert(kind, id, entity);
        } catch (RuntimeException e) {
            log.warn("Cloud mirror upsert of {} {} failed: {}", kind, id, e.getMessage());
        }
    }

    private String nowTime() {
        return LocalTime.now(clock).format(TIME_FORMAT);
    }

    static String newId() {
        return UUID.randomUUID().toString();
    }

    static void requireAmount(BigDecimal amount, String what) {
        if (amount == null) {
            throw new LedgerConstraintException(what + " is required");
        }
        if (amount.signum() < 0) {
            throw new LedgerConstraintException(what + " must not be negative: " + amount);
        }
    }

    static void requireText(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new LedgerConstraintException(what + " is required");
        }
    }

    private record Snapshot(String name, WorkerCategory category) {
    }
}
