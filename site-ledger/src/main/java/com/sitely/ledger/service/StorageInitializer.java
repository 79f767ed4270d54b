package com.sitely.ledger.service;

import com.sitely.ledger.exception.LedgerException;
import com.sitely.ledger.exception.SchemaException;
import com.sitely.ledger.migration.LegacyMigrationEngine;
import com.sitely.ledger.migration.MigrationReport;
import com.sitely.ledger.schema.SchemaManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Brings the store up once per process: schema, then legacy migration, then
 * the retention sweep, each stage only after the previous one finished.
 *
 * The whole chain is memoized. The first caller runs it; every other caller,
 * concurrent or later, gets the same future. A failure is memoized too, so
 * every store call after a failed start fails the same way.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StorageInitializer {

    private final SchemaManager schemaManager;
    private final LegacyMigrationEngine migrationEngine;
    private final RetentionSweeper retentionSweeper;

    private final AtomicReference<CompletableFuture<Void>> ready = new AtomicReference<>();

    public CompletableFuture<Void> initStorage() {
        CompletableFuture<Void> existing = ready.get();
        if (existing != null) {
            return existing;
        }
        CompletableFuture<Void> mine = new CompletableFuture<>();
        if (!ready.compareAndSet(null, mine)) {
            return ready.get();
        }

        try {
            schemaManager.ensureSchema();
            MigrationReport report = migrationEngine.migrateLegacyStore();
            RetentionSweeper.SweepResult sweep = retentionSweeper.sweep();
            log.info("Ledger storage ready (migration {}, {} expired row(s) swept)",
                    report.getStatus(), sweep.total());
            mine.complete(null);
        } catch (RuntimeException e) {
            log.error("Ledger storage failed to initialise: {}", e.getMessage(), e);
            mine.completeExceptionally(e);
        }
        return mine;
    }

    /**
     * Blocks until {@link #initStorage()} has finished, starting it if needed.
     *
     * @throws LedgerException the memoized initialization failure
     */
    public void awaitReady() {
        try {
            initStorage().join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof LedgerException) {
                throw (LedgerException) cause;
            }
            throw new SchemaException("Ledger storage failed to initialise", cause);
        }
    }
}
