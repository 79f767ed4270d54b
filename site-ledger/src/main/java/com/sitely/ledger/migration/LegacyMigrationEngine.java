package com.sitely.ledger.migration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitely.ledger.config.SiteLedgerProperties;
import com.sitely.ledger.exception.MigrationRecordException;
import com.sitely.ledger.migration.legacy.LegacyLedgerEntry;
import com.sitely.ledger.migration.legacy.LegacyMaterial;
import com.sitely.ledger.migration.legacy.LegacyMaterialUsage;
import com.sitely.ledger.migration.legacy.LegacyPhoto;
import com.sitely.ledger.migration.legacy.LegacySite;
import com.sitely.ledger.migration.legacy.LegacyWorker;
import com.sitely.ledger.model.Material;
import com.sitely.ledger.repository.ExpenseRecordRepository;
import com.sitely.ledger.repository.MaterialRepository;
import com.sitely.ledger.repository.MaterialUsageRepository;
import com.sitely.ledger.repository.PaymentRecordRepository;
import com.sitely.ledger.repository.PhotoRepository;
import com.sitely.ledger.repository.SettingsRepository;
import com.sitely.ledger.repository.SiteRepository;
import com.sitely.ledger.repository.WageRecordRepository;
import com.sitely.ledger.repository.WorkerRepository;
import com.sitely.ledger.service.LedgerTransactions;
import com.sitely.ledger.service.SettingsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Copies the legacy flat key-value store into the relational tables.
 *
 * Each legacy key holds a JSON array of one entity type. Every element is
 * mapped and written in its own transaction with insert-if-absent semantics
 * keyed on the legacy id, so a pass can be repeated at any point without
 * duplicating rows. A record that fails is logged and skipped; the pass
 * carries on, but the completion flag is only written when nothing failed.
 *
 * The legacy store is read, never cleared.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LegacyMigrationEngine {

    public static final String COMPLETION_FLAG = "@sqlite_migrated";

    static final String LANGUAGE_KEY = "@language";
    static final String ONBOARDING_KEY = "@onboarding_done";
    static final String SITES_KEY = "@sites";
    static final String WORKERS_KEY = "@workers";
    static final String WAGES_KEY = "@hajari";
    static final String EXPENSES_KEY = "@expenses";
    static final String PAYMENTS_KEY = "@payments";
    static final String PHOTOS_KEY = "@photos";
    static final String MATERIALS_PREFIX = "sitely_materials_";
    static final String USAGE_PREFIX = "sitely_usage_";

    private final LegacyStore legacyStore;
    private final ObjectMapper objectMapper;
    private final LegacyRecordMapper recordMapper;
    private final LedgerTransactions transactions;
    private final SiteLedgerProperties properties;
    private final SettingsRepository settingsRepository;
    private final SiteRepository siteRepository;
    private final WorkerRepository workerRepository;
    private final WageRecordRepository wageRecordRepository;
    private final ExpenseRecordRepository expenseRecordRepository;
    private final PaymentRecordRepository paymentRecordRepository;
    private final PhotoRepository photoRepository;
    private final MaterialRepository materialRepository;
    private final MaterialUsageRepository materialUsageRepository;

    public MigrationReport migrateLegacyStore() {
        if (!properties.getLegacy().isEnabled()) {
            log.info("Legacy migration disabled");
            return MigrationReport.of(MigrationReport.Status.DISABLED);
        }
        if (legacyStore.get(COMPLETION_FLAG).map("true"::equals).orElse(false)) {
            log.debug("Legacy store already migrated");
            return MigrationReport.of(MigrationReport.Status.ALREADY_COMPLETE);
        }

        log.info("Migrating legacy key-value store...");
        MigrationReport report = new MigrationReport();

        migrateSetting(LANGUAGE_KEY, SettingsService.LANGUAGE, report);
        migrateSetting(ONBOARDING_KEY, SettingsService.ONBOARDING_DONE, report);

        // Parents before children: ledger rows, photos and materials reference sites.
        migrateArray(SITES_KEY, LegacySite.class, recordMapper::toSite, siteRepository::insertIfAbsent, report);
        migrateArray(WORKERS_KEY, LegacyWorker.class, recordMapper::toWorker, workerRepository::insertIfAbsent, report);
        migrateArray(WAGES_KEY, LegacyLedgerEntry.class, recordMapper::toWage,
                wageRecordRepository::insertIfAbsent, report);
        migrateArray(EXPENSES_KEY, LegacyLedgerEntry.class, recordMapper::toExpense,
                expenseRecordRepository::insertIfAbsent, report);
        migrateArray(PAYMENTS_KEY, LegacyLedgerEntry.class, recordMapper::toPayment,
                paymentRecordRepository::insertIfAbsent, report);
        migrateArray(PHOTOS_KEY, LegacyPhoto.class, recordMapper::toPhoto, photoRepository::insertIfAbsent, report);
        migrateMaterials(report);

        if (report.isClean()) {
            legacyStore.put(COMPLETION_FLAG, "true");
            report.setStatus(MigrationReport.Status.COMPLETED);
            log.info("Legacy migration complete: {} inserted, {} already present, {} unassigned",
                    report.getInserted(), report.getAlreadyPresent(), report.getUnassigned());
        } else {
            report.setStatus(MigrationReport.Status.INCOMPLETE);
            log.warn("Legacy migration incomplete: {} inserted, {} already present, {} failed {}; will retry on next start",
                    report.getInserted(), report.getAlreadyPresent(), report.getFailed(), report.getFailedRecords());
        }
        return report;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void migrateSetting(String legacyKey, String settingKey, MigrationReport report) {
        Optional<String> legacyValue = legacyStore.get(legacyKey);
        if (legacyValue.isEmpty()) {
            return;
        }
        try {
            boolean written = transactions.write(() -> {
                if (settingsRepository.find(settingKey).isPresent()) {
                    return false;
                }
                settingsRepository.put(settingKey, legacyValue.get());
                return true;
            });
            if (written) {
                report.recordInserted();
            } else {
                report.recordAlreadyPresent();
            }
        } catch (RuntimeException e) {
            skip(new MigrationRecordException(legacyKey, settingKey, e.getMessage(), e), report);
        }
    }

    /**
     * Materials live under one key per site; usages under one key per material.
     * All material keys go before any usage key since usages reference materials.
     *
     * The bucket with an empty site id holds materials saved before a site was
     * chosen. Its elements go to the only legacy site when there is exactly one;
     * otherwise elements without a site of their own are reported as unassigned
     * and left behind.
     */
    private void migrateMaterials(MigrationReport report) {
        List<String> keys = legacyStore.keys().stream().sorted().toList();
        Optional<String> orphanSite = soleLegacySiteId();

        for (String key : keys) {
            if (!key.startsWith(MATERIALS_PREFIX)) continue;
            String bucketSite = key.substring(MATERIALS_PREFIX.length());
            String siteId = bucketSite.isEmpty() ? orphanSite.orElse(null) : bucketSite;
            migrateArray(key, LegacyMaterial.class,
                    raw -> siteId == null && isBlank(raw.getSiteId()),
                    raw -> recordMapper.toMaterial(raw, siteId),
                    materialRepository::insertIfAbsent, report);
        }

        for (String key : keys) {
            if (!key.startsWith(USAGE_PREFIX)) continue;
            String rest = key.substring(USAGE_PREFIX.length());
            int split = rest.indexOf('_');
            String bucketSite = split < 0 ? "" : rest.substring(0, split);
            String materialId = split < 0 ? rest : rest.substring(split + 1);
            String siteId = bucketSite.isEmpty()
                    ? materialRepository.findById(materialId).map(Material::getSiteId).orElse(null)
                    : bucketSite;
            migrateArray(key, LegacyMaterialUsage.class,
                    raw -> siteId == null && isBlank(raw.getSiteId()),
                    raw -> recordMapper.toMaterialUsage(raw, siteId, materialId),
                    materialUsageRepository::insertIfAbsent, report);
        }
    }

    private Optional<String> soleLegacySiteId() {
        Optional<String> blob = legacyStore.get(SITES_KEY);
        if (blob.isEmpty()) {
            return Optional.empty();
        }
        try {
            JsonNode sites = objectMapper.readTree(blob.get());
            if (sites == null || !sites.isArray() || sites.size() != 1) {
                return Optional.empty();
            }
            return Optional.ofNullable(sites.get(0).path("id").asText(null)).filter(id -> !id.isBlank());
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private <L, R> void migrateArray(String key, Class<L> legacyType, Function<L, R> mapping,
                                     Predicate<R> insertIfAbsent, MigrationReport report) {
        migrateArray(key, legacyType, raw -> false, mapping, insertIfAbsent, report);
    }

    private <L, R> void migrateArray(String key, Class<L> legacyType, Predicate<L> unassigned,
                                     Function<L, R> mapping, Predicate<R> insertIfAbsent,
                                     MigrationReport report) {
        Optional<String> blob = legacyStore.get(key);
        if (blob.isEmpty()) {
            log.debug("Legacy key {} not present", key);
            return;
        }

        JsonNode array;
        try {
            array = objectMapper.readTree(blob.get());
        } catch (JsonProcessingException e) {
            skip(new MigrationRecordException(key, null, "unparseable JSON", e), report);
            return;
        }
        if (array == null || !array.isArray()) {
            skip(new MigrationRecordException(key, null, "expected a JSON array", null), report);
            return;
        }

        int before = report.getInserted();
        for (JsonNode element : array) {
            String recordId = element.path("id").asText(null);
            try {
                L legacy = objectMapper.treeToValue(element, legacyType);
                if (unassigned.test(legacy)) {
                    log.warn("Legacy record {}#{} has no site to belong to; leaving it behind", key, recordId);
                    report.recordUnassigned(key, recordId);
                    continue;
                }
                R row = mapping.apply(legacy);
                if (transactions.write(() -> insertIfAbsent.test(row))) {
                    report.recordInserted();
                } else {
                    report.recordAlreadyPresent();
                }
            } catch (JsonProcessingException | RuntimeException e) {
                skip(new MigrationRecordException(key, recordId, e.getMessage(), e), report);
            }
        }
        log.debug("Legacy key {}: {} element(s), {} inserted", key, array.size(), report.getInserted() - before);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private void skip(MigrationRecordException e, MigrationReport report) {
        log.warn("Skipping legacy record: {}", e.getMessage());
        report.recordFailure(e.getLegacyKey(), e.getRecordId());
    }
}
