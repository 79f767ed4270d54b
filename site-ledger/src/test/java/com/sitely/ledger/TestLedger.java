package com.sitely.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitely.ledger.config.SiteLedgerProperties;
import com.sitely.ledger.migration.LegacyMigrationEngine;
import com.sitely.ledger.migration.LegacyRecordMapper;
import com.sitely.ledger.migration.LegacyStore;
import com.sitely.ledger.repository.ExpenseRecordRepository;
import com.sitely.ledger.repository.LedgerTotalsRepository;
import com.sitely.ledger.repository.MaterialRepository;
import com.sitely.ledger.repository.MaterialUsageRepository;
import com.sitely.ledger.repository.PaymentRecordRepository;
import com.sitely.ledger.repository.PhotoGroupRepository;
import com.sitely.ledger.repository.PhotoRepository;
import com.sitely.ledger.repository.SettingsRepository;
import com.sitely.ledger.repository.SiteRepository;
import com.sitely.ledger.repository.TodoRepository;
import com.sitely.ledger.repository.WageRecordRepository;
import com.sitely.ledger.repository.WorkerRepository;
import com.sitely.ledger.schema.SchemaManager;
import com.sitely.ledger.service.LedgerStore;
import com.sitely.ledger.service.LedgerTransactions;
import com.sitely.ledger.service.MaterialService;
import com.sitely.ledger.service.PhotoService;
import com.sitely.ledger.service.RetentionPolicy;
import com.sitely.ledger.service.RetentionSweeper;
import com.sitely.ledger.service.SettingsService;
import com.sitely.ledger.service.SiteCodeGenerator;
import com.sitely.ledger.service.StorageInitializer;
import com.sitely.ledger.service.TodoService;
import com.sitely.ledger.sync.CloudMirror;
import com.sitely.ledger.sync.NoopCloudMirror;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * The whole storage layer wired by hand over a private in-memory H2 database.
 */
public class TestLedger {

    public static final Instant NOW = Instant.parse("2026-06-15T10:00:00Z");

    public final Clock clock;
    public final SiteLedgerProperties properties = new SiteLedgerProperties();
    public final ObjectMapper objectMapper = new ObjectMapper();
    public final JdbcTemplate jdbcTemplate;
    public final LedgerTransactions transactions;

    public final SiteRepository siteRepository;
    public final WorkerRepository workerRepository;
    public final WageRecordRepository wageRecordRepository;
    public final ExpenseRecordRepository expenseRecordRepository;
    public final PaymentRecordRepository paymentRecordRepository;
    public final LedgerTotalsRepository ledgerTotalsRepository;
    public final MaterialRepository materialRepository;
    public final MaterialUsageRepository materialUsageRepository;
    public final PhotoRepository photoRepository;
    public final PhotoGroupRepository photoGroupRepository;
    public final TodoRepository todoRepository;
    public final SettingsRepository settingsRepository;

    public final SchemaManager schemaManager;
    public final LegacyStore legacyStore;
    public final LegacyRecordMapper recordMapper;
    public final LegacyMigrationEngine migrationEngine;
    public final RetentionPolicy retentionPolicy;
    public final RetentionSweeper retentionSweeper;
    public final SiteCodeGenerator siteCodeGenerator;
    public final StorageInitializer storageInitializer;

    public final LedgerStore ledgerStore;
    public final MaterialService materialService;
    public final PhotoService photoService;
    public final TodoService todoService;
    public final SettingsService settingsService;

    public TestLedger() {
        this(Clock.fixed(NOW, ZoneOffset.UTC), new InMemoryLegacyStore(), new NoopCloudMirror());
    }

    public TestLedger(Clock clock, LegacyStore legacyStore, CloudMirror cloudMirror) {
        this.clock = clock;
        this.legacyStore = legacyStore;

        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "");
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactions = new LedgerTransactions(new DataSourceTransactionManager(dataSource));

        this.siteRepository = new SiteRepository(jdbcTemplate);
        this.workerRepository = new WorkerRepository(jdbcTemplate);
        this.wageRecordRepository = new WageRecordRepository(jdbcTemplate);
        this.expenseRecordRepository = new ExpenseRecordRepository(jdbcTemplate);
        this.paymentRecordRepository = new PaymentRecordRepository(jdbcTemplate);
        this.ledgerTotalsRepository = new LedgerTotalsRepository(jdbcTemplate);
        this.materialRepository = new MaterialRepository(jdbcTemplate);
        this.materialUsageRepository = new MaterialUsageRepository(jdbcTemplate);
        this.photoRepository = new PhotoRepository(jdbcTemplate);
        this.photoGroupRepository = new PhotoGroupRepository(jdbcTemplate);
        this.todoRepository = new TodoRepository(jdbcTemplate);
        this.settingsRepository = new SettingsRepository(jdbcTemplate);

        this.schemaManager = new SchemaManager(jdbcTemplate);
        this.recordMapper = new LegacyRecordMapper(clock);
        this.migrationEngine = newMigrationEngine(wageRecordRepository);
        this.retentionPolicy = new RetentionPolicy(clock, properties);
        this.retentionSweeper = new RetentionSweeper(retentionPolicy, transactions,
                wageRecordRepository, expenseRecordRepository, paymentRecordRepository);
        this.siteCodeGenerator = new SiteCodeGenerator(siteRepository, properties, clock);
        this.storageInitializer = new StorageInitializer(schemaManager, migrationEngine, retentionSweeper);

        this.ledgerStore = new LedgerStore(storageInitializer, transactions, retentionPolicy, siteCodeGenerator,
                cloudMirror, clock, siteRepository, workerRepository, wageRecordRepository,
                expenseRecordRepository, paymentRecordRepository, ledgerTotalsRepository);
        this.materialService = new MaterialService(storageInitializer, transactions, cloudMirror, clock,
                materialRepository, materialUsageRepository);
        this.photoService = new PhotoService(storageInitializer, transactions, cloudMirror, clock,
                photoRepository, photoGroupRepository);
        this.todoService = new TodoService(storageInitializer, transactions, clock, todoRepository);
        this.settingsService = new SettingsService(storageInitializer, transactions, settingsRepository);
    }

    /**
     * A migration engine over this database, with the wage repository swapped
     * (e.g. for a spy that fails on a chosen record).
     */
    public LegacyMigrationEngine newMigrationEngine(WageRecordRepository wages) {
        return new LegacyMigrationEngine(legacyStore, objectMapper, recordMapper, transactions, properties,
                settingsRepository, siteRepository, workerRepository, wages, expenseRecordRepository,
                paymentRecordRepository, photoRepository, materialRepository, materialUsageRepository);
    }

    public int rowCount(String table) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return count == null ? 0 : count;
    }

    public int rowCount(String table, String siteId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + table + " WHERE site_id = ?", Integer.class, siteId);
        return count == null ? 0 : count;
    }
}
