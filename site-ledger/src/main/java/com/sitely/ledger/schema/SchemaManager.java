package com.sitely.ledger.schema;

import com.sitely.ledger.exception.SchemaException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Creates the relational schema and applies additive column migrations.
 *
 * Tables are created in their first-release shape; every column added since
 * is listed in {@link #COLUMN_MIGRATIONS} and applied only when missing, so
 * running this on every start is a no-op once the store is current.
 *
 * Cascade paths from sites are kept single: material_usages hang off
 * materials, and photos reference their group without a foreign key.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SchemaManager {

    static final List<ColumnMigration> COLUMN_MIGRATIONS = List.of(
            new ColumnMigration("sites", "site_code", "VARCHAR(16) DEFAULT NULL"),
            new ColumnMigration("sites", "user_id", "VARCHAR(128) DEFAULT NULL"),
            new ColumnMigration("wage_records", "overtime", "DECIMAL(19,2) DEFAULT 0 NOT NULL"),
            new ColumnMigration("payment_records", "method",
                    "VARCHAR(8) DEFAULT 'cash' NOT NULL CHECK (method IN ('cash', 'upi', 'bank'))"),
            new ColumnMigration("todos", "priority",
                    "VARCHAR(8) DEFAULT 'medium' NOT NULL CHECK (priority IN ('high', 'medium', 'low'))"),
            new ColumnMigration("expense_records", "description", "VARCHAR(1024) DEFAULT '' NOT NULL")
    );

    private final JdbcTemplate jdbcTemplate;

    public synchronized void ensureSchema() {
        log.info("Ensuring ledger schema exists...");
        try {
            createTables();
            int applied = 0;
            for (ColumnMigration migration : COLUMN_MIGRATIONS) {
                if (applyIfMissing(migration)) {
                    applied++;
                }
            }
            createIndexes();
            log.info("Ledger schema ready ({} column migration(s) applied).", applied);
        } catch (DataAccessException e) {
            log.error("Schema setup failed: {}", e.getMessage(), e);
            throw new SchemaException("Could not create or migrate the ledger schema", e);
        }
    }

    boolean columnExists(String table, String column) {
        Integer count = jdbcTemplate.queryForObject("""
                SELECT COUNT(*) FROM INFORMATION_SCHEMA.COLUMNS
                WHERE TABLE_SCHEMA = CURRENT_SCHEMA AND TABLE_NAME = ? AND COLUMN_NAME = ?
                """, Integer.class, table.toUpperCase(Locale.ROOT), column.toUpperCase(Locale.ROOT));
        return count != null && count > 0;
    }

    private boolean applyIfMissing(ColumnMigration migration) {
        if (columnExists(migration.table(), migration.column())) {
            log.debug("Column {}.{} already present", migration.table(), migration.column());
            return false;
        }
        log.info("Adding column {}.{}", migration.table(), migration.column());
        jdbcTemplate.execute("ALTER TABLE " + migration.table()
                + " ADD COLUMN " + migration.column() + " " + migration.definition());
        return true;
    }

    private void createTables() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS settings
            (
                setting_key     VARCHAR(64) PRIMARY KEY,
                setting_value   VARCHAR(1024) NOT NULL
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS sites
            (
                id              VARCHAR(64) PRIMARY KEY,
                name            VARCHAR(255) NOT NULL,
                site_type       VARCHAR(16) NOT NULL
                                CHECK (site_type IN ('residential', 'commercial', 'rowhouse', 'tenament', 'shop', 'other')),
                location        VARCHAR(512) DEFAULT '' NOT NULL,
                start_date      DATE,
                end_date        DATE,
                is_running      BOOLEAN DEFAULT TRUE NOT NULL,
                owner_name      VARCHAR(255) DEFAULT '' NOT NULL,
                contact         VARCHAR(64) DEFAULT '' NOT NULL,
                created_at      TIMESTAMP NOT NULL
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS workers
            (
                id              VARCHAR(64) PRIMARY KEY,
                site_id         VARCHAR(64) NOT NULL,
                name            VARCHAR(255) NOT NULL,
                age             VARCHAR(32) DEFAULT '' NOT NULL,
                contact         VARCHAR(64) DEFAULT '' NOT NULL,
                village         VARCHAR(255) DEFAULT '' NOT NULL,
                category        VARCHAR(16) NOT NULL CHECK (category IN ('karigar', 'majdur')),
                photo_uri       VARCHAR(2048),
                joining_date    DATE NOT NULL,
                FOREIGN KEY (site_id) REFERENCES sites(id) ON DELETE CASCADE
            )
        """);

        for (String ledgerTable : List.of("wage_records", "expense_records", "payment_records")) {
            jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS %s
                (
                    id              VARCHAR(64) PRIMARY KEY,
                    site_id         VARCHAR(64) NOT NULL,
                    worker_id       VARCHAR(64) NOT NULL,
                    worker_name     VARCHAR(255) NOT NULL,
                    worker_category VARCHAR(16) NOT NULL CHECK (worker_category IN ('karigar', 'majdur')),
                    amount          DECIMAL(19,2) NOT NULL,
                    record_date     DATE NOT NULL,
                    record_time     VARCHAR(32) DEFAULT '' NOT NULL,
                    FOREIGN KEY (site_id) REFERENCES sites(id) ON DELETE CASCADE
                )
            """.formatted(ledgerTable));
        }

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS photo_groups
            (
                id              VARCHAR(64) PRIMARY KEY,
                site_id         VARCHAR(64) NOT NULL,
                name            VARCHAR(255) NOT NULL,
                created_at      TIMESTAMP NOT NULL,
                FOREIGN KEY (site_id) REFERENCES sites(id) ON DELETE CASCADE
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS photos
            (
                id              VARCHAR(64) PRIMARY KEY,
                site_id         VARCHAR(64) NOT NULL,
                uri             VARCHAR(2048) NOT NULL,
                description     VARCHAR(1024) DEFAULT '' NOT NULL,
                record_date     DATE NOT NULL,
                record_time     VARCHAR(32) DEFAULT '' NOT NULL,
                group_id        VARCHAR(64),
                FOREIGN KEY (site_id) REFERENCES sites(id) ON DELETE CASCADE
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS materials
            (
                id              VARCHAR(64) PRIMARY KEY,
                site_id         VARCHAR(64) NOT NULL,
                name            VARCHAR(255) NOT NULL,
                vendor_name     VARCHAR(255) DEFAULT '' NOT NULL,
                vendor_phone    VARCHAR(64) DEFAULT '' NOT NULL,
                quantity        DECIMAL(19,3) DEFAULT 0 NOT NULL,
                unit            VARCHAR(8) NOT NULL
                                CHECK (unit IN ('kg', 'bag', 'piece', 'ton', 'litre', 'sqft', 'cft', 'nos', 'other')),
                rate_per_unit   DECIMAL(19,2) DEFAULT 0 NOT NULL,
                total_amount    DECIMAL(19,2) DEFAULT 0 NOT NULL,
                amount_paid     DECIMAL(19,2) DEFAULT 0 NOT NULL,
                bill_photo_uri  VARCHAR(2048),
                purchased_at    TIMESTAMP NOT NULL,
                FOREIGN KEY (site_id) REFERENCES sites(id) ON DELETE CASCADE
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS material_usages
            (
                id              VARCHAR(64) PRIMARY KEY,
                material_id     VARCHAR(64) NOT NULL,
                site_id         VARCHAR(64) NOT NULL,
                quantity_used   DECIMAL(19,3) NOT NULL,
                description     VARCHAR(1024) DEFAULT '' NOT NULL,
                usage_date      DATE NOT NULL,
                FOREIGN KEY (material_id) REFERENCES materials(id) ON DELETE CASCADE
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS todos
            (
                id              VARCHAR(64) PRIMARY KEY,
                title           VARCHAR(255) NOT NULL,
                description     VARCHAR(1024) DEFAULT '' NOT NULL,
                todo_type       VARCHAR(8) DEFAULT 'daily' NOT NULL CHECK (todo_type IN ('daily', 'monthly')),
                deadline        DATE,
                completed       BOOLEAN DEFAULT FALSE NOT NULL,
                completed_at    TIMESTAMP,
                site_id         VARCHAR(64),
                created_at      TIMESTAMP NOT NULL
            )
        """);
    }

    private void createIndexes() {
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_sites_user_id ON sites(user_id)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_sites_site_code ON sites(site_code)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_workers_site_id ON workers(site_id)");
        for (String ledgerTable : List.of("wage_records", "expense_records", "payment_records")) {
            jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_%1$s_site_date ON %1$s(site_id, record_date)"
                    .formatted(ledgerTable));
            jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_%1$s_worker ON %1$s(site_id, worker_id, record_date)"
                    .formatted(ledgerTable));
        }
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_photos_site_id ON photos(site_id)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_photo_groups_site_id ON photo_groups(site_id)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_materials_site_id ON materials(site_id)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_material_usages_material_id ON material_usages(material_id)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_todos_type ON todos(todo_type)");
    }

    record ColumnMigration(String table, String column, String definition) {
    }
}
