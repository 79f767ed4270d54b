package com.sitely.ledger.schema;

import com.sitely.ledger.exception.SchemaException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class SchemaManagerTest {

    private JdbcTemplate jdbcTemplate;
    private SchemaManager schemaManager;

    @BeforeEach
    void setUp() {
        jdbcTemplate = new JdbcTemplate(new DriverManagerDataSource(
                "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", ""));
        schemaManager = new SchemaManager(jdbcTemplate);
    }

    @Test
    @DisplayName("creates every table and every migrated column")
    void createsSchema() {
        schemaManager.ensureSchema();

        for (String table : new String[]{"settings", "sites", "workers", "wage_records", "expense_records",
                "payment_records", "photo_groups", "photos", "materials", "material_usages", "todos"}) {
            Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
            assertThat(count).as(table).isZero();
        }
        for (SchemaManager.ColumnMigration migration : SchemaManager.COLUMN_MIGRATIONS) {
            assertThat(schemaManager.columnExists(migration.table(), migration.column()))
                    .as(migration.table() + "." + migration.column())
                    .isTrue();
        }
    }

    @Test
    @DisplayName("running it again on a current schema is a no-op")
    void idempotent() {
        schemaManager.ensureSchema();

        assertThatCode(() -> {
            schemaManager.ensureSchema();
            schemaManager.ensureSchema();
        }).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("adds columns missing from an older store and backfills their defaults")
    void appliesMissingColumns() {
        schemaManager.ensureSchema();
        jdbcTemplate.execute("INSERT INTO sites (id, name, site_type, created_at) "
                + "VALUES ('s1', 'old site', 'shop', CURRENT_TIMESTAMP)");
        jdbcTemplate.execute("INSERT INTO expense_records "
                + "(id, site_id, worker_id, worker_name, worker_category, amount, record_date) "
                + "VALUES ('e1', 's1', 'w1', 'Ramesh', 'karigar', 10, CURRENT_DATE)");
        jdbcTemplate.execute("ALTER TABLE expense_records DROP COLUMN description");
        jdbcTemplate.execute("ALTER TABLE sites DROP COLUMN site_code");
        assertThat(schemaManager.columnExists("expense_records", "description")).isFalse();

        schemaManager.ensureSchema();

        assertThat(schemaManager.columnExists("expense_records", "description")).isTrue();
        assertThat(schemaManager.columnExists("sites", "site_code")).isTrue();
        assertThat(jdbcTemplate.queryForObject(
                "SELECT description FROM expense_records WHERE id = 'e1'", String.class)).isEmpty();
    }

    @Test
    @DisplayName("an unreachable store surfaces as SchemaException")
    void failureIsSchemaException() {
        JdbcTemplate broken = mock(JdbcTemplate.class);
        doThrow(new DataAccessResourceFailureException("no database")).when(broken).execute(anyString());

        assertThatThrownBy(() -> new SchemaManager(broken).ensureSchema())
                .isInstanceOf(SchemaException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }
}
