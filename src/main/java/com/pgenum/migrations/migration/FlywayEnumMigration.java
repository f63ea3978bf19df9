package com.pgenum.migrations.migration;

import com.pgenum.migrations.config.EnumMigrationProperties;
import com.pgenum.migrations.repository.EnumCatalogRepository;
import com.pgenum.migrations.service.EnumMutationExecutor;
import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

/**
 * Runs an {@link EnumMigration} as a versioned Flyway Java migration, forward
 * only, on the connection and transaction Flyway supplies.
 *
 * <p>Declared as a Spring bean, the migration is handed to Flyway by Spring Boot
 * and receives the {@code enum-migrations.*} settings through its constructor.
 * Instantiated by Flyway's classpath scan, it falls back to
 * {@link EnumMigrationProperties#defaults()}.
 *
 * <pre>{@code
 * @Component
 * public class V7__AddSuspendedStatus extends FlywayEnumMigration {
 *     public V7__AddSuspendedStatus(EnumMigrationProperties properties) {
 *         super(properties);
 *     }
 *
 *     public void change(EnumMigrations enums) {
 *         enums.addEnumValue("account_status", "suspended");
 *     }
 * }
 * }</pre>
 */
public abstract class FlywayEnumMigration extends BaseJavaMigration implements EnumMigration {

    private static final Logger log = LoggerFactory.getLogger(FlywayEnumMigration.class);

    private final EnumMigrationProperties properties;

    protected FlywayEnumMigration() {
        this(EnumMigrationProperties.defaults());
    }

    protected FlywayEnumMigration(EnumMigrationProperties properties) {
        this.properties = properties;
    }

    public EnumMigrationProperties getProperties() {
        return properties;
    }

    @Override
    public void migrate(Context context) throws Exception {
        log.info("Running migration: {}", getClass().getSimpleName());
        JdbcTemplate jdbcTemplate = new JdbcTemplate(new SingleConnectionDataSource(context.getConnection(), true));
        EnumCatalogRepository catalog = new EnumCatalogRepository(jdbcTemplate, properties);

        EnumMigrations.run(this, Direction.UP, catalog, new EnumMutationExecutor(catalog, properties));
    }
}
