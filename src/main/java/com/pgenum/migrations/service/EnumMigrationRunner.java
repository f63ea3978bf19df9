package com.pgenum.migrations.service;

import com.pgenum.migrations.migration.Direction;
import com.pgenum.migrations.migration.EnumMigration;
import com.pgenum.migrations.migration.EnumMigrations;
import com.pgenum.migrations.repository.EnumCatalogRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Applies or rolls back an {@link EnumMigration} inside a single transaction.
 * Any failure aborts the whole migration and leaves the catalog as it was.
 */
@Service
@RequiredArgsConstructor
public class EnumMigrationRunner {

    private static final Logger log = LoggerFactory.getLogger(EnumMigrationRunner.class);

    private final EnumCatalogRepository catalog;
    private final EnumMutationExecutor executor;
    private final TransactionTemplate transactionTemplate;

    public void apply(EnumMigration migration) {
        run(migration, Direction.UP);
    }

    public void rollback(EnumMigration migration) {
        run(migration, Direction.DOWN);
    }

    private void run(EnumMigration migration, Direction direction) {
        String name = migration.getClass().getSimpleName();
        log.info("Running migration {} ({})", name, direction);
        transactionTemplate.executeWithoutResult(status ->
            EnumMigrations.run(migration, direction, catalog, executor));
        log.info("Migration {} ({}) completed", name, direction);
    }
}
