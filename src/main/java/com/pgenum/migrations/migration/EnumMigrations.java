package com.pgenum.migrations.migration;

import com.pgenum.migrations.model.ColumnBinding;
import com.pgenum.migrations.operation.ChangeEnumValues;
import com.pgenum.migrations.operation.CreateEnum;
import com.pgenum.migrations.operation.DropEnum;
import com.pgenum.migrations.operation.EnumOperation;
import com.pgenum.migrations.operation.RenameEnum;
import com.pgenum.migrations.repository.EnumCatalogRepository;
import com.pgenum.migrations.service.EnumMutationExecutor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Operations available inside {@link EnumMigration#change}.
 *
 * <p>Going {@link Direction#UP}, each mutating call runs as soon as it is made, so
 * {@link #enumValues} and {@link #columnsUsingType} see the effect of the calls
 * before them. Going {@link Direction#DOWN}, calls are only recorded while
 * {@link EnumMigration#change} runs and are reverted afterwards in reverse order;
 * inspection then reads the catalog as it was before the rollback.
 */
public class EnumMigrations {

    private final EnumCatalogRepository catalog;
    private final EnumMutationExecutor executor;
    private final Direction direction;
    private final List<EnumOperation> operations = new ArrayList<>();

    public EnumMigrations(EnumCatalogRepository catalog, EnumMutationExecutor executor, Direction direction) {
        this.catalog = catalog;
        this.executor = executor;
        this.direction = direction;
    }

    /**
     * Runs {@code migration} in {@code direction}. The caller owns the transaction.
     */
    public static List<EnumOperation> run(EnumMigration migration, Direction direction,
                                          EnumCatalogRepository catalog, EnumMutationExecutor executor) {
        EnumMigrations enums = new EnumMigrations(catalog, executor, direction);
        migration.change(enums);
        direction.completed(enums.operations, executor);
        return enums.operations();
    }

    public void createEnum(String name, String... values) {
        createEnum(name, List.of(values));
    }

    public void createEnum(String name, List<String> values) {
        declare(new CreateEnum(name, values));
    }

    /**
     * Drops without declaring the labels. Reverting a migration that contains
     * this call fails.
     */
    public void dropEnum(String name) {
        declare(new DropEnum(name));
    }

    public void dropEnum(String name, String... values) {
        dropEnum(name, List.of(values));
    }

    public void dropEnum(String name, List<String> values) {
        declare(new DropEnum(name, values));
    }

    public void addEnumValue(String name, String value) {
        addEnumValues(name, List.of(value));
    }

    public void addEnumValues(String name, String... values) {
        addEnumValues(name, List.of(values));
    }

    public void addEnumValues(String name, List<String> values) {
        declare(ChangeEnumValues.addValues(name, values));
    }

    public void removeEnumValue(String name, String value) {
        removeEnumValues(name, List.of(value));
    }

    public void removeEnumValues(String name, String... values) {
        removeEnumValues(name, List.of(values));
    }

    public void removeEnumValues(String name, List<String> values) {
        declare(ChangeEnumValues.removeValues(name, values));
    }

    public void changeEnumValues(String name, List<String> add, List<String> remove) {
        declare(new ChangeEnumValues(name, add, remove));
    }

    public void renameEnum(String from, String to) {
        declare(new RenameEnum(from, to));
    }

    public List<String> enumValues(String name) {
        return catalog.findLabels(name);
    }

    public List<ColumnBinding> columnsUsingType(String name) {
        return catalog.findBindings(name);
    }

    private void declare(EnumOperation operation) {
        operations.add(operation);
        direction.declared(operation, executor);
    }

    public List<EnumOperation> operations() {
        return Collections.unmodifiableList(operations);
    }
}
