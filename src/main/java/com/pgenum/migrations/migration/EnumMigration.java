package com.pgenum.migrations.migration;

/**
 * A reversible enum migration. {@link #change} declares the operations once;
 * the direction of execution decides whether they are applied or reverted.
 *
 * <pre>{@code
 * EnumMigration renameRole = enums -> enums.renameEnum("user_role", "user_kind");
 * }</pre>
 */
@FunctionalInterface
public interface EnumMigration {

    void change(EnumMigrations enums);
}
