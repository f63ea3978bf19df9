package com.pgenum.migrations.model;

/**
 * A base-table column whose declared type is an enum type.
 */
public record ColumnBinding(String tableName, String columnName) {}
