package com.pgenum.migrations.exception;

public class DuplicateTypeException extends EnumMigrationException {

    public DuplicateTypeException(String typeName, Throwable cause) {
        super(typeName, "Type already exists: " + typeName, cause);
    }
}
