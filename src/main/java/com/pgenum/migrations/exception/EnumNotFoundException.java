package com.pgenum.migrations.exception;

public class EnumNotFoundException extends EnumMigrationException {

    public EnumNotFoundException(String typeName) {
        this(typeName, null);
    }

    public EnumNotFoundException(String typeName, Throwable cause) {
        super(typeName, "Enum type not found: " + typeName, cause);
    }
}
