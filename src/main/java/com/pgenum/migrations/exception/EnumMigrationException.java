package com.pgenum.migrations.exception;

/**
 * Base type of every failure raised while changing or inspecting an enum type.
 */
public abstract class EnumMigrationException extends RuntimeException {

    private final String typeName;

    protected EnumMigrationException(String typeName, String message, Throwable cause) {
        super(message, cause);
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
