package com.pgenum.migrations.exception;

public class DependentObjectsExistException extends EnumMigrationException {

    public DependentObjectsExistException(String typeName, Throwable cause) {
        super(typeName, "Cannot drop type " + typeName + " because columns still depend on it", cause);
    }
}
