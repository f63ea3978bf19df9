package com.pgenum.migrations.exception;

/**
 * Raised when rolling back an operation whose inverse cannot be derived,
 * such as dropping an enum without declaring the labels it had.
 */
public class IrreversibleOperationException extends EnumMigrationException {

    public IrreversibleOperationException(String typeName, String operation) {
        super(typeName, operation + " on " + typeName + " cannot be reverted: no labels were declared", null);
    }
}
