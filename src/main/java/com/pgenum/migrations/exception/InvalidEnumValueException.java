package com.pgenum.migrations.exception;

/**
 * A stored value is not a label of the type a column is being converted to.
 */
public class InvalidEnumValueException extends EnumMigrationException {

    public InvalidEnumValueException(String typeName, Throwable cause) {
        super(typeName, "A column bound to " + typeName + " holds a value that is not a label of the new type", cause);
    }
}
