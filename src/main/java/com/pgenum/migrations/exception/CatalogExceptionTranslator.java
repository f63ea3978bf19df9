package com.pgenum.migrations.exception;

import org.springframework.dao.DataAccessException;

import java.sql.SQLException;

/**
 * Maps PostgreSQL SQLSTATEs raised by enum DDL onto the domain exceptions.
 * Anything not listed here is returned unchanged.
 */
public final class CatalogExceptionTranslator {

    static final String DUPLICATE_OBJECT = "42710";
    static final String UNDEFINED_OBJECT = "42704";
    static final String DEPENDENT_OBJECTS_STILL_EXIST = "2BP01";
    static final String INVALID_TEXT_REPRESENTATION = "22P02";

    private CatalogExceptionTranslator() {}

    public static RuntimeException translate(String typeName, DataAccessException ex) {
        String sqlState = sqlState(ex);
        if (DUPLICATE_OBJECT.equals(sqlState)) {
            return new DuplicateTypeException(typeName, ex);
        }
        if (UNDEFINED_OBJECT.equals(sqlState)) {
            return new EnumNotFoundException(typeName, ex);
        }
        if (DEPENDENT_OBJECTS_STILL_EXIST.equals(sqlState)) {
            return new DependentObjectsExistException(typeName, ex);
        }
        if (INVALID_TEXT_REPRESENTATION.equals(sqlState)) {
            return new InvalidEnumValueException(typeName, ex);
        }
        return ex;
    }

    private static String sqlState(DataAccessException ex) {
        Throwable cause = ex.getMostSpecificCause();
        if (cause instanceof SQLException sql) {
            return sql.getSQLState();
        }
        return null;
    }
}
