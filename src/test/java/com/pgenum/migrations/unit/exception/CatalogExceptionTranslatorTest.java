package com.pgenum.migrations.unit.exception;

import com.pgenum.migrations.exception.CatalogExceptionTranslator;
import com.pgenum.migrations.exception.DuplicateTypeException;
import com.pgenum.migrations.exception.EnumNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.BadSqlGrammarException;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

class CatalogExceptionTranslatorTest {

    @Test
    void translate_duplicateObject_returnsDuplicateTypeException() {
        var failure = new BadSqlGrammarException("create", "CREATE TYPE",
            new SQLException("type \"user_role\" already exists", "42710"));

        RuntimeException translated = CatalogExceptionTranslator.translate("user_role", failure);

        assertThat(translated).isInstanceOf(DuplicateTypeException.class).hasCause(failure);
    }

    @Test
    void translate_undefinedObject_returnsEnumNotFoundException() {
        var failure = new BadSqlGrammarException("drop", "DROP TYPE",
            new SQLException("type \"user_role\" does not exist", "42704"));

        assertThat(CatalogExceptionTranslator.translate("user_role", failure))
            .isInstanceOf(EnumNotFoundException.class);
    }

    @Test
    void translate_withoutSqlException_returnsOriginal() {
        var failure = new DataAccessResourceFailureException("connection refused");

        assertThat(CatalogExceptionTranslator.translate("user_role", failure)).isSameAs(failure);
    }
}
