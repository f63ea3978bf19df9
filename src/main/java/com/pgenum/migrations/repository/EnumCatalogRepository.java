package com.pgenum.migrations.repository;

import com.pgenum.migrations.config.EnumMigrationProperties;
import com.pgenum.migrations.exception.CatalogExceptionTranslator;
import com.pgenum.migrations.model.ColumnBinding;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Catalog access for enum types of the configured schema.
 *
 * <p>Lookups bind every name as a parameter. DDL statements quote identifiers and
 * labels through {@link PgSql}, and PostgreSQL failures are translated into the
 * domain exceptions by {@link CatalogExceptionTranslator}.
 */
@Repository
@RequiredArgsConstructor
public class EnumCatalogRepository {

    private static final Logger log = LoggerFactory.getLogger(EnumCatalogRepository.class);

    private static final String LABELS_QUERY = """
        SELECT e.enumlabel
        FROM pg_catalog.pg_enum e
        JOIN pg_catalog.pg_type t ON t.oid = e.enumtypid
        JOIN pg_catalog.pg_namespace n ON n.oid = t.typnamespace
        WHERE n.nspname = ? AND t.typname = ?
        ORDER BY e.enumsortorder
        """;

    private static final String EXISTS_QUERY = """
        SELECT EXISTS (
            SELECT 1
            FROM pg_catalog.pg_type t
            JOIN pg_catalog.pg_namespace n ON n.oid = t.typnamespace
            WHERE n.nspname = ? AND t.typname = ? AND t.typtype = 'e'
        )
        """;

    /**
     * Columns declared directly on a table. Partitions and inheritance children
     * are skipped: their columns follow the parent's type change and cannot be
     * altered on their own.
     */
    private static final String BINDINGS_QUERY = """
        SELECT c.relname AS table_name, a.attname AS column_name
        FROM pg_catalog.pg_attribute a
        JOIN pg_catalog.pg_class c ON c.oid = a.attrelid
        JOIN pg_catalog.pg_namespace cn ON cn.oid = c.relnamespace
        JOIN pg_catalog.pg_type t ON t.oid = a.atttypid
        JOIN pg_catalog.pg_namespace tn ON tn.oid = t.typnamespace
        WHERE cn.nspname = ?
          AND tn.nspname = ?
          AND t.typname = ?
          AND c.relkind IN ('r', 'p')
          AND NOT c.relispartition
          AND a.attnum > 0
          AND NOT a.attisdropped
          AND a.attinhcount = 0
        ORDER BY c.relname, a.attname
        """;

    private final JdbcTemplate jdbcTemplate;
    private final EnumMigrationProperties properties;

    public List<String> findLabels(String typeName) {
        return jdbcTemplate.queryForList(LABELS_QUERY, String.class, properties.schema(), typeName);
    }

    public boolean exists(String typeName) {
        Boolean exists = jdbcTemplate.queryForObject(EXISTS_QUERY, Boolean.class, properties.schema(), typeName);
        return Boolean.TRUE.equals(exists);
    }

    public List<ColumnBinding> findBindings(String typeName) {
        String schema = properties.schema();
        return jdbcTemplate.query(BINDINGS_QUERY,
            (rs, rowNum) -> new ColumnBinding(rs.getString("table_name"), rs.getString("column_name")),
            schema, schema, typeName);
    }

    public void createType(String typeName, List<String> labels) {
        execute(typeName, "CREATE TYPE " + qualified(typeName) + " AS ENUM (" + PgSql.literalList(labels) + ")");
    }

    public void dropType(String typeName) {
        execute(typeName, "DROP TYPE " + qualified(typeName));
    }

    /**
     * Retypes a column through its text representation, since PostgreSQL has no
     * cast between two enum types.
     */
    public void alterColumnType(ColumnBinding binding, String typeName) {
        String column = PgSql.identifier(binding.columnName());
        String type = qualified(typeName);
        execute(typeName, "ALTER TABLE " + qualified(binding.tableName())
            + " ALTER COLUMN " + column
            + " TYPE " + type
            + " USING " + column + "::text::" + type);
    }

    private String qualified(String name) {
        return PgSql.qualified(properties.schema(), name);
    }

    private void execute(String typeName, String sql) {
        log.debug("Executing: {}", sql);
        try {
            jdbcTemplate.execute(sql);
        } catch (DataAccessException ex) {
            throw CatalogExceptionTranslator.translate(typeName, ex);
        }
    }
}
