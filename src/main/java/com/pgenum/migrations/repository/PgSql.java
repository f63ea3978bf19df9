package com.pgenum.migrations.repository;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Quoting for the parts of PostgreSQL DDL that cannot be bound as parameters.
 */
public final class PgSql {

    /** NAMEDATALEN - 1; longer identifiers are silently truncated by the server. */
    static final int MAX_IDENTIFIER_BYTES = 63;

    private PgSql() {}

    public static String identifier(String name) {
        requireText(name, "Identifier");
        if (name.getBytes(StandardCharsets.UTF_8).length > MAX_IDENTIFIER_BYTES) {
            throw new IllegalArgumentException(
                "Identifier exceeds " + MAX_IDENTIFIER_BYTES + " bytes: " + name);
        }
        return '"' + name.replace("\"", "\"\"") + '"';
    }

    public static String qualified(String schema, String name) {
        return identifier(schema) + "." + identifier(name);
    }

    /**
     * Escape-string literal, read the same way whatever
     * {@code standard_conforming_strings} is set to.
     */
    public static String literal(String value) {
        requireText(value, "Enum label");
        return "E'" + value.replace("\\", "\\\\").replace("'", "''") + "'";
    }

    public static String literalList(List<String> values) {
        return values.stream()
            .map(PgSql::literal)
            .collect(Collectors.joining(", "));
    }

    private static void requireText(String value, String kind) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(kind + " must not be empty");
        }
        if (value.indexOf('\0') >= 0) {
            throw new IllegalArgumentException(kind + " must not contain NUL characters");
        }
    }
}
