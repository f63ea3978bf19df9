package com.pgenum.migrations.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Settings for enum migrations, bound from the {@code enum-migrations} prefix.
 *
 * @param schema          schema that owns the enum types and the tables bound to them
 * @param temporaryPrefix prefix of the placeholder type created while an enum's labels change
 */
@ConfigurationProperties(prefix = "enum-migrations")
public record EnumMigrationProperties(
    @DefaultValue("public") String schema,
    @DefaultValue("new_") String temporaryPrefix
) {
    public static final String DEFAULT_SCHEMA = "public";
    public static final String DEFAULT_TEMPORARY_PREFIX = "new_";

    public EnumMigrationProperties {
        if (schema == null || schema.isBlank()) {
            throw new IllegalArgumentException("enum-migrations.schema must not be blank");
        }
        if (temporaryPrefix == null || temporaryPrefix.isEmpty()) {
            throw new IllegalArgumentException("enum-migrations.temporary-prefix must not be empty");
        }
    }

    public static EnumMigrationProperties defaults() {
        return new EnumMigrationProperties(DEFAULT_SCHEMA, DEFAULT_TEMPORARY_PREFIX);
    }

    public String temporaryName(String typeName) {
        return temporaryPrefix + typeName;
    }
}
