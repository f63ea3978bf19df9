package com.pgenum.migrations.integration.migration;

import com.pgenum.migrations.config.EnumMigrationProperties;
import com.pgenum.migrations.migration.EnumMigrations;
import com.pgenum.migrations.migration.FlywayEnumMigration;
import org.springframework.stereotype.Component;

@Component
public class V4__AddSuspendedAccountStatus extends FlywayEnumMigration {

    public V4__AddSuspendedAccountStatus(EnumMigrationProperties properties) {
        super(properties);
    }

    @Override
    public void change(EnumMigrations enums) {
        enums.addEnumValue("account_status", "suspended");
    }
}
