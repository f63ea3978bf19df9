package com.pgenum.migrations;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PgEnumMigrationsApplication {

    public static void main(String[] args) {
        SpringApplication.run(PgEnumMigrationsApplication.class, args);
    }
}
