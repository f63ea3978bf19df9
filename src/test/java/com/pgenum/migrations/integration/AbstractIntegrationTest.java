package com.pgenum.migrations.integration;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;

/**
 * Boots the application against a PostgreSQL container shared by every
 * integration test. Tests are skipped when Docker is not available.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
public abstract class AbstractIntegrationTest {

    private static final List<String> TEST_TYPES =
        List.of("user_role", "user_kind", "tmp_user_role", "tmp_user_kind");

    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine");

    static {
        postgres.start();
    }

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @BeforeEach
    void resetSchema() {
        jdbcTemplate.execute("DROP TABLE IF EXISTS events");
        jdbcTemplate.execute("DROP TABLE IF EXISTS users");
        for (String type : TEST_TYPES) {
            jdbcTemplate.execute("DROP TYPE IF EXISTS " + type);
        }
        jdbcTemplate.execute("CREATE TABLE users (id BIGSERIAL PRIMARY KEY, email VARCHAR(255))");
    }
}
