package com.promptroute.test.integration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class PostgresIntegrationTestSupport {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("prompt_route_it")
            .withUsername("postgres")
            .withPassword("postgres")
            .withInitScript("sql/schema.sql");

    static {
        bridgeDockerApiVersionFromEnv();
        ensurePostgresStarted();
    }

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @DynamicPropertySource
    static void registerDataSource(DynamicPropertyRegistry registry) {
        ensurePostgresStarted();
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.datasource.driver-class-name", POSTGRES::getDriverClassName);
        registry.add("spring.datasource.type", () -> "com.zaxxer.hikari.HikariDataSource");
        registry.add("spring.sql.init.mode", () -> "never");
    }

    private static synchronized void ensurePostgresStarted() {
        if (!POSTGRES.isRunning()) {
            POSTGRES.start();
        }
    }

    private static void bridgeDockerApiVersionFromEnv() {
        if (System.getProperty("api.version") != null) {
            return;
        }
        String dockerApiVersion = System.getenv("DOCKER_API_VERSION");
        if (dockerApiVersion == null) {
            return;
        }
        String trimmed = dockerApiVersion.trim();
        if (!trimmed.isEmpty()) {
            System.setProperty("api.version", trimmed);
        }
    }

    @BeforeEach
    void truncateTables() {
        jdbcTemplate.execute("TRUNCATE TABLE interaction_outcomes, route_decisions, prompt_events, channel_weights, ledger_entries RESTART IDENTITY CASCADE");
    }

    /**
     * 直接写入一条事件与决策，返回决策 id。
     */
    protected Long insertDecision(String organization, String user, String channel) {
        Long eventId = jdbcTemplate.queryForObject(
                "INSERT INTO prompt_events (organization, user_key, features) VALUES (?, ?, '{}'::jsonb) RETURNING id",
                Long.class, organization, user);
        return jdbcTemplate.queryForObject(
                "INSERT INTO route_decisions (event_id, organization, user_key, chosen_channel, rule_scores, weights, "
                        + "final_scores, confidence, rationale, directive, served_channel) "
                        + "VALUES (?, ?, ?, ?, '{}'::jsonb, '{}'::jsonb, '{}'::jsonb, 0.5, '[]'::jsonb, 'ALLOW', ?) RETURNING id",
                Long.class, eventId, organization, user, channel, channel);
    }
}
