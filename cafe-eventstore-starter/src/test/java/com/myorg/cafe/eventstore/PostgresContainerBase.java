package com.myorg.cafe.eventstore;

import org.junit.jupiter.api.BeforeAll;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
public abstract class PostgresContainerBase {

    static final PostgreSQLContainer<?> pg = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("eventstore_it")
            .withUsername("test")
            .withPassword("test");

    @BeforeAll
    static void start() {
        if (!pg.isRunning()) pg.start();
    }
}
