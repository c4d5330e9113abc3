package dev.mars.pgpubsub.test.schema;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import dev.mars.pgpubsub.migrations.SchemaMigrations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.testcontainers.containers.PostgreSQLContainer;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Schema setup for tests. Applies the production Flyway scripts so tests always run against the
 * same tables and trigger as a deployed database.
 *
 * Usage:
 * ```java
 * @BeforeAll
 * static void schema() {
 *     PubSubTestSchemaInitializer.initializeSchema(postgres);
 * }
 *
 * @BeforeEach
 * void reset() {
 *     PubSubTestSchemaInitializer.resetData(postgres);
 * }
 * ```
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-09
 * @version 1.0
 */
public final class PubSubTestSchemaInitializer {

    private static final Logger logger = LoggerFactory.getLogger(PubSubTestSchemaInitializer.class);

    private PubSubTestSchemaInitializer() {
    }

    /**
     * Applies all pending migrations to the container's database.
     *
     * @param postgres the PostgreSQL container
     */
    public static void initializeSchema(PostgreSQLContainer<?> postgres) {
        int applied = SchemaMigrations.migrate(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        logger.info("Initialized pgpubsub schema in {} ({} migration(s) applied)", postgres.getDatabaseName(), applied);
    }

    /**
     * Deletes all messages and topics and resets their id sequences.
     *
     * @param postgres the PostgreSQL container
     */
    public static void resetData(PostgreSQLContainer<?> postgres) {
        try (Connection conn = DriverManager.getConnection(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
             Statement stmt = conn.createStatement()) {
            stmt.execute("TRUNCATE messages, topics RESTART IDENTITY");
            logger.debug("Reset pgpubsub tables in {}", postgres.getDatabaseName());
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to reset pgpubsub tables", e);
        }
    }
}
