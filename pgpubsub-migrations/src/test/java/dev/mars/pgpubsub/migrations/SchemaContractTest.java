package dev.mars.pgpubsub.migrations;

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

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Verifies the constraints the delivery engine relies on: unique topic names, message defaults
 * and the non-cascading topic reference.
 */
@Tag("integration")
@Testcontainers(disabledWithoutDocker = true)
class SchemaContractTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15.13-alpine3.20")
            .withDatabaseName("pgpubsub_contract_test")
            .withUsername("test")
            .withPassword("test");

    @BeforeAll
    static void migrate() {
        SchemaMigrations.migrate(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
    }

    @BeforeEach
    void truncate() throws SQLException {
        execute("TRUNCATE messages, topics RESTART IDENTITY");
    }

    @Test
    void testTopicNamesAreUnique() throws SQLException {
        execute("INSERT INTO topics (name) VALUES ('t')");

        assertThatThrownBy(() -> execute("INSERT INTO topics (name) VALUES ('t')"))
                .isInstanceOf(SQLException.class)
                .satisfies(e -> assertThat(((SQLException) e).getSQLState()).isEqualTo("23505"));
    }

    @Test
    void testMessageDefaults() throws SQLException {
        execute("INSERT INTO topics (name) VALUES ('t')");
        execute("INSERT INTO messages (topic_id, content) SELECT id, '\\x01'::bytea FROM topics WHERE name = 't'");

        try (Connection conn = connect();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT status::text, published_at, content FROM messages")) {
            assertThat(rs.next()).isTrue();
            assertThat(rs.getString(1)).isEqualTo("new");
            assertThat(rs.getTimestamp(2)).isNotNull();
            assertThat(rs.getBytes(3)).containsExactly(1);
        }
    }

    @Test
    void testTopicWithMessagesCannotBeDeleted() throws SQLException {
        execute("INSERT INTO topics (name) VALUES ('t')");
        execute("INSERT INTO messages (topic_id, content) SELECT id, '\\x01'::bytea FROM topics WHERE name = 't'");

        assertThatThrownBy(() -> execute("DELETE FROM topics WHERE name = 't'"))
                .isInstanceOf(SQLException.class)
                .satisfies(e -> assertThat(((SQLException) e).getSQLState()).isEqualTo("23503"));
    }

    @Test
    void testContentIsRequired() throws SQLException {
        execute("INSERT INTO topics (name) VALUES ('t')");

        assertThatThrownBy(() -> execute("INSERT INTO messages (topic_id, content) SELECT id, NULL FROM topics WHERE name = 't'"))
                .isInstanceOf(SQLException.class)
                .satisfies(e -> assertThat(((SQLException) e).getSQLState()).isEqualTo("23502"));
    }

    private static void execute(String sql) throws SQLException {
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }

    private static Connection connect() throws SQLException {
        return DriverManager.getConnection(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
    }
}
