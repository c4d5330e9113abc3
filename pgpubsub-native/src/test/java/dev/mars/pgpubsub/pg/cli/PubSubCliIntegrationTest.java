package dev.mars.pgpubsub.pg.cli;

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

import dev.mars.pgpubsub.api.Topic;
import dev.mars.pgpubsub.pg.BasePubSubIntegrationTest;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PubSubCliIntegrationTest extends BasePubSubIntegrationTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int cli(String... args) {
        PostgreSQLContainer<?> postgres = getPostgres();
        String url = "postgres://" + postgres.getUsername() + ":" + postgres.getPassword()
            + "@" + postgres.getHost() + ":" + postgres.getFirstMappedPort() + "/" + postgres.getDatabaseName();
        return PubSubCli.run(args, Map.of("DATABASE_URL", url),
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8),
            PubSubCli.PgBackend::new);
    }

    @Test
    void migrateIsIdempotent() {
        assertThat(cli("migrate")).isEqualTo(PubSubCli.EXIT_OK);
        assertThat(cli("migrate")).isEqualTo(PubSubCli.EXIT_OK);
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("Migrations completed successfully");
    }

    @Test
    void addAndRemoveTopic() throws Exception {
        assertThat(cli("add-topic", "orders")).isEqualTo(PubSubCli.EXIT_OK);
        assertThat(awaitResult(pubsub.listTopics())).extracting(Topic::name).containsExactly("orders");

        assertThat(cli("add-topic", "orders")).isEqualTo(PubSubCli.EXIT_ERROR);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("ERROR: Topic already exists: orders");

        assertThat(cli("remove-topic", "orders")).isEqualTo(PubSubCli.EXIT_OK);
        assertThat(cli("remove-topic", "orders")).isEqualTo(PubSubCli.EXIT_OK);
        assertThat(awaitResult(pubsub.listTopics())).isEmpty();
    }
}
