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

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the pgpubsub schema with Flyway.
 *
 * <p>The scripts live under {@code db/migration} on the classpath and create the {@code topics}
 * and {@code messages} tables plus the trigger that emits a {@code new_message} notification
 * for every inserted message.</p>
 */
public final class SchemaMigrations {
    private static final Logger logger = LoggerFactory.getLogger(SchemaMigrations.class);

    public static final String LOCATION = "classpath:db/migration";

    private SchemaMigrations() {
    }

    /**
     * Builds a Flyway instance for the pgpubsub scripts.
     *
     * @param cleanAllowed whether {@code clean} may be executed
     */
    public static Flyway configure(String jdbcUrl, String user, String password, boolean cleanAllowed) {
        return Flyway.configure()
                .dataSource(jdbcUrl, user, password)
                .locations(LOCATION)
                .baselineOnMigrate(true)
                .outOfOrder(false)
                .validateOnMigrate(true)
                .cleanDisabled(!cleanAllowed)
                .connectRetries(3)
                .load();
    }

    /**
     * Applies all pending migrations.
     *
     * @return the number of migrations executed
     */
    public static int migrate(String jdbcUrl, String user, String password) {
        logger.info("Applying pgpubsub migrations to {}", maskPassword(jdbcUrl));
        MigrateResult result = configure(jdbcUrl, user, password, false).migrate();
        logger.info("Applied {} migration(s), schema now at version {}",
                result.migrationsExecuted, result.targetSchemaVersion);
        return result.migrationsExecuted;
    }

    static String maskPassword(String jdbcUrl) {
        return jdbcUrl.replaceAll("password=[^&;]+", "password=***");
    }
}
