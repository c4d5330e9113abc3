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
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.output.MigrateResult;

import java.io.PrintStream;
import java.util.Map;

/**
 * Standalone CLI for running pgpubsub database migrations.
 *
 * <p><b>Configuration via Environment Variables:</b>
 * <ul>
 *   <li>{@code DB_JDBC_URL} - JDBC connection URL (required)</li>
 *   <li>{@code DB_USER} - Database username (required)</li>
 *   <li>{@code DB_PASSWORD} - Database password (required)</li>
 *   <li>{@code DB_CLEAN_ON_START} - Set to "true" to clean database before migration (dev only!)</li>
 * </ul>
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code migrate} - Apply pending migrations (default)</li>
 *   <li>{@code info} - Show migration status and history</li>
 *   <li>{@code validate} - Validate applied migrations</li>
 *   <li>{@code repair} - Repair metadata table</li>
 *   <li>{@code clean} - Clean database (dev only - requires DB_CLEAN_ON_START=true)</li>
 * </ul>
 *
 * <p><b>Example:</b>
 * <pre>
 * export DB_JDBC_URL=jdbc:postgresql://localhost:5432/pubsub
 * export DB_USER=pubsub
 * export DB_PASSWORD=pubsub
 * java -cp pgpubsub-migrations.jar dev.mars.pgpubsub.migrations.RunMigrations migrate
 * </pre>
 */
public class RunMigrations {

    private static final String DEFAULT_COMMAND = "migrate";

    public static void main(String[] args) {
        System.exit(run(args, System.getenv(), System.out, System.err));
    }

    /**
     * Runs one command and returns the process exit code.
     */
    static int run(String[] args, Map<String, String> env, PrintStream out, PrintStream err) {
        try {
            String command = args.length > 0 ? args[0].toLowerCase() : DEFAULT_COMMAND;

            String jdbcUrl = getRequired(env, "DB_JDBC_URL");
            String user = getRequired(env, "DB_USER");
            String password = getRequired(env, "DB_PASSWORD");
            boolean cleanOnStart = Boolean.parseBoolean(env.getOrDefault("DB_CLEAN_ON_START", "false"));

            out.println("pgpubsub migration runner");
            out.println("Command:  " + command);
            out.println("Database: " + SchemaMigrations.maskPassword(jdbcUrl));
            out.println("User:     " + user);
            out.println();

            Flyway flyway = SchemaMigrations.configure(jdbcUrl, user, password, cleanOnStart);

            switch (command) {
                case "migrate":
                    if (cleanOnStart) {
                        out.println("WARNING: DB_CLEAN_ON_START=true - cleaning database, all data will be deleted");
                        flyway.clean();
                        out.println("Database cleaned");
                    }
                    MigrateResult result = flyway.migrate();
                    out.println("Migration completed successfully");
                    out.println("  Migrations executed: " + result.migrationsExecuted);
                    out.println("  Target version:      " + (result.targetSchemaVersion != null ? result.targetSchemaVersion : "latest"));
                    break;

                case "info":
                    out.println("Migration Status:");
                    for (MigrationInfo migration : flyway.info().all()) {
                        out.printf("%-10s | %-40s | %s%n",
                                migration.getVersion(),
                                migration.getDescription(),
                                migration.getState());
                    }
                    break;

                case "validate":
                    flyway.validate();
                    out.println("Validation successful - all migrations are consistent");
                    break;

                case "repair":
                    flyway.repair();
                    out.println("Metadata table repaired successfully");
                    break;

                case "clean":
                    if (!cleanOnStart) {
                        err.println("ERROR: 'clean' command requires DB_CLEAN_ON_START=true");
                        return 1;
                    }
                    flyway.clean();
                    out.println("Database cleaned successfully");
                    break;

                default:
                    err.println("ERROR: Unknown command: " + command);
                    err.println("   Valid commands: migrate, info, validate, repair, clean");
                    return 1;
            }
            return 0;

        } catch (Exception e) {
            err.println("ERROR: Migration failed");
            err.println("   " + e.getMessage());
            return 1;
        }
    }

    private static String getRequired(Map<String, String> env, String name) {
        String value = env.get(name);
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(
                    "Required environment variable not set: " + name
                    + " (set DB_JDBC_URL, DB_USER, DB_PASSWORD)");
        }
        return value;
    }
}
