package dev.mars.pgpubsub.test;

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

import org.testcontainers.containers.PostgreSQLContainer;

/**
 * Centralized PostgreSQL version constants for all pgpubsub tests.
 *
 * Usage:
 * ```java
 * PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(PostgreSQLTestConstants.POSTGRES_IMAGE)
 *     .withDatabaseName("test_db")
 *     .withUsername("test_user")
 *     .withPassword("test_password");
 * ```
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-07
 * @version 1.0
 */
public final class PostgreSQLTestConstants {

    /**
     * The only PostgreSQL image used by the project's tests. Keep in sync with the literal used by
     * pgpubsub-migrations tests, which cannot depend on this module.
     */
    public static final String POSTGRES_IMAGE = "postgres:15.13-alpine3.20";

    public static final String DEFAULT_DATABASE_NAME = "pgpubsub_test";

    public static final String DEFAULT_USERNAME = "pgpubsub_test";

    public static final String DEFAULT_PASSWORD = "pgpubsub_test";

    /**
     * Standard shared memory size for PostgreSQL containers (256MB).
     */
    public static final long DEFAULT_SHARED_MEMORY_SIZE = 256 * 1024 * 1024L;

    /**
     * Creates a standard PostgreSQL container with default settings.
     *
     * @return configured PostgreSQL container
     */
    public static PostgreSQLContainer<?> createStandardContainer() {
        return createContainer(DEFAULT_DATABASE_NAME, DEFAULT_USERNAME, DEFAULT_PASSWORD);
    }

    /**
     * Creates a PostgreSQL container with custom database settings.
     *
     * @param databaseName the database name
     * @param username the username
     * @param password the password
     * @return configured PostgreSQL container
     */
    public static PostgreSQLContainer<?> createContainer(String databaseName, String username, String password) {
        return new PostgreSQLContainer<>(POSTGRES_IMAGE)
                .withDatabaseName(databaseName)
                .withUsername(username)
                .withPassword(password)
                .withSharedMemorySize(DEFAULT_SHARED_MEMORY_SIZE)
                .withReuse(false);
    }

    private PostgreSQLTestConstants() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }
}
