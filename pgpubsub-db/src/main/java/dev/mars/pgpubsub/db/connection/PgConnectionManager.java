package dev.mars.pgpubsub.db.connection;

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

import dev.mars.pgpubsub.api.database.ConnectOptionsProvider;
import dev.mars.pgpubsub.db.PubSubDefaults;
import dev.mars.pgpubsub.db.config.PgConnectionConfig;
import dev.mars.pgpubsub.db.config.PgPoolConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.pgclient.PgBuilder;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.SslMode;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.SqlConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Manages reactive PostgreSQL pools per service id using Vert.x 5.x.
 *
 * Besides the pools it keeps the {@link PgConnectOptions} each pool was built from, so that
 * subscriptions can open dedicated LISTEN connections against the same server.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 2.0
 */
public class PgConnectionManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PgConnectionManager.class);

    static final String SEARCH_PATH = "search_path";

    private final MeterRegistry meter;

    private final Map<String, Pool> reactivePools = new ConcurrentHashMap<>();
    private final Map<String, PgConnectOptions> connectOptions = new ConcurrentHashMap<>();

    private final Vertx vertx;

    public PgConnectionManager(Vertx vertx) {
        this(vertx, null);
    }

    public PgConnectionManager(Vertx vertx, MeterRegistry meter) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        this.meter = meter;
        logger.debug("Initialized PgConnectionManager");
    }

    /**
     * Creates or retrieves the reactive pool for a service. A schema other than {@code public}
     * is sent as the {@code search_path} startup parameter, so it applies to pooled and
     * dedicated connections alike.
     *
     * @param serviceId The unique identifier for the service, or null/blank for the default pool
     * @param connectionConfig The PostgreSQL connection configuration
     * @param poolConfig The connection pool configuration
     * @return The pool
     */
    public Pool getOrCreateReactivePool(String serviceId,
                                        PgConnectionConfig connectionConfig,
                                        PgPoolConfig poolConfig) {
        Objects.requireNonNull(connectionConfig, "connectionConfig");
        Objects.requireNonNull(poolConfig, "poolConfig");

        return reactivePools.computeIfAbsent(resolveServiceId(serviceId), id -> {
            try {
                PgConnectOptions options = toConnectOptions(connectionConfig);
                Pool pool = createReactivePool(options, poolConfig);
                connectOptions.put(id, options);
                logger.info("Created reactive pool for service '{}' ({}:{}/{}, maxSize={}, search_path={})", id,
                        connectionConfig.getHost(), connectionConfig.getPort(), connectionConfig.getDatabase(),
                        poolConfig.maxSize(), options.getProperties().getOrDefault(SEARCH_PATH, "default"));
                increment("pgpubsub.db.pool.created", id);
                return pool;
            } catch (RuntimeException e) {
                logger.error("Failed to create pool for {}: {}", id, e.getMessage());
                connectOptions.remove(id);
                increment("pgpubsub.db.pool.create.failed", id);
                throw e;
            }
        });
    }

    /**
     * Provider of options for dedicated connections to the service's server.
     */
    public ConnectOptionsProvider connectOptionsProvider(String serviceId) {
        String resolvedId = resolveServiceId(serviceId);
        return () -> {
            PgConnectOptions options = connectOptions.get(resolvedId);
            return options == null ? null : new PgConnectOptions(options);
        };
    }

    /**
     * Executes an operation with a pooled connection of the service.
     */
    public <T> Future<T> withConnection(String serviceId, Function<SqlConnection, Future<T>> operation) {
        String resolvedId = resolveServiceId(serviceId);
        Pool pool = reactivePools.get(resolvedId);
        if (pool == null) {
            return Future.failedFuture(new IllegalStateException("No reactive pool found for service: " + resolvedId));
        }
        return pool.withConnection(operation);
    }

    /**
     * Returns the search_path configured for a service, or null when the server default applies.
     */
    public String getSearchPath(String serviceId) {
        PgConnectOptions options = connectOptions.get(resolveServiceId(serviceId));
        return options == null ? null : options.getProperties().get(SEARCH_PATH);
    }

    private String resolveServiceId(String serviceId) {
        return (serviceId == null || serviceId.isBlank())
            ? PubSubDefaults.DEFAULT_POOL_ID
            : serviceId;
    }

    static PgConnectOptions toConnectOptions(PgConnectionConfig connectionConfig) {
        Objects.requireNonNull(connectionConfig.getHost(), "host");
        Objects.requireNonNull(connectionConfig.getDatabase(), "database");
        Objects.requireNonNull(connectionConfig.getUsername(), "username");

        PgConnectOptions options = new PgConnectOptions()
            .setHost(connectionConfig.getHost())
            .setPort(connectionConfig.getPort())
            .setDatabase(connectionConfig.getDatabase())
            .setUser(connectionConfig.getUsername())
            .setPassword(connectionConfig.getPassword() == null ? "" : connectionConfig.getPassword())
            .setSslMode(connectionConfig.isSslEnabled() ? SslMode.REQUIRE : SslMode.DISABLE);

        String schema = connectionConfig.getSchema();
        if (schema != null && !schema.isBlank() && !"public".equals(schema.trim())) {
            options.addProperty(SEARCH_PATH, normalizeSearchPath(schema));
        }
        return options;
    }

    private Pool createReactivePool(PgConnectOptions options, PgPoolConfig poolConfig) {
        return PgBuilder.pool()
            .with(poolConfig.toPoolOptions())
            .connectingTo(options)
            .using(vertx)
            .build();
    }

    /**
     * Accepts identifiers separated by commas; allows letters, digits, underscore.
     */
    static String normalizeSearchPath(String schemaConfig) {
        String s = schemaConfig.trim();
        if (!s.matches("[A-Za-z0-9_,\\s]+")) {
            throw new IllegalArgumentException(
                "Invalid schema config (allowed: letters, digits, underscore, comma, space): " + schemaConfig);
        }
        StringBuilder sb = new StringBuilder();
        for (String part : s.split(",")) {
            String p = part.trim();
            if (p.isEmpty()) continue;
            if (sb.length() > 0) sb.append(", ");
            sb.append(p);
        }
        return sb.toString();
    }

    /**
     * Runs {@code SELECT 1} on the service's pool.
     *
     * @return a future completing with false instead of failing when the database is unreachable
     */
    public Future<Boolean> checkHealth(String serviceId) {
        String resolvedId = resolveServiceId(serviceId);
        if (!reactivePools.containsKey(resolvedId)) {
            return Future.succeededFuture(false);
        }

        return withConnection(resolvedId, conn ->
            conn.query("SELECT 1").execute().map(rs -> true)
        ).recover(err -> {
            logger.warn("Health check failed for {}: {}", resolvedId, err.getMessage());
            return Future.succeededFuture(false);
        });
    }

    public Future<Void> closePoolAsync(String serviceId) {
        String resolvedId = resolveServiceId(serviceId);
        Pool pool = reactivePools.remove(resolvedId);
        connectOptions.remove(resolvedId);
        if (pool == null) {
            logger.debug("No pool found for service: {}", resolvedId);
            return Future.succeededFuture();
        }

        return pool.close()
            .onSuccess(v -> {
                logger.debug("Closed reactive pool for service: {}", resolvedId);
                increment("pgpubsub.db.pool.closed", resolvedId);
            })
            .onFailure(err -> {
                logger.warn("Failed to close reactive pool for service: {}", resolvedId, err);
                increment("pgpubsub.db.pool.close.failed", resolvedId);
            });
    }

    /**
     * Closes all pools. Individual close failures are logged and do not fail the result.
     */
    public Future<Void> closeAsync() {
        if (reactivePools.isEmpty()) {
            return Future.succeededFuture();
        }

        List<Future<Void>> closeFutures = new ArrayList<>();
        for (String serviceId : new ArrayList<>(reactivePools.keySet())) {
            closeFutures.add(closePoolAsync(serviceId));
        }

        return Future.all(closeFutures)
            .<Void>mapEmpty()
            .onSuccess(v -> logger.info("PgConnectionManager closed {} pool(s)", closeFutures.size()))
            .recover(throwable -> {
                logger.warn("Some pools failed to close cleanly: {}", throwable.getMessage());
                return Future.succeededFuture();
            });
    }

    /**
     * Synchronous wrapper for AutoCloseable. Prefer {@link #closeAsync()}.
     */
    @Override
    public void close() {
        try {
            closeAsync().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while closing PgConnectionManager");
        } catch (Exception e) {
            logger.error("Error during synchronous close", e);
        }
    }

    private void increment(String name, String serviceId) {
        if (meter != null) {
            Counter.builder(name)
                .tag("service", serviceId)
                .register(meter)
                .increment();
        }
    }
}
