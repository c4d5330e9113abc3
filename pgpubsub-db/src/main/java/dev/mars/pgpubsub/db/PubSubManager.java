package dev.mars.pgpubsub.db;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.pgpubsub.api.database.ConnectOptionsProvider;
import dev.mars.pgpubsub.api.error.PubSubErrorCodes;
import dev.mars.pgpubsub.api.error.PubSubStoreException;
import dev.mars.pgpubsub.db.codec.JsonPayloadCodec;
import dev.mars.pgpubsub.db.config.PubSubConfiguration;
import dev.mars.pgpubsub.db.connection.PgConnectionManager;
import dev.mars.pgpubsub.db.metrics.PubSubMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.sqlclient.Pool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Owns the runtime resources shared by publishers and subscribers: the Vert.x instance,
 * the default pool, metrics and the Jackson mapper.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class PubSubManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PubSubManager.class);

    private final PubSubConfiguration configuration;
    private final Vertx vertx;
    private final boolean vertxOwnedByManager;
    private final MeterRegistry meterRegistry;
    private final PgConnectionManager connectionManager;
    private final Pool pool;
    private final PubSubMetrics metrics;
    private final ObjectMapper objectMapper;

    private volatile boolean started = false;
    private volatile boolean closed = false;

    public PubSubManager() {
        this(new PubSubConfiguration());
    }

    public PubSubManager(PubSubConfiguration configuration) {
        this(configuration, new SimpleMeterRegistry());
    }

    public PubSubManager(PubSubConfiguration configuration, MeterRegistry meterRegistry) {
        this(configuration, meterRegistry, null);
    }

    /**
     * @param vertx an externally owned Vert.x instance, or null to let the manager create and close its own
     */
    public PubSubManager(PubSubConfiguration configuration, MeterRegistry meterRegistry, Vertx vertx) {
        this(configuration, meterRegistry, vertx != null ? vertx : Vertx.vertx(), vertx == null);
    }

    PubSubManager(PubSubConfiguration configuration, MeterRegistry meterRegistry, Vertx vertx, boolean vertxOwnedByManager) {
        this.configuration = configuration;
        this.meterRegistry = meterRegistry;
        this.objectMapper = JsonPayloadCodec.createDefaultObjectMapper();
        this.vertx = vertx;
        this.vertxOwnedByManager = vertxOwnedByManager;

        logger.info("Initializing PubSub Manager with profile: {} ({} Vert.x instance)",
            configuration.getProfile(), vertxOwnedByManager ? "owned" : "external");

        this.connectionManager = new PgConnectionManager(this.vertx, meterRegistry);
        try {
            var dbConfig = configuration.getDatabaseConfig();
            logger.debug("Creating default pool with host={}, port={}, db={}, user={}",
                dbConfig.getHost(), dbConfig.getPort(), dbConfig.getDatabase(), dbConfig.getUsername());
            this.pool = connectionManager.getOrCreateReactivePool(PubSubDefaults.DEFAULT_POOL_ID,
                dbConfig, configuration.getPoolConfig());
        } catch (RuntimeException e) {
            if (vertxOwnedByManager) {
                logger.debug("Closing owned Vert.x instance after failed pool setup");
                this.vertx.close();
            }
            throw e;
        }

        this.metrics = new PubSubMetrics(configuration.getMetricsConfig().getInstanceId());
        if (configuration.getMetricsConfig().isEnabled() && meterRegistry != null) {
            metrics.bindTo(meterRegistry);
        }

        logger.info("PubSub Manager initialized successfully");
    }

    /**
     * Validates database connectivity. Completes once a {@code SELECT 1} has succeeded.
     */
    public Future<Void> startReactive() {
        if (closed) {
            return Future.failedFuture(new IllegalStateException("PubSub Manager is closed"));
        }
        if (started) {
            logger.warn("PubSub Manager is already started");
            return Future.succeededFuture();
        }

        logger.info("Validating database connectivity...");
        return connectionManager.withConnection(PubSubDefaults.DEFAULT_POOL_ID, connection ->
                connection.query("SELECT 1").execute())
            .<Void>mapEmpty()
            .onSuccess(v -> {
                started = true;
                logger.info("PubSub Manager started successfully");
            })
            .recover(throwable -> {
                logger.error("Database connectivity validation failed: {}", throwable.getMessage());
                return Future.failedFuture(new PubSubStoreException(PubSubErrorCodes.DATABASE_CONNECTION_FAILED,
                    "Database startup validation failed: " + throwable.getMessage(), null, throwable));
            });
    }

    /**
     * Blocking variant of {@link #startReactive()}. Must not be called on an event loop thread.
     */
    public synchronized void start() {
        if (Vertx.currentContext() != null && Vertx.currentContext().isEventLoopContext()) {
            throw new IllegalStateException("Do not call blocking start() on event-loop thread - use startReactive() instead");
        }
        try {
            startReactive()
                .toCompletionStage()
                .toCompletableFuture()
                .get(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while starting PubSub Manager", e);
        } catch (Exception e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof PubSubStoreException) {
                throw (PubSubStoreException) cause;
            }
            throw new PubSubStoreException(PubSubErrorCodes.DATABASE_CONNECTION_FAILED,
                "Failed to start PubSub Manager: " + cause.getMessage(), null, cause);
        }
    }

    public Future<Boolean> checkHealth() {
        return connectionManager.checkHealth(PubSubDefaults.DEFAULT_POOL_ID);
    }

    public boolean isStarted() {
        return started;
    }

    /**
     * Closes pools and, when owned, the Vert.x instance. Failures while closing are logged, not propagated.
     */
    public Future<Void> closeReactive() {
        if (closed) {
            return Future.succeededFuture();
        }
        closed = true;
        started = false;
        logger.info("Closing PubSub Manager");

        return connectionManager.closeAsync()
            .compose(v -> {
                if (vertxOwnedByManager) {
                    logger.info("Closing Vert.x instance (manager-owned)");
                    return vertx.close()
                        .recover(e -> {
                            if (e instanceof RejectedExecutionException || e.getCause() instanceof RejectedExecutionException) {
                                logger.debug("Vert.x event executor terminated during close; treating as closed.");
                            } else {
                                logger.warn("Error closing Vert.x instance", e);
                            }
                            return Future.succeededFuture();
                        });
                }
                logger.debug("Skipping Vert.x close (external ownership)");
                return Future.<Void>succeededFuture();
            })
            .onSuccess(v -> logger.info("PubSub Manager closed"));
    }

    @Override
    public void close() {
        if (Vertx.currentContext() != null && Vertx.currentContext().isEventLoopContext()) {
            logger.warn("Blocking close() called on event loop thread. Triggering async close and returning immediately.");
            closeReactive();
            return;
        }
        try {
            closeReactive().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while closing PubSub Manager");
        } catch (Exception e) {
            logger.error("Error during synchronous close", e);
        }
    }

    public <T> JsonPayloadCodec<T> codec(Class<T> payloadType) {
        return new JsonPayloadCodec<>(objectMapper, payloadType);
    }

    public ConnectOptionsProvider getConnectOptionsProvider() {
        return connectionManager.connectOptionsProvider(PubSubDefaults.DEFAULT_POOL_ID);
    }

    public PubSubConfiguration getConfiguration() { return configuration; }
    public Vertx getVertx() { return vertx; }
    public Pool getPool() { return pool; }
    public PgConnectionManager getConnectionManager() { return connectionManager; }
    public PubSubMetrics getMetrics() { return metrics; }
    public MeterRegistry getMeterRegistry() { return meterRegistry; }
    public ObjectMapper getObjectMapper() { return objectMapper; }
}
