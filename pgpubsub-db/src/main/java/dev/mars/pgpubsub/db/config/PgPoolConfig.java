package dev.mars.pgpubsub.db.config;

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

import io.vertx.sqlclient.PoolOptions;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Settings of the shared pool that serves publishes, topic operations and claim transactions.
 *
 * <p>A DEFERRED claim keeps its pooled connection until the handler has finished, so every busy
 * subscription pins one connection. {@link #claimLimit()} is the number of subscriptions that can
 * be inside a handler at once while one connection stays free for publishes made from handlers.
 * LISTEN connections are dedicated and not counted here.</p>
 *
 * @param maxSize pooled connections, at least 1
 * @param maxWaitQueueSize requests allowed to wait for a connection, -1 for unbounded
 * @param connectionTimeout how long a request waits for a connection
 * @param idleTimeout how long an unused connection stays open
 * @param shared whether pools with the same options share their connections within one Vert.x instance
 */
public record PgPoolConfig(int maxSize,
                           int maxWaitQueueSize,
                           Duration connectionTimeout,
                           Duration idleTimeout,
                           boolean shared) {

    public static final int DEFAULT_MAX_SIZE = 16;
    public static final int DEFAULT_MAX_WAIT_QUEUE_SIZE = 128;
    public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofMinutes(10);

    public PgPoolConfig {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1, got " + maxSize);
        }
        if (maxWaitQueueSize < -1) {
            throw new IllegalArgumentException("maxWaitQueueSize must be -1 or greater, got " + maxWaitQueueSize);
        }
        Objects.requireNonNull(connectionTimeout, "connectionTimeout");
        Objects.requireNonNull(idleTimeout, "idleTimeout");
    }

    public static PgPoolConfig defaults() {
        return new PgPoolConfig(DEFAULT_MAX_SIZE, DEFAULT_MAX_WAIT_QUEUE_SIZE,
            DEFAULT_CONNECTION_TIMEOUT, DEFAULT_IDLE_TIMEOUT, true);
    }

    public PgPoolConfig withMaxSize(int size) {
        return new PgPoolConfig(size, maxWaitQueueSize, connectionTimeout, idleTimeout, shared);
    }

    public int claimLimit() {
        return maxSize == 1 ? 1 : maxSize - 1;
    }

    public PoolOptions toPoolOptions() {
        return new PoolOptions()
            .setMaxSize(maxSize)
            .setMaxWaitQueueSize(maxWaitQueueSize)
            .setConnectionTimeout((int) connectionTimeout.toMillis())
            .setConnectionTimeoutUnit(TimeUnit.MILLISECONDS)
            .setIdleTimeout((int) idleTimeout.toMillis())
            .setIdleTimeoutUnit(TimeUnit.MILLISECONDS)
            .setShared(shared);
    }
}
