package dev.mars.pgpubsub.pg;

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
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.PgConnection;
import io.vertx.sqlclient.Pool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gives the registry, queue and delivery engine access to the shared pool and to dedicated
 * connections for LISTEN. The adapter owns none of these resources.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class VertxPoolAdapter {
    private static final Logger logger = LoggerFactory.getLogger(VertxPoolAdapter.class);

    private final Vertx vertx;
    private final Pool pool;
    private final ConnectOptionsProvider connectOptionsProvider;

    /**
     * @param vertx The Vert.x instance
     * @param pool The connection pool used for claims, publishes and topic changes
     * @param connectOptionsProvider Provider for connection options (for dedicated connections)
     */
    public VertxPoolAdapter(Vertx vertx, Pool pool, ConnectOptionsProvider connectOptionsProvider) {
        this.vertx = vertx;
        this.pool = pool;
        this.connectOptionsProvider = connectOptionsProvider;
        logger.debug("Initialized VertxPoolAdapter");
    }

    /**
     * Gets the pool or throws if not available.
     *
     * @return The Pool instance
     * @throws IllegalStateException if pool is not available
     */
    public Pool getPoolOrThrow() {
        if (this.pool == null) {
            throw new IllegalStateException("Pool is not available");
        }
        return this.pool;
    }

    public Vertx getVertx() {
        return vertx;
    }

    /**
     * Creates a dedicated, non-pooled PgConnection for LISTEN/UNLISTEN. The connection is bound
     * to the calling Vert.x context, so its handlers run there.
     *
     * @return A Future containing the dedicated connection
     */
    public Future<PgConnection> connectDedicated() {
        if (connectOptionsProvider == null) {
            return Future.failedFuture(new IllegalStateException("No ConnectOptionsProvider available for dedicated connection"));
        }

        PgConnectOptions opts = connectOptionsProvider.getConnectOptions();
        if (opts == null) {
            return Future.failedFuture(new IllegalStateException("ConnectOptionsProvider returned null options"));
        }

        if (vertx == null) {
            return Future.failedFuture(new IllegalStateException("No Vert.x instance available for dedicated connection"));
        }

        return PgConnection.connect(vertx, opts);
    }
}
