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

import dev.mars.pgpubsub.api.ClaimMode;
import dev.mars.pgpubsub.api.MessageHandler;
import dev.mars.pgpubsub.api.ShutdownSignal;
import dev.mars.pgpubsub.api.Subscriber;
import dev.mars.pgpubsub.api.error.PubSubErrorCodes;
import dev.mars.pgpubsub.api.error.PubSubException;
import dev.mars.pgpubsub.db.config.PgPoolConfig;
import dev.mars.pgpubsub.db.metrics.PubSubMetrics;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Subscribe path. Every {@link #subscribe(String, MessageHandler)} call runs its own
 * {@link SubscriptionSession}; sessions share nothing but the pool and the shutdown signal,
 * so concurrent sessions on one topic are serialized only by row locks in the store.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class PgDeliveryEngine implements Subscriber {
    private static final Logger logger = LoggerFactory.getLogger(PgDeliveryEngine.class);

    private final VertxPoolAdapter poolAdapter;
    private final ShutdownSignal shutdownSignal;
    private final ClaimMode claimMode;
    private final PubSubMetrics metrics;
    private final int claimLimit;

    public PgDeliveryEngine(VertxPoolAdapter poolAdapter, ShutdownSignal shutdownSignal,
                            ClaimMode claimMode, PubSubMetrics metrics) {
        this(poolAdapter, shutdownSignal, claimMode, metrics, PgPoolConfig.defaults().claimLimit());
    }

    /**
     * @param claimLimit subscriptions the pool can serve inside handlers at once, see {@link PgPoolConfig#claimLimit()}
     */
    public PgDeliveryEngine(VertxPoolAdapter poolAdapter, ShutdownSignal shutdownSignal,
                            ClaimMode claimMode, PubSubMetrics metrics, int claimLimit) {
        this.poolAdapter = Objects.requireNonNull(poolAdapter, "poolAdapter");
        this.shutdownSignal = Objects.requireNonNull(shutdownSignal, "shutdownSignal");
        this.claimMode = claimMode == null ? ClaimMode.DEFERRED : claimMode;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.claimLimit = claimLimit;
        logger.debug("Created delivery engine with claim mode {}", this.claimMode);
    }

    @Override
    public CompletableFuture<Void> subscribe(String topic, MessageHandler handler) {
        return subscribeReactive(topic, handler).toCompletionStage().toCompletableFuture();
    }

    public Future<Void> subscribeReactive(String topic, MessageHandler handler) {
        if (topic == null || handler == null) {
            return Future.failedFuture(new PubSubException(PubSubErrorCodes.INVALID_ARGUMENT,
                "Topic and handler must not be null"));
        }
        int active = metrics.getActiveSubscriptions();
        if (active >= claimLimit) {
            logger.warn("{} subscription(s) already active for a claim limit of {}; claims on topic '{}' may wait for pool connections",
                active, claimLimit, topic);
        }
        return new SubscriptionSession(topic, handler, poolAdapter, shutdownSignal, claimMode, metrics).start();
    }

    public ClaimMode getClaimMode() {
        return claimMode;
    }

    public int getClaimLimit() {
        return claimLimit;
    }
}
