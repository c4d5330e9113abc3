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
import dev.mars.pgpubsub.api.PubSub;
import dev.mars.pgpubsub.api.ShutdownSignal;
import dev.mars.pgpubsub.api.Topic;
import dev.mars.pgpubsub.api.TopicStats;
import dev.mars.pgpubsub.db.PubSubManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * PostgreSQL implementation of {@link PubSub}.
 *
 * <p>The handle does not own the {@link PubSubManager}: closing it only requests shutdown of
 * the subscriptions observing its signal. Handles created with the same {@link ShutdownSignal}
 * are shut down together.</p>
 *
 * <pre>{@code
 * try (PubSubManager manager = new PubSubManager(new PubSubConfiguration())) {
 *     manager.start();
 *     try (PgPubSub pubsub = new PgPubSub(manager)) {
 *         pubsub.createTopic("orders").join();
 *         pubsub.push("orders", bytes).join();
 *     }
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class PgPubSub implements PubSub {
    private static final Logger logger = LoggerFactory.getLogger(PgPubSub.class);

    private final ShutdownSignal shutdownSignal;
    private final PgTopicRegistry topicRegistry;
    private final PgMessageQueue messageQueue;
    private final PgDeliveryEngine deliveryEngine;

    public PgPubSub(PubSubManager manager) {
        this(manager, new ShutdownSignal());
    }

    public PgPubSub(PubSubManager manager, ShutdownSignal shutdownSignal) {
        this(manager, shutdownSignal, manager.getConfiguration().getSubscriberConfig().getClaimMode());
    }

    public PgPubSub(PubSubManager manager, ShutdownSignal shutdownSignal, ClaimMode claimMode) {
        Objects.requireNonNull(manager, "manager");
        this.shutdownSignal = Objects.requireNonNull(shutdownSignal, "shutdownSignal");
        VertxPoolAdapter poolAdapter = new VertxPoolAdapter(manager.getVertx(), manager.getPool(),
            manager.getConnectOptionsProvider());
        this.topicRegistry = new PgTopicRegistry(poolAdapter);
        this.messageQueue = new PgMessageQueue(poolAdapter, manager.getMetrics());
        this.deliveryEngine = new PgDeliveryEngine(poolAdapter, shutdownSignal, claimMode, manager.getMetrics(),
            manager.getConfiguration().getPoolConfig().claimLimit());
    }

    @Override
    public CompletableFuture<Void> createTopic(String name) {
        return topicRegistry.createTopic(name);
    }

    @Override
    public CompletableFuture<Void> removeTopic(String name) {
        return topicRegistry.removeTopic(name);
    }

    @Override
    public CompletableFuture<List<Topic>> listTopics() {
        return topicRegistry.listTopics();
    }

    @Override
    public CompletableFuture<Long> push(String topic, byte[] content) {
        return messageQueue.push(topic, content);
    }

    @Override
    public CompletableFuture<TopicStats> stats(String topic) {
        return messageQueue.stats(topic);
    }

    @Override
    public CompletableFuture<Void> subscribe(String topic, MessageHandler handler) {
        return deliveryEngine.subscribe(topic, handler);
    }

    @Override
    public void shutdown() {
        if (shutdownSignal.trigger()) {
            logger.info("Shutdown requested");
        }
    }

    @Override
    public boolean isShutdown() {
        return shutdownSignal.isTriggered();
    }

    @Override
    public ShutdownSignal getShutdownSignal() {
        return shutdownSignal;
    }

    public ClaimMode getClaimMode() {
        return deliveryEngine.getClaimMode();
    }

    @Override
    public void close() {
        shutdown();
    }
}
