package dev.mars.pgpubsub.db.metrics;

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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delivery metrics for publish/subscribe traffic.
 *
 * Recording before {@link #bindTo(MeterRegistry)} is a no-op, so the engine can record
 * unconditionally whether or not metrics are enabled.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class PubSubMetrics implements MeterBinder {
    private static final Logger logger = LoggerFactory.getLogger(PubSubMetrics.class);

    private final String instanceId;
    private volatile MeterRegistry registry;

    // Counters
    private Counter messagesPublished;
    private Counter messagesDelivered;
    private Counter messagesFailed;
    private Counter messagesSkipped;

    // Timers
    private Timer messageProcessingTime;

    // Gauges
    private final AtomicInteger activeSubscriptions = new AtomicInteger(0);

    public PubSubMetrics(String instanceId) {
        this.instanceId = instanceId == null ? "default" : instanceId;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        messagesPublished = Counter.builder("pgpubsub.messages.published")
            .description("Total number of messages pushed to topics")
            .tag("instance", instanceId)
            .register(registry);

        messagesDelivered = Counter.builder("pgpubsub.messages.delivered")
            .description("Total number of messages processed by a callback and marked processed")
            .tag("instance", instanceId)
            .register(registry);

        messagesFailed = Counter.builder("pgpubsub.messages.failed")
            .description("Total number of callback failures")
            .tag("instance", instanceId)
            .register(registry);

        messagesSkipped = Counter.builder("pgpubsub.messages.skipped")
            .description("Notifications for messages already claimed, processed or on another topic")
            .tag("instance", instanceId)
            .register(registry);

        messageProcessingTime = Timer.builder("pgpubsub.message.processing.time")
            .description("Time taken by callbacks to process messages")
            .tag("instance", instanceId)
            .register(registry);

        Gauge.builder("pgpubsub.subscriptions.active", activeSubscriptions, AtomicInteger::get)
            .description("Number of running subscriptions")
            .tag("instance", instanceId)
            .register(registry);

        this.registry = registry;
        logger.info("PubSub metrics bound to registry for instance: {}", instanceId);
    }

    public void recordPublished(String topic) {
        if (registry != null) {
            messagesPublished.increment();
            topicCounter("pgpubsub.topic.messages.published", topic).increment();
        }
    }

    public void recordDelivered(String topic, Duration processingTime) {
        if (registry != null) {
            messagesDelivered.increment();
            messageProcessingTime.record(processingTime);
            topicCounter("pgpubsub.topic.messages.delivered", topic).increment();
        }
    }

    public void recordFailed(String topic) {
        if (registry != null) {
            messagesFailed.increment();
            topicCounter("pgpubsub.topic.messages.failed", topic).increment();
        }
    }

    public void recordSkipped(String topic) {
        if (registry != null) {
            messagesSkipped.increment();
        }
    }

    public void subscriptionStarted() {
        activeSubscriptions.incrementAndGet();
    }

    public void subscriptionEnded() {
        activeSubscriptions.decrementAndGet();
    }

    public int getActiveSubscriptions() {
        return activeSubscriptions.get();
    }

    public String getInstanceId() {
        return instanceId;
    }

    private Counter topicCounter(String name, String topic) {
        return Counter.builder(name)
            .tag("instance", instanceId)
            .tag("topic", topic == null ? "unknown" : topic)
            .register(registry);
    }
}
