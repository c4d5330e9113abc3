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
import dev.mars.pgpubsub.api.error.PubSubErrorCodes;
import dev.mars.pgpubsub.api.error.PubSubStoreException;
import dev.mars.pgpubsub.api.error.UnknownTopicException;
import dev.mars.pgpubsub.db.PubSubDefaults;
import dev.mars.pgpubsub.db.error.PgErrors;
import dev.mars.pgpubsub.db.metrics.PubSubMetrics;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.pgclient.PgConnection;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * One {@code subscribe} call: LISTEN, backlog drain, then the live notification loop.
 *
 * <p>All mutable state is touched only on {@link #context}. The listener connection is created
 * from that context so its notification and close handlers run there as well, and handler
 * completions are moved back onto it before the transaction continues. At most one claim is in
 * flight at any time.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
final class SubscriptionSession {
    private static final Logger logger = LoggerFactory.getLogger(SubscriptionSession.class);

    static final String SELECT_TOPIC_ID = "SELECT id FROM topics WHERE name = $1";

    static final String SELECT_BACKLOG = """
        SELECT id FROM messages
        WHERE topic_id = $1 AND status = 'new'
        ORDER BY published_at ASC, id ASC
        """;

    static final String CLAIM_MESSAGE = """
        SELECT content FROM messages
        WHERE id = $1 AND topic_id = $2 AND status = 'new'
        FOR UPDATE SKIP LOCKED
        """;

    static final String MARK_PROCESSING = """
        UPDATE messages SET status = 'processing'
        WHERE id = (
            SELECT id FROM messages
            WHERE id = $1 AND topic_id = $2 AND status = 'new'
            FOR UPDATE SKIP LOCKED
        )
        RETURNING content
        """;

    static final String MARK_PROCESSED = "UPDATE messages SET status = 'processed' WHERE id = $1";

    enum Outcome { DELIVERED, FAILED, SKIPPED }

    /** Carries a handler failure out of a claim transaction so that it rolls back. */
    private static final class HandlerFailure extends RuntimeException {
        HandlerFailure(Throwable cause) {
            super(cause.getMessage(), cause, false, false);
        }
    }

    private final String topic;
    private final MessageHandler handler;
    private final VertxPoolAdapter poolAdapter;
    private final ShutdownSignal shutdownSignal;
    private final ClaimMode claimMode;
    private final PubSubMetrics metrics;
    private final Context context;
    private final Promise<Void> completion = Promise.promise();

    private final Deque<String> pendingNotifications = new ArrayDeque<>();
    private PgConnection listener;
    private Runnable unregisterShutdown;
    private int topicId;
    private boolean draining = true;
    private boolean claimInFlight = false;
    private boolean finished = false;

    SubscriptionSession(String topic,
                        MessageHandler handler,
                        VertxPoolAdapter poolAdapter,
                        ShutdownSignal shutdownSignal,
                        ClaimMode claimMode,
                        PubSubMetrics metrics) {
        this.topic = topic;
        this.handler = handler;
        this.poolAdapter = poolAdapter;
        this.shutdownSignal = shutdownSignal;
        this.claimMode = claimMode;
        this.metrics = metrics;
        this.context = poolAdapter.getVertx().getOrCreateContext();
    }

    /**
     * @return a future completing when the session ends
     */
    Future<Void> start() {
        context.runOnContext(v -> begin());
        return completion.future();
    }

    private void begin() {
        if (shutdownSignal.isTriggered()) {
            logger.info("Shutdown already requested, not subscribing to topic '{}'", topic);
            finished = true;
            completion.complete();
            return;
        }
        metrics.subscriptionStarted();
        unregisterShutdown = shutdownSignal.onShutdown(() -> context.runOnContext(v -> onShutdown()));

        poolAdapter.connectDedicated()
            .compose(this::listen)
            .compose(v -> resolveTopicId())
            .compose(id -> {
                topicId = id;
                logger.info("Subscribed to topic '{}' (id {}, claim mode {})", topic, id, claimMode);
                return drainBacklog();
            })
            .onSuccess(v -> {
                draining = false;
                logger.debug("Backlog drained for topic '{}', {} notification(s) queued", topic, pendingNotifications.size());
                pump();
            })
            .onFailure(this::fail);
    }

    private Future<Void> listen(PgConnection conn) {
        listener = conn;
        conn.notificationHandler(notification -> {
            if (finished || !PubSubDefaults.NOTIFY_CHANNEL.equals(notification.getChannel())) {
                return;
            }
            logger.debug("Notification on '{}' for topic '{}': {}", notification.getChannel(), topic, notification.getPayload());
            pendingNotifications.add(notification.getPayload());
            pump();
        });
        conn.closeHandler(v -> {
            if (!finished) {
                listener = null;
                fail(new PubSubStoreException(PubSubErrorCodes.LISTENER_CONNECTION_LOST,
                    "Listener connection closed while subscribed to topic '" + topic + "'", null, null));
            }
        });
        conn.exceptionHandler(err -> {
            if (!finished) {
                fail(new PubSubStoreException(PubSubErrorCodes.LISTENER_CONNECTION_LOST,
                    "Listener connection failed while subscribed to topic '" + topic + "': " + err.getMessage(), null, err));
            }
        });
        return conn.query("LISTEN " + PubSubDefaults.NOTIFY_CHANNEL).execute().mapEmpty();
    }

    private Future<Integer> resolveTopicId() {
        return pool().preparedQuery(SELECT_TOPIC_ID)
            .execute(Tuple.of(topic))
            .compose(rows -> {
                if (rows.size() == 0) {
                    return Future.failedFuture(new UnknownTopicException(topic));
                }
                return Future.succeededFuture(rows.iterator().next().getInteger("id"));
            });
    }

    private Future<Void> drainBacklog() {
        return pool().preparedQuery(SELECT_BACKLOG)
            .execute(Tuple.of(topicId))
            .compose(rows -> {
                List<Integer> ids = new ArrayList<>(rows.size());
                for (Row row : rows) {
                    ids.add(row.getInteger("id"));
                }
                logger.debug("Backlog for topic '{}': {} message(s)", topic, ids.size());
                return drainNext(ids.iterator());
            });
    }

    private Future<Void> drainNext(Iterator<Integer> ids) {
        if (finished || shutdownSignal.isTriggered() || !ids.hasNext()) {
            return Future.succeededFuture();
        }
        int id = ids.next();
        claimInFlight = true;
        return claimDeferred(id)
            .onComplete(ar -> claimInFlight = false)
            .compose(outcome -> drainNext(ids));
    }

    /**
     * Takes the next queued notification, if idle. Also the point where shutdown is observed
     * once the backlog has been drained.
     */
    private void pump() {
        if (finished || draining || claimInFlight) {
            return;
        }
        if (shutdownSignal.isTriggered()) {
            stop();
            return;
        }
        String payload = pendingNotifications.poll();
        if (payload == null) {
            return;
        }
        int id;
        try {
            id = NotificationPayload.parseMessageId(payload);
        } catch (RuntimeException e) {
            fail(e);
            return;
        }
        claimInFlight = true;
        Future<Outcome> claim = claimMode == ClaimMode.EAGER ? claimEager(id) : claimDeferred(id);
        claim.onComplete(ar -> {
            claimInFlight = false;
            if (ar.failed()) {
                fail(ar.cause());
            } else {
                pump();
            }
        });
    }

    private void onShutdown() {
        logger.debug("Shutdown observed by subscription to topic '{}'", topic);
        // Otherwise the drain loop or the pending claim calls pump() when it completes.
        if (!draining && !claimInFlight) {
            stop();
        }
    }

    /**
     * Claim, handler and status update in one transaction. The row stays {@code new} if the
     * handler fails.
     */
    Future<Outcome> claimDeferred(int id) {
        long started = System.nanoTime();
        return pool().withTransaction(conn -> conn.preparedQuery(CLAIM_MESSAGE)
                .execute(Tuple.of(id, topicId))
                .compose(rows -> {
                    byte[] content = contentOf(rows);
                    if (content == null) {
                        return Future.succeededFuture(Outcome.SKIPPED);
                    }
                    logger.debug("Claimed message {} on topic '{}'", id, topic);
                    return invokeHandler(id, content)
                        .compose(v -> conn.preparedQuery(MARK_PROCESSED).execute(Tuple.of(id)))
                        .map(rs -> Outcome.DELIVERED);
                }))
            .recover(err -> err instanceof HandlerFailure
                ? Future.succeededFuture(Outcome.FAILED)
                : Future.failedFuture(PgErrors.toStoreException("claim message " + id + " on topic '" + topic + "'", err)))
            .onSuccess(outcome -> record(id, outcome, started));
    }

    /**
     * Commits {@code processing} before the handler runs. A failed handler leaves the row at
     * {@code processing}; no later claim picks it up.
     */
    Future<Outcome> claimEager(int id) {
        long started = System.nanoTime();
        return pool().withTransaction(conn -> conn.preparedQuery(MARK_PROCESSING).execute(Tuple.of(id, topicId)))
            .compose(rows -> {
                byte[] content = contentOf(rows);
                if (content == null) {
                    return Future.succeededFuture(Outcome.SKIPPED);
                }
                logger.debug("Marked message {} on topic '{}' as processing", id, topic);
                return invokeHandler(id, content)
                    .compose(v -> pool().preparedQuery(MARK_PROCESSED).execute(Tuple.of(id)))
                    .map(rs -> Outcome.DELIVERED);
            })
            .recover(err -> err instanceof HandlerFailure
                ? Future.succeededFuture(Outcome.FAILED)
                : Future.failedFuture(PgErrors.toStoreException("claim message " + id + " on topic '" + topic + "'", err)))
            .onSuccess(outcome -> record(id, outcome, started));
    }

    private Future<Void> invokeHandler(int id, byte[] content) {
        CompletableFuture<Void> result;
        try {
            result = handler.handle(content);
            if (result == null) {
                result = CompletableFuture.failedFuture(new IllegalStateException("Handler returned null"));
            }
        } catch (Exception e) {
            result = CompletableFuture.failedFuture(e);
        }
        return Future.fromCompletionStage(result, context)
            .recover(err -> {
                logger.warn("Handler failed for message {} on topic '{}': {}", id, topic, err.toString());
                return Future.failedFuture(new HandlerFailure(err));
            });
    }

    private void record(int id, Outcome outcome, long startedNanos) {
        switch (outcome) {
            case DELIVERED:
                metrics.recordDelivered(topic, Duration.ofNanos(System.nanoTime() - startedNanos));
                logger.debug("Processed message {} on topic '{}'", id, topic);
                break;
            case FAILED:
                metrics.recordFailed(topic);
                break;
            case SKIPPED:
                metrics.recordSkipped(topic);
                logger.debug("Skipped message {}: claimed elsewhere, already processed or on another topic", id);
                break;
            default:
                break;
        }
    }

    private static byte[] contentOf(RowSet<Row> rows) {
        if (rows.size() == 0) {
            return null;
        }
        return rows.iterator().next().getBuffer("content").getBytes();
    }

    private void stop() {
        if (finished) {
            return;
        }
        finished = true;
        logger.info("Subscription to topic '{}' stopped", topic);
        release().onComplete(ar -> completion.tryComplete());
    }

    private void fail(Throwable error) {
        if (finished) {
            return;
        }
        finished = true;
        RuntimeException cause = PgErrors.toStoreException("subscribe to topic '" + topic + "'", error);
        logger.error("Subscription to topic '{}' failed: {}", topic, cause.getMessage());
        release().onComplete(ar -> completion.tryFail(cause));
    }

    private Future<Void> release() {
        metrics.subscriptionEnded();
        if (unregisterShutdown != null) {
            unregisterShutdown.run();
        }
        PgConnection conn = listener;
        listener = null;
        pendingNotifications.clear();
        if (conn == null) {
            return Future.succeededFuture();
        }
        return conn.query("UNLISTEN " + PubSubDefaults.NOTIFY_CHANNEL)
            .execute()
            .<Void>mapEmpty()
            .recover(err -> {
                logger.debug("UNLISTEN failed for topic '{}': {}", topic, err.getMessage());
                return Future.succeededFuture();
            })
            .compose(v -> conn.close())
            .recover(err -> {
                logger.debug("Closing listener connection failed for topic '{}': {}", topic, err.getMessage());
                return Future.succeededFuture();
            });
    }

    private Pool pool() {
        return poolAdapter.getPoolOrThrow();
    }
}
