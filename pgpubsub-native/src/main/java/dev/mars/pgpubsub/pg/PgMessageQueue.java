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

import dev.mars.pgpubsub.api.MessagePublisher;
import dev.mars.pgpubsub.api.TopicStats;
import dev.mars.pgpubsub.api.error.PubSubErrorCodes;
import dev.mars.pgpubsub.api.error.PubSubException;
import dev.mars.pgpubsub.api.error.UnknownTopicException;
import dev.mars.pgpubsub.db.error.PgErrors;
import dev.mars.pgpubsub.db.metrics.PubSubMetrics;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Publish path. The insert resolves the topic by name in the same statement; the schema trigger
 * emits the {@code new_message} notification when it commits.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class PgMessageQueue implements MessagePublisher {
    private static final Logger logger = LoggerFactory.getLogger(PgMessageQueue.class);

    private static final String INSERT_MESSAGE = """
        INSERT INTO messages (topic_id, content)
        SELECT id, $2 FROM topics WHERE name = $1
        RETURNING id
        """;

    private static final String TOPIC_STATS = """
        SELECT t.id,
               count(m.id) FILTER (WHERE m.status = 'new')        AS new_count,
               count(m.id) FILTER (WHERE m.status = 'processing') AS processing_count,
               count(m.id) FILTER (WHERE m.status = 'processed')  AS processed_count
        FROM topics t
        LEFT JOIN messages m ON m.topic_id = t.id
        WHERE t.name = $1
        GROUP BY t.id
        """;

    private final VertxPoolAdapter poolAdapter;
    private final PubSubMetrics metrics;

    public PgMessageQueue(VertxPoolAdapter poolAdapter, PubSubMetrics metrics) {
        this.poolAdapter = poolAdapter;
        this.metrics = metrics;
    }

    @Override
    public CompletableFuture<Long> push(String topic, byte[] content) {
        return pushReactive(topic, content).toCompletionStage().toCompletableFuture();
    }

    public Future<Long> pushReactive(String topic, byte[] content) {
        if (topic == null || content == null) {
            return Future.failedFuture(new PubSubException(PubSubErrorCodes.INVALID_ARGUMENT,
                "Topic and content must not be null"));
        }
        return poolAdapter.getPoolOrThrow()
            .preparedQuery(INSERT_MESSAGE)
            .execute(Tuple.of(topic, Buffer.buffer(content)))
            .recover(err -> Future.failedFuture(PgErrors.toStoreException("push to topic '" + topic + "'", err)))
            .compose(rows -> {
                if (rows.rowCount() == 0) {
                    return Future.failedFuture(new UnknownTopicException(topic));
                }
                long id = rows.iterator().next().getLong("id");
                metrics.recordPublished(topic);
                logger.debug("Pushed message {} ({} bytes) to topic '{}'", id, content.length, topic);
                return Future.succeededFuture(id);
            });
    }

    @Override
    public CompletableFuture<TopicStats> stats(String topic) {
        return poolAdapter.getPoolOrThrow()
            .preparedQuery(TOPIC_STATS)
            .execute(Tuple.of(topic))
            .recover(err -> Future.failedFuture(PgErrors.toStoreException("read stats of topic '" + topic + "'", err)))
            .compose(rows -> {
                if (rows.size() == 0) {
                    return Future.<TopicStats>failedFuture(new UnknownTopicException(topic));
                }
                Row row = rows.iterator().next();
                return Future.succeededFuture(new TopicStats(topic,
                    row.getLong("new_count"),
                    row.getLong("processing_count"),
                    row.getLong("processed_count")));
            })
            .toCompletionStage()
            .toCompletableFuture();
    }
}
