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

import dev.mars.pgpubsub.api.Topic;
import dev.mars.pgpubsub.api.TopicRegistry;
import dev.mars.pgpubsub.api.error.DuplicateTopicException;
import dev.mars.pgpubsub.api.error.PubSubErrorCodes;
import dev.mars.pgpubsub.api.error.PubSubException;
import dev.mars.pgpubsub.db.error.PgErrors;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Topic create, remove and list, each a single statement on the shared pool.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class PgTopicRegistry implements TopicRegistry {
    private static final Logger logger = LoggerFactory.getLogger(PgTopicRegistry.class);

    private static final String INSERT_TOPIC = "INSERT INTO topics (name) VALUES ($1)";
    private static final String DELETE_TOPIC = "DELETE FROM topics WHERE name = $1";
    private static final String SELECT_TOPICS = "SELECT id, name FROM topics ORDER BY id";

    private final VertxPoolAdapter poolAdapter;

    public PgTopicRegistry(VertxPoolAdapter poolAdapter) {
        this.poolAdapter = poolAdapter;
    }

    @Override
    public CompletableFuture<Void> createTopic(String name) {
        return createTopicReactive(name).toCompletionStage().toCompletableFuture();
    }

    public Future<Void> createTopicReactive(String name) {
        if (name == null || name.isBlank()) {
            return Future.failedFuture(new PubSubException(PubSubErrorCodes.INVALID_ARGUMENT, "Topic name must not be blank"));
        }
        return poolAdapter.getPoolOrThrow()
            .preparedQuery(INSERT_TOPIC)
            .execute(Tuple.of(name))
            .<Void>mapEmpty()
            .onSuccess(v -> logger.info("Created topic '{}'", name))
            .recover(err -> {
                if (PgErrors.isUniqueViolation(err)) {
                    logger.debug("Topic '{}' already exists", name);
                    return Future.failedFuture(new DuplicateTopicException(name, err));
                }
                logger.error("Failed to create topic '{}': {}", name, err.getMessage());
                return Future.failedFuture(PgErrors.toStoreException("create topic '" + name + "'", err));
            });
    }

    @Override
    public CompletableFuture<Void> removeTopic(String name) {
        return removeTopicReactive(name).toCompletionStage().toCompletableFuture();
    }

    /**
     * Deletes the topic row. Zero affected rows is not an error. A topic that still has messages
     * cannot be removed: the foreign key rejects the delete.
     */
    public Future<Void> removeTopicReactive(String name) {
        if (name == null) {
            return Future.failedFuture(new PubSubException(PubSubErrorCodes.INVALID_ARGUMENT, "Topic name must not be null"));
        }
        return poolAdapter.getPoolOrThrow()
            .preparedQuery(DELETE_TOPIC)
            .execute(Tuple.of(name))
            .map(rows -> {
                if (rows.rowCount() == 0) {
                    logger.debug("Topic '{}' not found, nothing removed", name);
                } else {
                    logger.info("Removed topic '{}'", name);
                }
                return (Void) null;
            })
            .recover(err -> {
                logger.error("Failed to remove topic '{}': {}", name, err.getMessage());
                return Future.failedFuture(PgErrors.toStoreException("remove topic '" + name + "'", err));
            });
    }

    @Override
    public CompletableFuture<List<Topic>> listTopics() {
        return poolAdapter.getPoolOrThrow()
            .query(SELECT_TOPICS)
            .execute()
            .map(rows -> {
                List<Topic> topics = new ArrayList<>(rows.size());
                for (Row row : rows) {
                    topics.add(new Topic(row.getInteger("id"), row.getString("name")));
                }
                return topics;
            })
            .recover(err -> Future.failedFuture(PgErrors.toStoreException("list topics", err)))
            .toCompletionStage()
            .toCompletableFuture();
    }
}
