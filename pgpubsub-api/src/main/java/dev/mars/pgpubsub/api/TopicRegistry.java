package dev.mars.pgpubsub.api;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Creates and removes named topics.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public interface TopicRegistry {

    /**
     * Creates a topic with the given unique name.
     *
     * @param name the topic name
     * @return a future that fails with {@link dev.mars.pgpubsub.api.error.DuplicateTopicException}
     *         if a topic with that name already exists
     */
    CompletableFuture<Void> createTopic(String name);

    /**
     * Deletes the topic with the given name. Removing an absent topic completes normally.
     *
     * @param name the topic name
     * @return a future that completes when the delete has been executed
     */
    CompletableFuture<Void> removeTopic(String name);

    /**
     * Lists all topics ordered by id.
     */
    CompletableFuture<List<Topic>> listTopics();
}
