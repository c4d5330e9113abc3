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

import java.util.concurrent.CompletableFuture;

/**
 * Publishes opaque byte content to named topics.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public interface MessagePublisher {

    /**
     * Stores a new message for the topic with status {@link MessageStatus#NEW}.
     * The store emits a {@code new_message} notification when the insert commits.
     *
     * @param topic the topic name
     * @param content the message content
     * @return a future holding the id assigned to the message, failing with
     *         {@link dev.mars.pgpubsub.api.error.UnknownTopicException} if the topic does not exist
     */
    CompletableFuture<Long> push(String topic, byte[] content);

    /**
     * Counts the topic's messages by status.
     *
     * @param topic the topic name
     * @return the per-status counts
     */
    CompletableFuture<TopicStats> stats(String topic);
}
