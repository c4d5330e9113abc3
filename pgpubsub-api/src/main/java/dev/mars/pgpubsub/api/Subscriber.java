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
 * Delivers the messages of a topic to a handler.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public interface Subscriber {

    /**
     * Starts a subscription session for the topic. The session first drains the backlog of
     * {@code new} messages in publish order, then delivers live notifications in arrival order,
     * claiming every message in its own transaction.
     *
     * <p>The returned future completes normally once shutdown has been requested and any
     * in-flight claim has finished. It completes exceptionally when the topic does not exist,
     * on any store or connection failure, or when a notification payload cannot be parsed.
     * Handler failures do not end the session.</p>
     *
     * @param topic the topic name
     * @param handler the callback for message content
     * @return a future tracking the lifetime of the session
     */
    CompletableFuture<Void> subscribe(String topic, MessageHandler handler);
}
