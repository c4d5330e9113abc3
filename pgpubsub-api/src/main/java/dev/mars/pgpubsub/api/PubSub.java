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

/**
 * Handle combining topic management, publishing and subscribing over one store.
 *
 * <p>Closing the handle requests shutdown, so every subscription started through it ends.
 * Use it in a try-with-resources block.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public interface PubSub extends TopicRegistry, MessagePublisher, Subscriber, AutoCloseable {

    /**
     * Requests shutdown of all subscriptions observing this handle's signal. Idempotent; returns
     * once the signal is set without waiting for the sessions to finish.
     */
    void shutdown();

    boolean isShutdown();

    ShutdownSignal getShutdownSignal();

    /**
     * Equivalent to {@link #shutdown()}.
     */
    @Override
    void close();
}
