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

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Callback invoked by a subscription with the raw content of each claimed message.
 *
 * <p>A handler reports success by completing the returned future normally. An exceptionally
 * completed future, or an exception thrown from {@link #handle(byte[])}, is a callback failure:
 * the message is not marked processed and may be handed to the handler again on a later
 * subscription. Handlers must therefore be safe to invoke repeatedly for the same content.
 * A subscription never invokes its handler concurrently with itself.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 2.0
 */
@FunctionalInterface
public interface MessageHandler {

    /**
     * Handles the content of one message.
     *
     * @param content the message content exactly as published
     * @return a future that completes when the message has been handled
     */
    CompletableFuture<Void> handle(byte[] content);

    /**
     * Adapts a typed handler into a byte handler by decoding the content with the given codec.
     * A decoding failure is reported as a callback failure.
     *
     * @param codec the codec used to decode message content
     * @param handler the typed handler
     * @param <T> the payload type
     * @return a handler for raw content
     */
    static <T> MessageHandler typed(PayloadCodec<T> codec, Function<T, CompletableFuture<Void>> handler) {
        Objects.requireNonNull(codec, "codec");
        Objects.requireNonNull(handler, "handler");
        return content -> {
            T payload;
            try {
                payload = codec.decode(content);
            } catch (Exception e) {
                return CompletableFuture.failedFuture(e);
            }
            return handler.apply(payload);
        };
    }
}
