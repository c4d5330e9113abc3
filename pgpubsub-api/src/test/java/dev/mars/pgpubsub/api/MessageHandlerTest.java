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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class MessageHandlerTest {

    private static final PayloadCodec<String> UTF8 = new PayloadCodec<>() {
        @Override
        public byte[] encode(String payload) {
            return payload.getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public String decode(byte[] content) {
            if (content.length == 0) {
                throw new IllegalArgumentException("empty content");
            }
            return new String(content, StandardCharsets.UTF_8);
        }
    };

    @Test
    void testTypedHandlerDecodesContent() throws Exception {
        List<String> received = new ArrayList<>();
        MessageHandler handler = MessageHandler.typed(UTF8, payload -> {
            received.add(payload);
            return CompletableFuture.completedFuture(null);
        });

        handler.handle("hello".getBytes(StandardCharsets.UTF_8)).get();

        assertEquals(List.of("hello"), received);
    }

    @Test
    void testDecodeFailureIsReportedAsFailedFuture() {
        MessageHandler handler = MessageHandler.typed(UTF8, payload -> CompletableFuture.completedFuture(null));

        CompletableFuture<Void> result = handler.handle(new byte[0]);

        ExecutionException error = assertThrows(ExecutionException.class, result::get);
        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }

    @Test
    void testTypedRejectsNullArguments() {
        assertThrows(NullPointerException.class, () -> MessageHandler.typed(null, p -> null));
        assertThrows(NullPointerException.class, () -> MessageHandler.typed(UTF8, null));
    }
}
