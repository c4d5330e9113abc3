package dev.mars.pgpubsub.db.codec;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.pgpubsub.api.PayloadCodec;

import java.io.IOException;
import java.util.Objects;

/**
 * Jackson codec for structured message payloads stored as opaque bytes.
 *
 * @param <T> payload type
 */
public class JsonPayloadCodec<T> implements PayloadCodec<T> {

    private final ObjectMapper objectMapper;
    private final Class<T> payloadType;

    public JsonPayloadCodec(Class<T> payloadType) {
        this(createDefaultObjectMapper(), payloadType);
    }

    public JsonPayloadCodec(ObjectMapper objectMapper, Class<T> payloadType) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.payloadType = Objects.requireNonNull(payloadType, "payloadType");
    }

    @Override
    public byte[] encode(T payload) {
        try {
            return objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to encode " + payloadType.getSimpleName() + " payload", e);
        }
    }

    @Override
    public T decode(byte[] content) {
        Objects.requireNonNull(content, "content");
        try {
            return objectMapper.readValue(content, payloadType);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to decode " + payloadType.getSimpleName() + " payload", e);
        }
    }

    public Class<T> getPayloadType() {
        return payloadType;
    }

    /**
     * Mapper with JSR310 support, writing dates as ISO strings rather than epoch numbers.
     */
    public static ObjectMapper createDefaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
