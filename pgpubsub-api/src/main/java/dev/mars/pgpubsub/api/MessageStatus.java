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
 * Lifecycle of a stored message. Status only moves forward.
 */
public enum MessageStatus {
    NEW("new"),
    PROCESSING("processing"),
    PROCESSED("processed");

    private final String dbValue;

    MessageStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    /**
     * @return the label used by the {@code message_status} database enum
     */
    public String dbValue() {
        return dbValue;
    }

    public static MessageStatus fromDbValue(String value) {
        for (MessageStatus status : values()) {
            if (status.dbValue.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown message status: " + value);
    }
}
