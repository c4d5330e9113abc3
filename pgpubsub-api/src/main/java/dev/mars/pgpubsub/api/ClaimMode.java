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
 * How a subscription advances message status around the handler call.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public enum ClaimMode {

    /**
     * The status is written only after the handler succeeds, for backlog and live messages
     * alike. A failed message stays {@code new} and is retried by a later subscription.
     */
    DEFERRED,

    /**
     * Live notifications mark the message {@code processing} in a committed transaction before
     * the handler runs. A failed live message stays at {@code processing} and needs manual
     * intervention. Backlog messages behave as in {@link #DEFERRED}.
     */
    EAGER;

    public static ClaimMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return DEFERRED;
        }
        return ClaimMode.valueOf(value.trim().toUpperCase(java.util.Locale.ROOT));
    }
}
