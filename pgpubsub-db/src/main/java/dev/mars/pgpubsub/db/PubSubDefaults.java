package dev.mars.pgpubsub.db;

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
 * Shared constants for the store adapter.
 */
public final class PubSubDefaults {

    private PubSubDefaults() {
    }

    /**
     * Identifier of the pool used when no service id is given.
     */
    public static final String DEFAULT_POOL_ID = "pgpubsub-default";

    /**
     * Channel the {@code notify_new_message} trigger publishes message ids on.
     */
    public static final String NOTIFY_CHANNEL = "new_message";

    public static final String DEFAULT_PROFILE = "default";
}
