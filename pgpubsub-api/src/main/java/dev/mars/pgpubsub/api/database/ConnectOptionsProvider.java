package dev.mars.pgpubsub.api.database;

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

import io.vertx.pgclient.PgConnectOptions;

/**
 * Supplies connection options for dedicated, non-pooled connections.
 *
 * <p>A subscription holds its own connection for LISTEN: notifications are delivered only to the
 * connection that issued LISTEN, and a pooled connection could be handed to someone else.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-18
 * @version 1.0
 */
@FunctionalInterface
public interface ConnectOptionsProvider {

    PgConnectOptions getConnectOptions();
}
