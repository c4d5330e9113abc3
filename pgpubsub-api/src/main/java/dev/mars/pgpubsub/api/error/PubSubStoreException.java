package dev.mars.pgpubsub.api.error;

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
 * A query, transaction or connection failure reported by the store. Never retried internally.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class PubSubStoreException extends PubSubException {

    private final String sqlState;

    public PubSubStoreException(String code, String message, String sqlState, Throwable cause) {
        super(code, message, cause);
        this.sqlState = sqlState;
    }

    public PubSubStoreException(String message, Throwable cause) {
        this(PubSubErrorCodes.DATABASE_QUERY_FAILED, message, null, cause);
    }

    /**
     * @return the SQLSTATE reported by PostgreSQL, or null for connection-level failures
     */
    public String getSqlState() {
        return sqlState;
    }
}
