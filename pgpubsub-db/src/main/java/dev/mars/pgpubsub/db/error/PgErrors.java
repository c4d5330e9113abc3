package dev.mars.pgpubsub.db.error;

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

import dev.mars.pgpubsub.api.error.PubSubErrorCodes;
import dev.mars.pgpubsub.api.error.PubSubException;
import dev.mars.pgpubsub.api.error.PubSubStoreException;
import io.vertx.pgclient.PgException;

/**
 * SQLSTATE inspection and translation of driver failures into {@link PubSubStoreException}.
 */
public final class PgErrors {

    public static final String UNIQUE_VIOLATION = "23505";
    public static final String FOREIGN_KEY_VIOLATION = "23503";

    private PgErrors() {
    }

    /**
     * @return the SQLSTATE of the first {@link PgException} in the cause chain, or null
     */
    public static String sqlState(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof PgException) {
                return ((PgException) current).getSqlState();
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }

    public static boolean isUniqueViolation(Throwable error) {
        return UNIQUE_VIOLATION.equals(sqlState(error));
    }

    public static boolean isForeignKeyViolation(Throwable error) {
        return FOREIGN_KEY_VIOLATION.equals(sqlState(error));
    }

    /**
     * Maps a failure into the store error surfaced to callers. Errors that are already
     * {@link PubSubException}s pass through unchanged.
     *
     * @param operation short description used as message prefix, e.g. "push to topic 'orders'"
     */
    public static PubSubException toStoreException(String operation, Throwable error) {
        Throwable cause = PubSubException.unwrap(error);
        if (cause instanceof PubSubException) {
            return (PubSubException) cause;
        }
        String state = sqlState(cause);
        if (state == null) {
            return new PubSubStoreException(PubSubErrorCodes.DATABASE_CONNECTION_FAILED,
                "Failed to " + operation + ": " + cause.getMessage(), null, cause);
        }
        String code = state.startsWith("23")
            ? PubSubErrorCodes.DATABASE_CONSTRAINT_VIOLATION
            : PubSubErrorCodes.DATABASE_QUERY_FAILED;
        return new PubSubStoreException(code,
            "Failed to " + operation + " (SQLSTATE " + state + "): " + cause.getMessage(), state, cause);
    }
}
