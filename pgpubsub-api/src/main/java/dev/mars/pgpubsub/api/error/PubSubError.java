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

import java.time.Instant;

/**
 * Immutable error record suitable for reporting to a user or operator.
 *
 * @param code      The standard error code (e.g., PGPSERR0101)
 * @param message   Human-readable error message
 * @param timestamp When the error occurred
 * @param details   Optional additional details (can be null)
 */
public record PubSubError(
    String code,
    String message,
    Instant timestamp,
    String details
) {
    public static PubSubError of(String code, String message) {
        return new PubSubError(code, message, Instant.now(), null);
    }

    public static PubSubError of(String code, String message, String details) {
        return new PubSubError(code, message, Instant.now(), details);
    }

    /**
     * Builds an error record for any throwable, keeping the code of a {@link PubSubException}.
     */
    public static PubSubError from(Throwable error) {
        Throwable cause = PubSubException.unwrap(error);
        if (cause instanceof PubSubException pse) {
            Throwable root = pse.getCause();
            return of(pse.getCode(), pse.getMessage(), root != null ? root.getMessage() : null);
        }
        return of(PubSubErrorCodes.INTERNAL_ERROR, String.valueOf(cause.getMessage()),
                  cause.getClass().getName());
    }

    @Override
    public String toString() {
        return details == null
            ? code + ": " + message
            : code + ": " + message + " (" + details + ")";
    }
}
