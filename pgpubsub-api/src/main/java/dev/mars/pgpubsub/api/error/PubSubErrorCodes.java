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
 * Standard error codes for pgpubsub.
 *
 * Error code ranges:
 * - PGPSERR0001-0049: General errors
 * - PGPSERR0100-0149: Topic errors
 * - PGPSERR0150-0199: Message errors
 * - PGPSERR0200-0249: Subscription errors
 * - PGPSERR0500-0549: Database/Connection errors
 * - PGPSERR0600-0649: Configuration errors
 */
public final class PubSubErrorCodes {

    private PubSubErrorCodes() {
    }

    // ========================================================================
    // General Errors (0001-0049)
    // ========================================================================
    public static final String INTERNAL_ERROR = "PGPSERR0001";
    public static final String INVALID_ARGUMENT = "PGPSERR0002";

    // ========================================================================
    // Topic Errors (0100-0149)
    // ========================================================================
    public static final String TOPIC_ALREADY_EXISTS = "PGPSERR0100";
    public static final String TOPIC_NOT_FOUND = "PGPSERR0101";

    // ========================================================================
    // Message Errors (0150-0199)
    // ========================================================================
    public static final String MESSAGE_PUBLISH_FAILED = "PGPSERR0150";

    // ========================================================================
    // Subscription Errors (0200-0249)
    // ========================================================================
    public static final String MALFORMED_NOTIFICATION = "PGPSERR0200";
    public static final String LISTENER_CONNECTION_LOST = "PGPSERR0201";

    // ========================================================================
    // Database/Connection Errors (0500-0549)
    // ========================================================================
    public static final String DATABASE_CONNECTION_FAILED = "PGPSERR0500";
    public static final String DATABASE_QUERY_FAILED = "PGPSERR0501";
    public static final String DATABASE_CONSTRAINT_VIOLATION = "PGPSERR0502";

    // ========================================================================
    // Configuration Errors (0600-0649)
    // ========================================================================
    public static final String CONFIGURATION_INVALID = "PGPSERR0600";
    public static final String CONFIGURATION_MISSING = "PGPSERR0601";
}
