package dev.mars.pgpubsub.pg;

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

import dev.mars.pgpubsub.api.error.MalformedNotificationException;

import java.util.regex.Pattern;

/**
 * Format of {@code new_message} notification payloads: the new message id in decimal, exactly
 * as written by the {@code notify_new_message()} trigger.
 */
public final class NotificationPayload {

    private static final Pattern MESSAGE_ID = Pattern.compile("[0-9]{1,10}");

    private NotificationPayload() {
    }

    /**
     * @throws MalformedNotificationException unless the payload is 1 to 10 ASCII digits within int range
     */
    public static int parseMessageId(String payload) {
        if (payload == null || !MESSAGE_ID.matcher(payload).matches()) {
            throw new MalformedNotificationException(payload, null);
        }
        try {
            return Integer.parseInt(payload);
        } catch (NumberFormatException e) {
            throw new MalformedNotificationException(payload, e);
        }
    }
}
