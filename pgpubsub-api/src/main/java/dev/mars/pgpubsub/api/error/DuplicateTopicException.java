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
 * A topic with the requested name already exists.
 */
public class DuplicateTopicException extends PubSubException {

    private final String topic;

    public DuplicateTopicException(String topic, Throwable cause) {
        super(PubSubErrorCodes.TOPIC_ALREADY_EXISTS, "Topic already exists: " + topic, cause);
        this.topic = topic;
    }

    public String getTopic() {
        return topic;
    }
}
