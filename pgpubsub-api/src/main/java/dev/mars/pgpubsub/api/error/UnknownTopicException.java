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
 * A publish or subscribe referenced a topic that does not exist.
 */
public class UnknownTopicException extends PubSubException {

    private final String topic;

    public UnknownTopicException(String topic) {
        super(PubSubErrorCodes.TOPIC_NOT_FOUND, "Topic not found: " + topic);
        this.topic = topic;
    }

    public String getTopic() {
        return topic;
    }
}
