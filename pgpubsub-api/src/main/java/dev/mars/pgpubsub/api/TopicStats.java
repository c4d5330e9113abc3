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
 * Message counts for one topic, by status.
 *
 * <p>A non-zero {@code processing} count with no live subscription points at messages whose
 * handler failed after the status was advanced eagerly; those rows are not claimed again.</p>
 */
public record TopicStats(String topic, long newCount, long processingCount, long processedCount) {

    public long total() {
        return newCount + processingCount + processedCount;
    }
}
