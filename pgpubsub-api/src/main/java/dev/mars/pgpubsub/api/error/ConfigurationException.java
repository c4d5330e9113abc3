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

import java.util.List;

/**
 * Missing or invalid configuration. Lists every validation error found, not just the first.
 */
public class ConfigurationException extends PubSubException {

    private final List<String> errors;

    public ConfigurationException(List<String> errors) {
        super(PubSubErrorCodes.CONFIGURATION_INVALID,
              "Configuration validation failed: " + String.join(", ", errors));
        this.errors = List.copyOf(errors);
    }

    public ConfigurationException(String message) {
        super(PubSubErrorCodes.CONFIGURATION_MISSING, message);
        this.errors = List.of(message);
    }

    public List<String> getErrors() {
        return errors;
    }
}
