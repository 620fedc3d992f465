package me.golemcore.loom.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.loom.domain.exception.ValidationException;
import me.golemcore.loom.domain.model.ModelParameters;
import me.golemcore.loom.domain.model.NodeMessage;
import me.golemcore.loom.domain.model.NodeMetadata;
import me.golemcore.loom.domain.model.RootConfig;

import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Validation helpers for records entering the store.
 *
 * <p>
 * Generated identifiers match {@code ^[a-z0-9]{12}$}.
 */
public final class NodeRecordValidator {

    private static final Pattern ID_PATTERN = Pattern.compile("^[a-z0-9]{12}$");
    private static final int ID_LENGTH = 12;
    private static final int MAX_EXTRA_KEY_LENGTH = 64;
    private static final int MAX_TAG_LENGTH = 64;

    private NodeRecordValidator() {
    }

    public static String newId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, ID_LENGTH);
    }

    public static boolean isValidId(String value) {
        return value != null && ID_PATTERN.matcher(value).matches();
    }

    public static void validateMessage(NodeMessage message) {
        if (message == null) {
            throw new ValidationException("message must not be null");
        }
        if (message.getRole() == null) {
            throw new ValidationException("message role must be user or assistant");
        }
        if (message.getContent() == null) {
            throw new ValidationException("message content must not be null");
        }
    }

    public static void validateMetadata(NodeMetadata metadata) {
        if (metadata == null) {
            throw new ValidationException("metadata must not be null");
        }
        if (metadata.getTags() == null) {
            throw new ValidationException("metadata tags must not be null");
        }
        for (String tag : metadata.getTags()) {
            if (tag == null || tag.isBlank()) {
                throw new ValidationException("metadata tags must not be blank");
            }
            if (tag.length() > MAX_TAG_LENGTH) {
                throw new ValidationException("metadata tag exceeds " + MAX_TAG_LENGTH + " characters: " + tag);
            }
        }
    }

    public static void validateRootConfig(RootConfig config, int maxExtraParameters) {
        if (config == null) {
            throw new ValidationException("root config must not be null");
        }
        if (config.getModel() == null || config.getModel().isBlank()) {
            throw new ValidationException("root config model must not be blank");
        }
        ModelParameters parameters = config.getParameters();
        if (parameters == null) {
            return;
        }
        if (parameters.getMaxTokens() != null && parameters.getMaxTokens() <= 0) {
            throw new ValidationException("maxTokens must be positive");
        }
        if (parameters.getTemperature() != null
                && (parameters.getTemperature().isNaN() || parameters.getTemperature() < 0)) {
            throw new ValidationException("temperature must be a non-negative number");
        }
        Map<String, String> extra = parameters.getExtra();
        if (extra == null) {
            return;
        }
        if (extra.size() > maxExtraParameters) {
            throw new ValidationException("at most " + maxExtraParameters + " extra parameters are allowed");
        }
        for (String key : extra.keySet()) {
            if (key == null || key.isBlank() || key.length() > MAX_EXTRA_KEY_LENGTH) {
                throw new ValidationException("extra parameter keys must be 1-" + MAX_EXTRA_KEY_LENGTH
                        + " characters");
            }
        }
    }
}
