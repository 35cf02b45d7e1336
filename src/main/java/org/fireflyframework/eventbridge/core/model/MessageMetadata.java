/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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


package org.fireflyframework.eventbridge.core.model;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Envelope fields that let a transport binding trace a command through to the events and
 * routed deliveries it produced.
 *
 * @param messageId     unique id of this message
 * @param correlationId id shared by every message of one conversation
 * @param causationId   id of the message that caused this one, {@code null} for a root message
 * @param timestamp     creation time
 * @param metadata      free-form string attributes
 */
public record MessageMetadata(
        String messageId,
        String correlationId,
        String causationId,
        Instant timestamp,
        Map<String, String> metadata
) {
    public MessageMetadata {
        Objects.requireNonNull(messageId, "messageId must not be null");
        Objects.requireNonNull(correlationId, "correlationId must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    /**
     * Starts a new conversation: the message is its own correlation root.
     */
    public static MessageMetadata root() {
        String id = UUID.randomUUID().toString();
        return new MessageMetadata(id, id, null, Instant.now(), Map.of());
    }

    public static MessageMetadata root(Map<String, String> metadata) {
        String id = UUID.randomUUID().toString();
        return new MessageMetadata(id, id, null, Instant.now(), metadata);
    }

    /**
     * Creates metadata for a message caused by this one, keeping the correlation id and metadata.
     */
    public MessageMetadata caused() {
        return new MessageMetadata(UUID.randomUUID().toString(), correlationId, messageId, Instant.now(), metadata);
    }

    public MessageMetadata withAttribute(String key, String value) {
        var copy = new HashMap<>(metadata);
        copy.put(key, value);
        return new MessageMetadata(messageId, correlationId, causationId, timestamp, copy);
    }
}
