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


package org.fireflyframework.eventbridge.core.dlq;

import org.fireflyframework.eventbridge.routing.RoutedEvent;

import java.time.Instant;
import java.util.UUID;

/**
 * A routed event that could not be delivered to a subject channel.
 *
 * @param pattern    the registered pattern whose channel rejected the event
 * @param retryCount redelivery attempts made so far
 */
public record DeadLetterEntry(
        String id,
        String pattern,
        String subject,
        RoutedEvent routedEvent,
        String errorMessage,
        int retryCount,
        Instant createdAt,
        Instant lastRetriedAt
) {
    public static DeadLetterEntry create(String pattern, RoutedEvent routedEvent, String errorMessage) {
        return new DeadLetterEntry(UUID.randomUUID().toString(), pattern, routedEvent.subject(), routedEvent,
                errorMessage, 0, Instant.now(), null);
    }

    public DeadLetterEntry withRetry() {
        return new DeadLetterEntry(id, pattern, subject, routedEvent, errorMessage, retryCount + 1,
                createdAt, Instant.now());
    }
}
