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


package org.fireflyframework.eventbridge.routing;

import org.fireflyframework.eventbridge.core.model.AggregateId;
import org.fireflyframework.eventbridge.core.model.MessageMetadata;
import org.fireflyframework.eventbridge.event.DomainEvent;

import java.time.Instant;
import java.util.Objects;

/**
 * A domain event as delivered to subscribers: the event, its subject and the sequence numbers
 * stamped when it was routed.
 */
public record RoutedEvent(
        DomainEvent event,
        String subject,
        long globalSequence,
        long aggregateSequence,
        int retryCount,
        Instant routedAt,
        MessageMetadata metadata
) {
    public RoutedEvent {
        Objects.requireNonNull(event, "event must not be null");
        Objects.requireNonNull(subject, "subject must not be null");
        Objects.requireNonNull(routedAt, "routedAt must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
    }

    public AggregateId aggregateId() {
        return event.aggregateId();
    }

    /**
     * Copy for a redelivery attempt. Sequence numbers are kept.
     */
    public RoutedEvent withRetry() {
        return new RoutedEvent(event, subject, globalSequence, aggregateSequence, retryCount + 1, routedAt, metadata);
    }
}
