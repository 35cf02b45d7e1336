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

import org.fireflyframework.eventbridge.event.DomainEvent;

import java.util.Objects;

/**
 * A domain event together with its tracing metadata.
 */
public record EventEnvelope(DomainEvent event, MessageMetadata metadata) {

    public EventEnvelope {
        Objects.requireNonNull(event, "event must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
    }

    public static EventEnvelope of(DomainEvent event) {
        return new EventEnvelope(event, MessageMetadata.root());
    }

    public static EventEnvelope causedBy(DomainEvent event, MessageMetadata cause) {
        return new EventEnvelope(event, cause.caused());
    }
}
