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


package org.fireflyframework.eventbridge.core.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.fireflyframework.eventbridge.event.DomainEvent;
import org.fireflyframework.eventbridge.routing.RoutedEvent;

import java.io.IOException;

/**
 * Serializes domain events and routed events to and from JSON for transport bindings and
 * durable event stores. Event variants are identified by a {@code type} property.
 */
public class EventSerializer {

    private final ObjectMapper mapper;

    public EventSerializer() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    public EventSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String serialize(DomainEvent event) {
        try {
            return mapper.writerFor(DomainEvent.class).writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + event.eventType(), e);
        }
    }

    public DomainEvent deserializeEvent(String json) {
        try {
            return mapper.readValue(json, DomainEvent.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to deserialize DomainEvent", e);
        }
    }

    public String serialize(RoutedEvent routed) {
        try {
            return mapper.writeValueAsString(routed);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize RoutedEvent " + routed.subject(), e);
        }
    }

    public RoutedEvent deserializeRouted(String json) {
        try {
            return mapper.readValue(json, RoutedEvent.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to deserialize RoutedEvent", e);
        }
    }

    public byte[] serializeToBytes(RoutedEvent routed) {
        try {
            return mapper.writeValueAsBytes(routed);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize RoutedEvent to bytes", e);
        }
    }

    public RoutedEvent deserializeFromBytes(byte[] data) {
        try {
            return mapper.readValue(data, RoutedEvent.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to deserialize RoutedEvent from bytes", e);
        }
    }
}
