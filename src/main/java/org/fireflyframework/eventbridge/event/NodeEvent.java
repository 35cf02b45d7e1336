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


package org.fireflyframework.eventbridge.event;

import org.fireflyframework.eventbridge.core.model.AggregateId;

import java.util.Map;

/**
 * Facts about nodes of a graph. Node events belong to the owning graph's event stream.
 */
public sealed interface NodeEvent extends DomainEvent {

    AggregateId graphId();

    String nodeId();

    @Override
    default AggregateId aggregateId() {
        return graphId();
    }

    record NodeAdded(AggregateId graphId, String nodeId, String label, Position position) implements NodeEvent {
        @Override
        public <R> R accept(DomainEventVisitor<R> visitor) { return visitor.visit(this); }
    }

    record NodeRemoved(AggregateId graphId, String nodeId) implements NodeEvent {
        @Override
        public <R> R accept(DomainEventVisitor<R> visitor) { return visitor.visit(this); }
    }

    record NodeUpdated(AggregateId graphId, String nodeId, Map<String, String> properties) implements NodeEvent {
        public NodeUpdated {
            properties = properties != null ? Map.copyOf(properties) : Map.of();
        }

        @Override
        public <R> R accept(DomainEventVisitor<R> visitor) { return visitor.visit(this); }
    }

    record NodeMoved(AggregateId graphId, String nodeId, Position from, Position to) implements NodeEvent {
        @Override
        public <R> R accept(DomainEventVisitor<R> visitor) { return visitor.visit(this); }
    }

    record NodeContentChanged(AggregateId graphId, String nodeId, String content) implements NodeEvent {
        @Override
        public <R> R accept(DomainEventVisitor<R> visitor) { return visitor.visit(this); }
    }
}
