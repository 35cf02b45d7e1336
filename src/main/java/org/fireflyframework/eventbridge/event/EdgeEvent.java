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
 * Facts about edges of a graph. Edge events belong to the owning graph's event stream.
 */
public sealed interface EdgeEvent extends DomainEvent {

    AggregateId graphId();

    String edgeId();

    @Override
    default AggregateId aggregateId() {
        return graphId();
    }

    record EdgeConnected(AggregateId graphId, String edgeId, String source, String target, String relationship)
            implements EdgeEvent {
        @Override
        public <R> R accept(DomainEventVisitor<R> visitor) { return visitor.visit(this); }
    }

    record EdgeRemoved(AggregateId graphId, String edgeId) implements EdgeEvent {
        @Override
        public <R> R accept(DomainEventVisitor<R> visitor) { return visitor.visit(this); }
    }

    record EdgeUpdated(AggregateId graphId, String edgeId, Map<String, String> properties) implements EdgeEvent {
        public EdgeUpdated {
            properties = properties != null ? Map.copyOf(properties) : Map.of();
        }

        @Override
        public <R> R accept(DomainEventVisitor<R> visitor) { return visitor.visit(this); }
    }

    record EdgeReversed(AggregateId graphId, String edgeId, String newSource, String newTarget) implements EdgeEvent {
        @Override
        public <R> R accept(DomainEventVisitor<R> visitor) { return visitor.visit(this); }
    }
}
