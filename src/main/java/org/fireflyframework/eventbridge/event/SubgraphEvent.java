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

/**
 * Facts about subgraphs nested in a graph. Subgraph events belong to the owning graph's event stream.
 */
public sealed interface SubgraphEvent extends DomainEvent {

    AggregateId graphId();

    String subgraphId();

    @Override
    default AggregateId aggregateId() {
        return graphId();
    }

    record SubgraphCreated(AggregateId graphId, String subgraphId, String name) implements SubgraphEvent {
        @Override
        public <R> R accept(DomainEventVisitor<R> visitor) { return visitor.visit(this); }
    }

    record SubgraphRemoved(AggregateId graphId, String subgraphId) implements SubgraphEvent {
        @Override
        public <R> R accept(DomainEventVisitor<R> visitor) { return visitor.visit(this); }
    }

    record SubgraphMoved(AggregateId graphId, String subgraphId, Position offset) implements SubgraphEvent {
        @Override
        public <R> R accept(DomainEventVisitor<R> visitor) { return visitor.visit(this); }
    }

    record NodeAddedToSubgraph(AggregateId graphId, String subgraphId, String nodeId) implements SubgraphEvent {
        @Override
        public <R> R accept(DomainEventVisitor<R> visitor) { return visitor.visit(this); }
    }

    record NodeRemovedFromSubgraph(AggregateId graphId, String subgraphId, String nodeId) implements SubgraphEvent {
        @Override
        public <R> R accept(DomainEventVisitor<R> visitor) { return visitor.visit(this); }
    }
}
