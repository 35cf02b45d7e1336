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

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Facts about a graph as a whole. The graph is the aggregate.
 */
public sealed interface GraphEvent extends DomainEvent {

    AggregateId graphId();

    @Override
    default AggregateId aggregateId() {
        return graphId();
    }

    record GraphCreated(AggregateId graphId, String name, List<String> tags, Instant createdAt) implements GraphEvent {
        public GraphCreated {
            tags = tags != null ? List.copyOf(tags) : List.of();
        }

        @Override
        public <R> R accept(DomainEventVisitor<R> visitor) { return visitor.visit(this); }
    }

    record GraphDeleted(AggregateId graphId) implements GraphEvent {
        @Override
        public <R> R accept(DomainEventVisitor<R> visitor) { return visitor.visit(this); }
    }

    record GraphRenamed(AggregateId graphId, String oldName, String newName) implements GraphEvent {
        @Override
        public <R> R accept(DomainEventVisitor<R> visitor) { return visitor.visit(this); }
    }

    record GraphTagged(AggregateId graphId, String tag) implements GraphEvent {
        @Override
        public <R> R accept(DomainEventVisitor<R> visitor) { return visitor.visit(this); }
    }

    record GraphUntagged(AggregateId graphId, String tag) implements GraphEvent {
        @Override
        public <R> R accept(DomainEventVisitor<R> visitor) { return visitor.visit(this); }
    }

    record GraphUpdated(AggregateId graphId, Map<String, String> properties) implements GraphEvent {
        public GraphUpdated {
            properties = properties != null ? Map.copyOf(properties) : Map.of();
        }

        @Override
        public <R> R accept(DomainEventVisitor<R> visitor) { return visitor.visit(this); }
    }

    record GraphImportRequested(AggregateId graphId, String source, String format) implements GraphEvent {
        @Override
        public <R> R accept(DomainEventVisitor<R> visitor) { return visitor.visit(this); }
    }

    record GraphImportCompleted(AggregateId graphId, int importedNodes, int importedEdges) implements GraphEvent {
        @Override
        public <R> R accept(DomainEventVisitor<R> visitor) { return visitor.visit(this); }
    }

    record GraphImportFailed(AggregateId graphId, String error) implements GraphEvent {
        @Override
        public <R> R accept(DomainEventVisitor<R> visitor) { return visitor.visit(this); }
    }
}
