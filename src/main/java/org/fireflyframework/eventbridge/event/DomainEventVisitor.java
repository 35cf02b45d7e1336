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

/**
 * Exhaustive dispatch over every {@link DomainEvent} variant.
 *
 * @param <R> result type of the visit
 */
public interface DomainEventVisitor<R> extends WorkflowEventVisitor<R> {

    // Graph
    R visit(GraphEvent.GraphCreated event);
    R visit(GraphEvent.GraphDeleted event);
    R visit(GraphEvent.GraphRenamed event);
    R visit(GraphEvent.GraphTagged event);
    R visit(GraphEvent.GraphUntagged event);
    R visit(GraphEvent.GraphUpdated event);
    R visit(GraphEvent.GraphImportRequested event);
    R visit(GraphEvent.GraphImportCompleted event);
    R visit(GraphEvent.GraphImportFailed event);

    // Node
    R visit(NodeEvent.NodeAdded event);
    R visit(NodeEvent.NodeRemoved event);
    R visit(NodeEvent.NodeUpdated event);
    R visit(NodeEvent.NodeMoved event);
    R visit(NodeEvent.NodeContentChanged event);

    // Edge
    R visit(EdgeEvent.EdgeConnected event);
    R visit(EdgeEvent.EdgeRemoved event);
    R visit(EdgeEvent.EdgeUpdated event);
    R visit(EdgeEvent.EdgeReversed event);

    // Subgraph
    R visit(SubgraphEvent.SubgraphCreated event);
    R visit(SubgraphEvent.SubgraphRemoved event);
    R visit(SubgraphEvent.SubgraphMoved event);
    R visit(SubgraphEvent.NodeAddedToSubgraph event);
    R visit(SubgraphEvent.NodeRemovedFromSubgraph event);
}
