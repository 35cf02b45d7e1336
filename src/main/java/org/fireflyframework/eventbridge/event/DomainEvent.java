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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.fireflyframework.eventbridge.core.model.AggregateId;

/**
 * Sealed root of every fact the event bridge can route.
 *
 * <p>Events are immutable and carry enough data to be projected and to be replayed onto their
 * aggregate. The category interfaces ({@link GraphEvent}, {@link NodeEvent}, {@link EdgeEvent},
 * {@link SubgraphEvent}, {@link WorkflowEvent}) close the hierarchy, and
 * {@link #accept(DomainEventVisitor)} gives exhaustive dispatch: a new variant does not compile
 * until every visitor handles it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = GraphEvent.GraphCreated.class, name = "GraphCreated"),
        @JsonSubTypes.Type(value = GraphEvent.GraphDeleted.class, name = "GraphDeleted"),
        @JsonSubTypes.Type(value = GraphEvent.GraphRenamed.class, name = "GraphRenamed"),
        @JsonSubTypes.Type(value = GraphEvent.GraphTagged.class, name = "GraphTagged"),
        @JsonSubTypes.Type(value = GraphEvent.GraphUntagged.class, name = "GraphUntagged"),
        @JsonSubTypes.Type(value = GraphEvent.GraphUpdated.class, name = "GraphUpdated"),
        @JsonSubTypes.Type(value = GraphEvent.GraphImportRequested.class, name = "GraphImportRequested"),
        @JsonSubTypes.Type(value = GraphEvent.GraphImportCompleted.class, name = "GraphImportCompleted"),
        @JsonSubTypes.Type(value = GraphEvent.GraphImportFailed.class, name = "GraphImportFailed"),
        @JsonSubTypes.Type(value = NodeEvent.NodeAdded.class, name = "NodeAdded"),
        @JsonSubTypes.Type(value = NodeEvent.NodeRemoved.class, name = "NodeRemoved"),
        @JsonSubTypes.Type(value = NodeEvent.NodeUpdated.class, name = "NodeUpdated"),
        @JsonSubTypes.Type(value = NodeEvent.NodeMoved.class, name = "NodeMoved"),
        @JsonSubTypes.Type(value = NodeEvent.NodeContentChanged.class, name = "NodeContentChanged"),
        @JsonSubTypes.Type(value = EdgeEvent.EdgeConnected.class, name = "EdgeConnected"),
        @JsonSubTypes.Type(value = EdgeEvent.EdgeRemoved.class, name = "EdgeRemoved"),
        @JsonSubTypes.Type(value = EdgeEvent.EdgeUpdated.class, name = "EdgeUpdated"),
        @JsonSubTypes.Type(value = EdgeEvent.EdgeReversed.class, name = "EdgeReversed"),
        @JsonSubTypes.Type(value = SubgraphEvent.SubgraphCreated.class, name = "SubgraphCreated"),
        @JsonSubTypes.Type(value = SubgraphEvent.SubgraphRemoved.class, name = "SubgraphRemoved"),
        @JsonSubTypes.Type(value = SubgraphEvent.SubgraphMoved.class, name = "SubgraphMoved"),
        @JsonSubTypes.Type(value = SubgraphEvent.NodeAddedToSubgraph.class, name = "NodeAddedToSubgraph"),
        @JsonSubTypes.Type(value = SubgraphEvent.NodeRemovedFromSubgraph.class, name = "NodeRemovedFromSubgraph"),
        @JsonSubTypes.Type(value = WorkflowCreated.class, name = "WorkflowCreated"),
        @JsonSubTypes.Type(value = StepAdded.class, name = "StepAdded"),
        @JsonSubTypes.Type(value = StepsConnected.class, name = "StepsConnected"),
        @JsonSubTypes.Type(value = WorkflowValidated.class, name = "WorkflowValidated"),
        @JsonSubTypes.Type(value = WorkflowStarted.class, name = "WorkflowStarted"),
        @JsonSubTypes.Type(value = StepCompleted.class, name = "StepCompleted"),
        @JsonSubTypes.Type(value = WorkflowPaused.class, name = "WorkflowPaused"),
        @JsonSubTypes.Type(value = WorkflowResumed.class, name = "WorkflowResumed"),
        @JsonSubTypes.Type(value = WorkflowCompleted.class, name = "WorkflowCompleted"),
        @JsonSubTypes.Type(value = WorkflowFailed.class, name = "WorkflowFailed"),
        @JsonSubTypes.Type(value = WorkflowRecovered.class, name = "WorkflowRecovered")
})
public sealed interface DomainEvent permits GraphEvent, NodeEvent, EdgeEvent, SubgraphEvent, WorkflowEvent {

    /**
     * The aggregate whose event stream this event belongs to.
     */
    AggregateId aggregateId();

    <R> R accept(DomainEventVisitor<R> visitor);

    default String eventType() {
        return getClass().getSimpleName();
    }
}
