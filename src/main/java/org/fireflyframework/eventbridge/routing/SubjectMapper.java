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

import org.fireflyframework.eventbridge.event.*;

/**
 * Maps every domain event to its routing subject.
 *
 * <p>Subjects are lowercase, dot-separated tokens: the fixed root {@code event}, the category
 * ({@code graph} or {@code workflow}), then the fact. Node, edge and subgraph facts live under the
 * graph category, e.g. {@code event.graph.node.added}. The mapping is a visitor, so an event variant
 * without a subject does not compile.
 */
public final class SubjectMapper {

    public static final String ROOT = "event";

    private static final Mapping MAPPING = new Mapping();

    private SubjectMapper() {}

    public static String subjectOf(DomainEvent event) {
        return event.accept(MAPPING);
    }

    private static String graph(String fact) {
        return ROOT + ".graph." + fact;
    }

    private static String workflow(String fact) {
        return ROOT + ".workflow." + fact;
    }

    private static final class Mapping implements DomainEventVisitor<String> {

        // Graph
        @Override public String visit(GraphEvent.GraphCreated event) { return graph("created"); }
        @Override public String visit(GraphEvent.GraphDeleted event) { return graph("deleted"); }
        @Override public String visit(GraphEvent.GraphRenamed event) { return graph("renamed"); }
        @Override public String visit(GraphEvent.GraphTagged event) { return graph("tagged"); }
        @Override public String visit(GraphEvent.GraphUntagged event) { return graph("untagged"); }
        @Override public String visit(GraphEvent.GraphUpdated event) { return graph("updated"); }
        @Override public String visit(GraphEvent.GraphImportRequested event) { return graph("import_requested"); }
        @Override public String visit(GraphEvent.GraphImportCompleted event) { return graph("import_completed"); }
        @Override public String visit(GraphEvent.GraphImportFailed event) { return graph("import_failed"); }

        // Node
        @Override public String visit(NodeEvent.NodeAdded event) { return graph("node.added"); }
        @Override public String visit(NodeEvent.NodeRemoved event) { return graph("node.removed"); }
        @Override public String visit(NodeEvent.NodeUpdated event) { return graph("node.updated"); }
        @Override public String visit(NodeEvent.NodeMoved event) { return graph("node.moved"); }
        @Override public String visit(NodeEvent.NodeContentChanged event) { return graph("node.content_changed"); }

        // Edge
        @Override public String visit(EdgeEvent.EdgeConnected event) { return graph("edge.connected"); }
        @Override public String visit(EdgeEvent.EdgeRemoved event) { return graph("edge.removed"); }
        @Override public String visit(EdgeEvent.EdgeUpdated event) { return graph("edge.updated"); }
        @Override public String visit(EdgeEvent.EdgeReversed event) { return graph("edge.reversed"); }

        // Subgraph
        @Override public String visit(SubgraphEvent.SubgraphCreated event) { return graph("subgraph.created"); }
        @Override public String visit(SubgraphEvent.SubgraphRemoved event) { return graph("subgraph.removed"); }
        @Override public String visit(SubgraphEvent.SubgraphMoved event) { return graph("subgraph.moved"); }
        @Override public String visit(SubgraphEvent.NodeAddedToSubgraph event) { return graph("subgraph.node_added"); }
        @Override public String visit(SubgraphEvent.NodeRemovedFromSubgraph event) { return graph("subgraph.node_removed"); }

        // Workflow
        @Override public String visit(WorkflowCreated event) { return workflow("created"); }
        @Override public String visit(StepAdded event) { return workflow("step_added"); }
        @Override public String visit(StepsConnected event) { return workflow("steps_connected"); }
        @Override public String visit(WorkflowValidated event) { return workflow("validated"); }
        @Override public String visit(WorkflowStarted event) { return workflow("started"); }
        @Override public String visit(StepCompleted event) { return workflow("step_completed"); }
        @Override public String visit(WorkflowPaused event) { return workflow("paused"); }
        @Override public String visit(WorkflowResumed event) { return workflow("resumed"); }
        @Override public String visit(WorkflowCompleted event) { return workflow("completed"); }
        @Override public String visit(WorkflowFailed event) { return workflow("failed"); }
        @Override public String visit(WorkflowRecovered event) { return workflow("recovered"); }
    }
}
