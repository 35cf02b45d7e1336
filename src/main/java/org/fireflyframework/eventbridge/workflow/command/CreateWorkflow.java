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


package org.fireflyframework.eventbridge.workflow.command;

import org.fireflyframework.eventbridge.core.model.AggregateId;

import java.util.List;

public record CreateWorkflow(AggregateId workflowId, String name, String description, String createdBy, List<String> tags)
        implements WorkflowCommand {

    public CreateWorkflow {
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public CreateWorkflow(AggregateId workflowId, String name, String description) {
        this(workflowId, name, description, null, List.of());
    }

    @Override
    public CommandKind kind() {
        return CommandKind.CREATE;
    }

    @Override
    public <R> R accept(WorkflowCommandVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
