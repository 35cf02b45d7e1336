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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param instanceId execution instance identifier, generated when {@code null}
 */
public record StartWorkflow(AggregateId workflowId, String instanceId, String startedBy, Map<String, Object> inputs)
        implements WorkflowCommand {

    public StartWorkflow {
        inputs = inputs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(inputs)) : Map.of();
    }

    public StartWorkflow(AggregateId workflowId, String startedBy) {
        this(workflowId, null, startedBy, Map.of());
    }

    @Override
    public CommandKind kind() {
        return CommandKind.START;
    }

    @Override
    public <R> R accept(WorkflowCommandVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
