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

/**
 * @param edgeId    identifier of the transition, generated when {@code null}
 * @param condition optional guard expression
 */
public record ConnectSteps(AggregateId workflowId, String fromStep, String toStep, String edgeId, String condition)
        implements WorkflowCommand {

    public ConnectSteps(AggregateId workflowId, String fromStep, String toStep) {
        this(workflowId, fromStep, toStep, null, null);
    }

    @Override
    public CommandKind kind() {
        return CommandKind.CONNECT_STEPS;
    }

    @Override
    public <R> R accept(WorkflowCommandVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
