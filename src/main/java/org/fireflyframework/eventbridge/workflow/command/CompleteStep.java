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
 * @param nextStep step to continue with, {@code null} when the completed step ends its path
 */
public record CompleteStep(AggregateId workflowId, String stepId, Map<String, Object> outputs, String nextStep)
        implements WorkflowCommand {

    public CompleteStep {
        outputs = outputs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(outputs)) : Map.of();
    }

    public CompleteStep(AggregateId workflowId, String stepId, String nextStep) {
        this(workflowId, stepId, Map.of(), nextStep);
    }

    @Override
    public CommandKind kind() {
        return CommandKind.COMPLETE_STEP;
    }

    @Override
    public <R> R accept(WorkflowCommandVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
