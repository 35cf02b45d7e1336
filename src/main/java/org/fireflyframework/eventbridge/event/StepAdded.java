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
import org.fireflyframework.eventbridge.workflow.model.WorkflowStep;

/**
 * @param startStep whether the step was explicitly marked as the start step
 * @param endStep   whether completing the step may finish the workflow
 */
public record StepAdded(AggregateId workflowId, WorkflowStep step, boolean startStep, boolean endStep)
        implements WorkflowEvent {

    @Override
    public <R> R accept(WorkflowEventVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
