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
 * Facts emitted by the workflow aggregate. The workflow is the aggregate.
 */
public sealed interface WorkflowEvent extends DomainEvent
        permits WorkflowCreated, StepAdded, StepsConnected, WorkflowValidated, WorkflowStarted,
        StepCompleted, WorkflowPaused, WorkflowResumed, WorkflowCompleted, WorkflowFailed, WorkflowRecovered {

    AggregateId workflowId();

    @Override
    default AggregateId aggregateId() {
        return workflowId();
    }

    <R> R accept(WorkflowEventVisitor<R> visitor);

    @Override
    default <R> R accept(DomainEventVisitor<R> visitor) {
        return accept((WorkflowEventVisitor<R>) visitor);
    }
}
