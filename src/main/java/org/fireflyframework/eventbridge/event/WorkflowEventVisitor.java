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
 * Exhaustive dispatch over every {@link WorkflowEvent} variant.
 */
public interface WorkflowEventVisitor<R> {
    R visit(WorkflowCreated event);
    R visit(StepAdded event);
    R visit(StepsConnected event);
    R visit(WorkflowValidated event);
    R visit(WorkflowStarted event);
    R visit(StepCompleted event);
    R visit(WorkflowPaused event);
    R visit(WorkflowResumed event);
    R visit(WorkflowCompleted event);
    R visit(WorkflowFailed event);
    R visit(WorkflowRecovered event);
}
