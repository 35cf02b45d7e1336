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
 * A request to change the state of one workflow aggregate. Commands are immutable and may be rejected.
 */
public sealed interface WorkflowCommand
        permits CreateWorkflow, AddStep, ConnectSteps, ValidateWorkflow, StartWorkflow,
        CompleteStep, PauseWorkflow, ResumeWorkflow, FailWorkflow, RecoverWorkflow {

    AggregateId workflowId();

    CommandKind kind();

    <R> R accept(WorkflowCommandVisitor<R> visitor);
}
