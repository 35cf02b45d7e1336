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


package org.fireflyframework.eventbridge.workflow.aggregate;

import org.fireflyframework.eventbridge.workflow.model.WorkflowResult;

import java.time.Instant;
import java.util.List;

/**
 * The current lifecycle state of a workflow. Each state carries only the data that is
 * meaningful while the workflow is in it.
 */
public sealed interface WorkflowState {

    WorkflowStatus status();

    record Designed() implements WorkflowState {
        @Override
        public WorkflowStatus status() { return WorkflowStatus.DESIGNED; }
    }

    record Ready(Instant validatedAt, String validatedBy) implements WorkflowState {
        @Override
        public WorkflowStatus status() { return WorkflowStatus.READY; }
    }

    record Running(Instant startedAt, String currentStep, List<String> completedSteps) implements WorkflowState {
        public Running {
            completedSteps = List.copyOf(completedSteps);
        }

        @Override
        public WorkflowStatus status() { return WorkflowStatus.RUNNING; }
    }

    /**
     * @param startedAt      start of the run, kept so resuming does not reset the duration
     * @param completedSteps steps completed before pausing
     */
    record Paused(Instant pausedAt, String pausedBy, String resumePoint, Instant startedAt, List<String> completedSteps)
            implements WorkflowState {
        public Paused {
            completedSteps = List.copyOf(completedSteps);
        }

        @Override
        public WorkflowStatus status() { return WorkflowStatus.PAUSED; }
    }

    record Completed(Instant completedAt, WorkflowResult result) implements WorkflowState {
        @Override
        public WorkflowStatus status() { return WorkflowStatus.COMPLETED; }
    }

    /**
     * @param recoveryPoint step a recovery restarts from, {@code null} when the failure is final
     */
    record Failed(Instant failedAt, String error, String failedStep, String recoveryPoint,
                  Instant startedAt, List<String> completedSteps) implements WorkflowState {
        public Failed {
            completedSteps = List.copyOf(completedSteps);
        }

        public boolean isRecoverable() {
            return recoveryPoint != null;
        }

        @Override
        public WorkflowStatus status() { return WorkflowStatus.FAILED; }
    }
}
