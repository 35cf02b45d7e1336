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


package org.fireflyframework.eventbridge.workflow.model;

import org.fireflyframework.eventbridge.core.model.RetryPolicy;

import java.util.List;
import java.util.Objects;

/**
 * A step definition owned by a workflow. Steps are never mutated once added.
 *
 * @param nodeId    graph node this step is drawn as, may be {@code null}
 * @param timeoutMs step timeout, {@code 0} for none
 */
public record WorkflowStep(
        String id,
        String name,
        StepType stepType,
        String nodeId,
        List<StepInput> inputs,
        List<StepOutput> outputs,
        long timeoutMs,
        RetryPolicy retryPolicy
) {
    public WorkflowStep {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(stepType, "stepType must not be null");
        if (id.isBlank()) throw new IllegalArgumentException("id must not be blank");
        if (timeoutMs < 0) throw new IllegalArgumentException("timeoutMs must be >= 0");
        name = name != null ? name : id;
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
        retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.NO_RETRY;
    }

    public static WorkflowStep of(String id, String name, StepType stepType) {
        return new WorkflowStep(id, name, stepType, null, List.of(), List.of(), 0, RetryPolicy.NO_RETRY);
    }

    public static WorkflowStep userTask(String id, String name) {
        return of(id, name, new StepType.UserTask());
    }

    public boolean hasTimeout() {
        return timeoutMs > 0;
    }
}
