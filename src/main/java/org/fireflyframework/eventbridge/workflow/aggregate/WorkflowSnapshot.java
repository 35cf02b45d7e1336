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

import org.fireflyframework.eventbridge.core.model.AggregateId;
import org.fireflyframework.eventbridge.workflow.model.StepTransition;
import org.fireflyframework.eventbridge.workflow.model.WorkflowStep;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of a {@link WorkflowAggregate}'s full state, enabling hydration without
 * replaying the whole event stream. Two aggregates with equal snapshots are equal by value.
 */
public record WorkflowSnapshot(
        AggregateId id,
        String name,
        String description,
        String createdBy,
        Instant createdAt,
        List<String> tags,
        WorkflowState state,
        Map<String, WorkflowStep> steps,
        List<StepTransition> transitions,
        String startStep,
        boolean startStepExplicit,
        Set<String> endSteps,
        long version,
        ExecutionContext executionContext
) {
    public WorkflowSnapshot {
        tags = tags != null ? List.copyOf(tags) : List.of();
        steps = steps != null ? Collections.unmodifiableMap(new LinkedHashMap<>(steps)) : Map.of();
        transitions = transitions != null ? List.copyOf(transitions) : List.of();
        endSteps = endSteps != null ? Collections.unmodifiableSet(new LinkedHashSet<>(endSteps)) : Set.of();
    }

    /**
     * Creates a snapshot from the current state of an aggregate.
     */
    public static WorkflowSnapshot from(WorkflowAggregate aggregate) {
        return new WorkflowSnapshot(
                aggregate.getId(),
                aggregate.getName(),
                aggregate.getDescription(),
                aggregate.getCreatedBy(),
                aggregate.getCreatedAt(),
                aggregate.getTags(),
                aggregate.getState(),
                aggregate.getSteps(),
                aggregate.getTransitions(),
                aggregate.getStartStep(),
                aggregate.isStartStepExplicit(),
                aggregate.getEndSteps(),
                aggregate.getVersion(),
                aggregate.getExecutionContext()
        );
    }

    public WorkflowAggregate restore() {
        return restore(Clock.systemUTC());
    }

    /**
     * Restores an aggregate from this snapshot. The restored aggregate has no uncommitted events.
     */
    public WorkflowAggregate restore(Clock clock) {
        var aggregate = new WorkflowAggregate(id, clock);
        aggregate.restore(this);
        return aggregate;
    }
}
