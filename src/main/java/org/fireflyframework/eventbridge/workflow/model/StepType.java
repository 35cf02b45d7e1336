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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * What kind of work a workflow step performs.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StepType.UserTask.class, name = "UserTask"),
        @JsonSubTypes.Type(value = StepType.ServiceTask.class, name = "ServiceTask"),
        @JsonSubTypes.Type(value = StepType.Decision.class, name = "Decision"),
        @JsonSubTypes.Type(value = StepType.ParallelGateway.class, name = "ParallelGateway"),
        @JsonSubTypes.Type(value = StepType.EventWait.class, name = "EventWait"),
        @JsonSubTypes.Type(value = StepType.Script.class, name = "Script")
})
public sealed interface StepType {

    record UserTask() implements StepType {
        @JsonCreator
        public UserTask {}
    }

    record ServiceTask(String service, String operation) implements StepType {}

    record Decision(List<DecisionCondition> conditions) implements StepType {
        public Decision {
            conditions = conditions != null ? List.copyOf(conditions) : List.of();
        }
    }

    record ParallelGateway(List<String> branches) implements StepType {
        public ParallelGateway {
            branches = branches != null ? List.copyOf(branches) : List.of();
        }
    }

    record EventWait(String eventType, long timeoutMs) implements StepType {}

    record Script(String language, String code) implements StepType {}
}
