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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Where a step input takes its value from.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "from")
@JsonSubTypes({
        @JsonSubTypes.Type(value = DataSource.Constant.class, name = "Constant"),
        @JsonSubTypes.Type(value = DataSource.StepOutputRef.class, name = "StepOutput"),
        @JsonSubTypes.Type(value = DataSource.WorkflowInput.class, name = "WorkflowInput"),
        @JsonSubTypes.Type(value = DataSource.External.class, name = "External")
})
public sealed interface DataSource {

    record Constant(Object value) implements DataSource {}

    record StepOutputRef(String stepId, String outputName) implements DataSource {}

    record WorkflowInput(String name) implements DataSource {}

    record External(String uri) implements DataSource {}
}
