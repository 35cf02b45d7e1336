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

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Data of one workflow run. Exists only while the workflow is executing; every update
 * returns a new context.
 *
 * @param variables   outputs of every completed step merged in completion order
 * @param stepOutputs outputs keyed by the step that produced them
 */
public record ExecutionContext(
        String instanceId,
        Map<String, Object> inputs,
        Map<String, Object> variables,
        Map<String, Map<String, Object>> stepOutputs
) {
    public ExecutionContext {
        inputs = inputs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(inputs)) : Map.of();
        variables = variables != null ? Collections.unmodifiableMap(new LinkedHashMap<>(variables)) : Map.of();
        stepOutputs = stepOutputs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(stepOutputs)) : Map.of();
    }

    public static ExecutionContext start(String instanceId, Map<String, Object> inputs) {
        return new ExecutionContext(instanceId, inputs, Map.of(), Map.of());
    }

    public ExecutionContext withStepOutputs(String stepId, Map<String, Object> outputs) {
        var mergedVariables = new HashMap<>(variables);
        mergedVariables.putAll(outputs);
        var mergedOutputs = new HashMap<>(stepOutputs);
        mergedOutputs.put(stepId, Collections.unmodifiableMap(new LinkedHashMap<>(outputs)));
        return new ExecutionContext(instanceId, inputs, mergedVariables, mergedOutputs);
    }
}
