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


package org.fireflyframework.eventbridge.workflow.service;

import org.fireflyframework.eventbridge.core.model.AggregateId;
import org.fireflyframework.eventbridge.event.WorkflowEvent;
import org.fireflyframework.eventbridge.workflow.aggregate.WorkflowStatus;

import java.util.List;

/**
 * Outcome of a successfully handled command.
 *
 * @param events      events produced, persisted and routed, in order
 * @param version     aggregate version after the events were applied
 * @param deliveries  for each event, the patterns it was delivered to
 */
public record CommandResult(
        AggregateId aggregateId,
        String correlationId,
        List<WorkflowEvent> events,
        WorkflowStatus status,
        long version,
        List<List<String>> deliveries
) {
    public CommandResult {
        events = List.copyOf(events);
        deliveries = deliveries.stream().map(List::copyOf).toList();
    }

    public int deliveryCount() {
        return deliveries.stream().mapToInt(List::size).sum();
    }
}
