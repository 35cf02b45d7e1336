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


package org.fireflyframework.eventbridge.unit.core;

import org.fireflyframework.eventbridge.core.model.AggregateId;
import org.fireflyframework.eventbridge.core.model.MessageMetadata;
import org.fireflyframework.eventbridge.core.serialization.EventSerializer;
import org.fireflyframework.eventbridge.event.DomainEvent;
import org.fireflyframework.eventbridge.event.NodeEvent;
import org.fireflyframework.eventbridge.event.Position;
import org.fireflyframework.eventbridge.event.StepAdded;
import org.fireflyframework.eventbridge.event.StepCompleted;
import org.fireflyframework.eventbridge.routing.RoutedEvent;
import org.fireflyframework.eventbridge.workflow.model.StepType;
import org.fireflyframework.eventbridge.workflow.model.WorkflowStep;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventSerializerTest {

    private final EventSerializer serializer = new EventSerializer();
    private final AggregateId graphId = AggregateId.random();

    @Test
    void domainEventCarriesItsTypeName() {
        var event = new NodeEvent.NodeAdded(graphId, "n1", "Start", new Position(1, 2, 0));

        String json = serializer.serialize(event);

        assertThat(json).contains("\"type\":\"NodeAdded\"").contains(graphId.toString());
        DomainEvent restored = serializer.deserializeEvent(json);
        assertThat(restored).isEqualTo(event);
    }

    @Test
    void routedEventSurvivesTheWire() {
        var step = WorkflowStep.of("charge", "Charge card", new StepType.ServiceTask("billing", "charge"));
        var routed = new RoutedEvent(new StepAdded(AggregateId.random(), step, true, false),
                "event.workflow.step_added", 42, 3, 1, Instant.parse("2026-03-01T10:00:00Z"),
                MessageMetadata.root(Map.of("tenant", "acme")));

        RoutedEvent restored = serializer.deserializeFromBytes(serializer.serializeToBytes(routed));

        assertThat(restored).isEqualTo(routed);
        assertThat(serializer.serialize(routed)).contains("2026-03-01T10:00:00Z").contains("\"kind\":\"ServiceTask\"");
    }

    @Test
    void nullOutputValuesSurviveTheWire() {
        Map<String, Object> outputs = new HashMap<>();
        outputs.put("approvedBy", null);
        outputs.put("amount", 120);
        var event = new StepCompleted(AggregateId.random(), "approve", outputs, null,
                Instant.parse("2026-03-01T10:00:00Z"));

        String json = serializer.serialize(event);

        assertThat(json).contains("\"approvedBy\":null");
        DomainEvent restored = serializer.deserializeEvent(json);
        assertThat(restored).isEqualTo(event);
        assertThat(((StepCompleted) restored).outputs()).containsEntry("approvedBy", null);
    }

    @Test
    void malformedInputIsReportedAsIllegalState() {
        assertThatThrownBy(() -> serializer.deserializeEvent("{\"type\":\"Unknown\"}"))
                .isInstanceOf(IllegalStateException.class);
    }
}
