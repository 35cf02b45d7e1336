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


package org.fireflyframework.eventbridge.integration;

import org.fireflyframework.eventbridge.config.EventBridgeAutoConfiguration;
import org.fireflyframework.eventbridge.consumer.EventSequencer;
import org.fireflyframework.eventbridge.consumer.SequencerConfig;
import org.fireflyframework.eventbridge.consumer.SubjectConsumer;
import org.fireflyframework.eventbridge.core.model.AggregateId;
import org.fireflyframework.eventbridge.routing.RoutedEvent;
import org.fireflyframework.eventbridge.routing.SubjectRouter;
import org.fireflyframework.eventbridge.workflow.command.*;
import org.fireflyframework.eventbridge.workflow.model.StepType;
import org.fireflyframework.eventbridge.workflow.model.WorkflowStep;
import org.fireflyframework.eventbridge.workflow.service.WorkflowService;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Drives a workflow through the service and reads the routed events back through a consumer
 * and a sequencer, as a downstream projection would.
 */
class WorkflowRoutingIntegrationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(EventBridgeAutoConfiguration.class));

    @Test
    void projectionSeesEveryEventInOrder() {
        contextRunner.run(context -> {
            var service = context.getBean(WorkflowService.class);
            var router = context.getBean(SubjectRouter.class);
            var sequencer = new EventSequencer(context.getBean(SequencerConfig.class));
            var id = AggregateId.random();

            try (var consumer = SubjectConsumer.subscribe(router, "event.workflow.>")) {
                List<WorkflowCommand> commands = List.of(
                        new CreateWorkflow(id, "Order fulfilment", "Ship an order"),
                        new AddStep(id, WorkflowStep.of("reserve", "Reserve stock",
                                new StepType.ServiceTask("inventory", "reserve")), true, false),
                        AddStep.endStep(id, WorkflowStep.of("ship", "Ship parcel",
                                new StepType.ServiceTask("shipping", "dispatch"))),
                        new ConnectSteps(id, "reserve", "ship"),
                        new ValidateWorkflow(id, "planner"),
                        new StartWorkflow(id, "order-17", "api", Map.of("orderId", "17")),
                        new CompleteStep(id, "reserve", Map.of("reservation", "r-1"), "ship"),
                        new CompleteStep(id, "ship", Map.of("tracking", "t-9"), null));
                for (WorkflowCommand command : commands) {
                    StepVerifier.create(service.execute(command)).expectNextCount(1).verifyComplete();
                }

                List<RoutedEvent> batch = consumer.pollEvents();
                List<RoutedEvent> reversed = new ArrayList<>(batch);
                Collections.reverse(reversed);
                List<RoutedEvent> released = new ArrayList<>();
                reversed.forEach(event -> released.addAll(sequencer.process(event)));

                assertThat(batch).hasSize(9);
                assertThat(released).extracting(RoutedEvent::subject).containsExactly(
                        "event.workflow.created",
                        "event.workflow.step_added",
                        "event.workflow.step_added",
                        "event.workflow.steps_connected",
                        "event.workflow.validated",
                        "event.workflow.started",
                        "event.workflow.step_completed",
                        "event.workflow.step_completed",
                        "event.workflow.completed");
                assertThat(released).extracting(RoutedEvent::aggregateSequence)
                        .containsExactly(1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L, 9L);
                assertThat(released.stream().map(event -> event.metadata().correlationId()).distinct())
                        .as("one correlation id per command")
                        .hasSize(commands.size());
            }
        });
    }
}
