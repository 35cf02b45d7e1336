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


package org.fireflyframework.eventbridge.unit.consumer;

import org.fireflyframework.eventbridge.consumer.SubjectConsumer;
import org.fireflyframework.eventbridge.core.exception.RoutingException;
import org.fireflyframework.eventbridge.core.model.AggregateId;
import org.fireflyframework.eventbridge.event.GraphEvent;
import org.fireflyframework.eventbridge.event.NodeEvent;
import org.fireflyframework.eventbridge.event.Position;
import org.fireflyframework.eventbridge.event.WorkflowStarted;
import org.fireflyframework.eventbridge.routing.RoutedEvent;
import org.fireflyframework.eventbridge.routing.RouterConfig;
import org.fireflyframework.eventbridge.routing.SubjectRouter;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubjectConsumerTest {

    private final SubjectRouter router = new SubjectRouter(RouterConfig.defaults());
    private final AggregateId graphId = AggregateId.random();
    private final AggregateId workflowId = AggregateId.random();

    @Test
    void pollMergesReceiversInGlobalOrder() {
        try (SubjectConsumer consumer = SubjectConsumer.subscribe(router, "event.workflow.>", "event.graph.node.*")) {
            router.routeEvent(new NodeEvent.NodeAdded(graphId, "n1", "A", new Position(0, 0, 0)));
            router.routeEvent(started());
            router.routeEvent(new NodeEvent.NodeRemoved(graphId, "n1"));
            router.routeEvent(new GraphEvent.GraphDeleted(graphId));

            List<RoutedEvent> batch = consumer.pollEvents();

            assertThat(batch).extracting(RoutedEvent::globalSequence).containsExactly(1L, 2L, 3L);
            assertThat(batch).extracting(RoutedEvent::subject).containsExactly(
                    "event.graph.node.added", "event.workflow.started", "event.graph.node.removed");
            assertThat(consumer.pollEvents()).isEmpty();
        }
    }

    @Test
    void overlappingPatternsYieldOneCopyPerPattern() {
        try (SubjectConsumer consumer = SubjectConsumer.subscribe(router, "event.graph.>", "event.graph.node.added")) {
            router.routeEvent(new NodeEvent.NodeAdded(graphId, "n1", "A", new Position(0, 0, 0)));

            List<RoutedEvent> batch = consumer.pollEvents();

            assertThat(batch).hasSize(2);
            assertThat(batch).extracting(RoutedEvent::globalSequence).containsOnly(1L);
        }
    }

    @Test
    void closeReleasesEveryReceiver() {
        SubjectConsumer consumer = SubjectConsumer.subscribe(router, "event.graph.>", "event.workflow.>");
        assertThat(consumer.getPatterns()).containsExactly("event.graph.>", "event.workflow.>");

        consumer.close();

        assertThat(router.getStats().values()).allSatisfy(stats -> assertThat(stats.subscribers()).isZero());
    }

    @Test
    void failedSubscriptionReleasesEarlierReceivers() {
        assertThatThrownBy(() -> SubjectConsumer.subscribe(router, "event.graph.>", "event..bad"))
                .isInstanceOf(RoutingException.class);

        assertThat(router.getStats().get("event.graph.>").subscribers()).isZero();
    }

    @Test
    void streamEmitsEachPollInOrder() {
        SubjectConsumer consumer = SubjectConsumer.subscribe(router, "event.workflow.>");

        StepVerifier.withVirtualTime(() -> consumer.stream(Duration.ofSeconds(1)))
                .expectSubscription()
                .then(() -> {
                    router.routeEvent(started());
                    router.routeEvent(started());
                })
                .thenAwait(Duration.ofSeconds(1))
                .assertNext(event -> assertThat(event.globalSequence()).isEqualTo(1))
                .assertNext(event -> assertThat(event.globalSequence()).isEqualTo(2))
                .then(() -> router.routeEvent(started()))
                .thenAwait(Duration.ofSeconds(1))
                .assertNext(event -> assertThat(event.aggregateSequence()).isEqualTo(3))
                .thenCancel()
                .verify();
        consumer.close();
    }

    private WorkflowStarted started() {
        return new WorkflowStarted(workflowId, "i1", "alice", Map.of(), "a", Instant.now());
    }
}
