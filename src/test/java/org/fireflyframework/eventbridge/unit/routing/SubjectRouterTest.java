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


package org.fireflyframework.eventbridge.unit.routing;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.fireflyframework.eventbridge.core.dlq.DeadLetterEntry;
import org.fireflyframework.eventbridge.core.dlq.DeadLetterService;
import org.fireflyframework.eventbridge.core.dlq.InMemoryDeadLetterStore;
import org.fireflyframework.eventbridge.core.exception.RoutingException;
import org.fireflyframework.eventbridge.core.model.AggregateId;
import org.fireflyframework.eventbridge.core.model.EventEnvelope;
import org.fireflyframework.eventbridge.core.model.MessageMetadata;
import org.fireflyframework.eventbridge.core.observability.RoutingEvents;
import org.fireflyframework.eventbridge.core.observability.RoutingLoggerEvents;
import org.fireflyframework.eventbridge.event.GraphEvent;
import org.fireflyframework.eventbridge.event.NodeEvent;
import org.fireflyframework.eventbridge.event.Position;
import org.fireflyframework.eventbridge.event.WorkflowStarted;
import org.fireflyframework.eventbridge.routing.*;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubjectRouterTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    private final AggregateId graphId = AggregateId.random();

    private NodeEvent.NodeAdded nodeAdded(String nodeId) {
        return new NodeEvent.NodeAdded(graphId, nodeId, "Node " + nodeId, new Position(0, 0, 0));
    }

    @Test
    void fansOutToEveryMatchingPatternWithSharedSequences() {
        var router = new SubjectRouter(RouterConfig.defaults());
        SubjectReceiver all = router.registerSubject("event.graph.>");
        SubjectReceiver added = router.registerSubject("event.graph.node.added");
        SubjectReceiver workflows = router.registerSubject("event.workflow.>");

        List<String> delivered = router.routeEvent(nodeAdded("n1"));

        assertThat(delivered).containsExactlyInAnyOrder("event.graph.>", "event.graph.node.added");
        RoutedEvent fromAll = all.tryReceive().orElseThrow();
        RoutedEvent fromAdded = added.tryReceive().orElseThrow();
        assertThat(fromAll.subject()).isEqualTo("event.graph.node.added");
        assertThat(fromAll.globalSequence()).isEqualTo(1);
        assertThat(fromAll.aggregateSequence()).isEqualTo(1);
        assertThat(fromAdded.globalSequence()).isEqualTo(fromAll.globalSequence());
        assertThat(fromAdded.aggregateSequence()).isEqualTo(fromAll.aggregateSequence());
        assertThat(fromAdded.event()).isEqualTo(fromAll.event());
        assertThat(workflows.tryReceive()).isEmpty();
    }

    @Test
    void stampsIncreasingSequencesAcrossAggregates() {
        var router = new SubjectRouter(RouterConfig.defaults());
        SubjectReceiver receiver = router.registerSubject(">");
        var otherGraph = AggregateId.random();

        router.routeEvent(nodeAdded("n1"));
        router.routeEvent(new GraphEvent.GraphDeleted(otherGraph));
        router.routeEvent(nodeAdded("n2"));

        List<RoutedEvent> events = receiver.drain();
        assertThat(events).extracting(RoutedEvent::globalSequence).containsExactly(1L, 2L, 3L);
        assertThat(events).extracting(RoutedEvent::aggregateSequence).containsExactly(1L, 1L, 2L);
        assertThat(router.currentGlobalSequence()).isEqualTo(3);
    }

    @Test
    void unmatchedEventIsStillStamped() {
        var tracking = new TrackingEvents();
        var router = new SubjectRouter(RouterConfig.defaults(), new SequenceTracker(Duration.ofSeconds(1)),
                tracking, null, CLOCK);

        List<String> delivered = router.routeEvent(nodeAdded("n1"));

        assertThat(delivered).isEmpty();
        assertThat(router.currentGlobalSequence()).isEqualTo(1);
        assertThat(tracking.unrouted).containsExactly("event.graph.node.added");
    }

    @Test
    void envelopeMetadataTravelsWithTheEvent() {
        var router = new SubjectRouter(RouterConfig.defaults());
        SubjectReceiver receiver = router.registerSubject("event.graph.node.*");
        var metadata = MessageMetadata.root(Map.of("tenant", "acme"));

        router.route(new EventEnvelope(nodeAdded("n1"), metadata));

        RoutedEvent routed = receiver.tryReceive().orElseThrow();
        assertThat(routed.metadata()).isEqualTo(metadata);
        assertThat(routed.retryCount()).isZero();
    }

    @Test
    void fullChannelDropsWithoutAffectingOtherChannels() {
        var router = new SubjectRouter(RouterConfig.defaults().withChannelCapacity(1));
        SubjectReceiver slow = router.registerSubject("event.graph.>");
        SubjectReceiver fast = router.registerSubject("event.graph.node.added");

        router.routeEvent(nodeAdded("n1"));
        fast.drain();
        List<String> second = router.routeEvent(nodeAdded("n2"));

        assertThat(second).containsExactly("event.graph.node.added");
        ChannelStats slowStats = router.getStats().get("event.graph.>");
        assertThat(slowStats.sent()).isEqualTo(1);
        assertThat(slowStats.dropped()).isEqualTo(1);
        assertThat(slowStats.lastError()).isEqualTo("channel full");
        assertThat(slowStats.isFull()).isTrue();
        assertThat(router.getStats().get("event.graph.node.added").dropped()).isZero();

        assertThat(slow.drain()).extracting(e -> ((NodeEvent.NodeAdded) e.event()).nodeId()).containsExactly("n1");
        assertThat(fast.drain()).hasSize(1);
    }

    @Test
    void dropIsLoggedOnceThroughTheLoggerListener() {
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        Logger routerLog = (Logger) LoggerFactory.getLogger(SubjectRouter.class);
        Logger listenerLog = (Logger) LoggerFactory.getLogger(RoutingLoggerEvents.class);
        routerLog.addAppender(appender);
        listenerLog.addAppender(appender);
        try {
            var router = new SubjectRouter(RouterConfig.defaults().withChannelCapacity(1),
                    new SequenceTracker(Duration.ofSeconds(1)), new RoutingLoggerEvents(), null, CLOCK);
            router.registerSubject("event.graph.>");
            router.routeEvent(nodeAdded("n1"));
            router.routeEvent(nodeAdded("n2"));

            assertThat(appender.list)
                    .filteredOn(e -> e.getLevel() == Level.WARN)
                    .singleElement()
                    .satisfies(e -> assertThat(e.getFormattedMessage())
                            .contains("dropped pattern=event.graph.>")
                            .contains("reason=channel full"));
        } finally {
            routerLog.detachAppender(appender);
            listenerLog.detachAppender(appender);
        }
    }

    @Test
    void closedReceiversCauseDrops() {
        var router = new SubjectRouter(RouterConfig.defaults());
        SubjectReceiver receiver = router.registerSubject("event.graph.>");
        receiver.close();

        List<String> delivered = router.routeEvent(nodeAdded("n1"));

        assertThat(delivered).isEmpty();
        ChannelStats stats = router.getStats().get("event.graph.>");
        assertThat(stats.subscribers()).isZero();
        assertThat(stats.dropped()).isEqualTo(1);
        assertThat(stats.lastError()).isEqualTo("no live receivers");
        assertThatThrownBy(receiver::tryReceive).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void registeringTheSamePatternSharesOneChannel() {
        var router = new SubjectRouter(RouterConfig.defaults());
        SubjectReceiver first = router.registerSubject("event.graph.>");
        SubjectReceiver second = router.registerSubject("event.graph.>");

        router.routeEvent(nodeAdded("n1"));
        first.close();

        assertThat(router.getPatterns()).containsExactly("event.graph.>");
        assertThat(router.getStats().get("event.graph.>").subscribers()).isEqualTo(1);
        assertThat(second.tryReceive()).isPresent();
    }

    @Test
    void deregisterRemovesThePattern() {
        var router = new SubjectRouter(RouterConfig.defaults());
        router.registerSubject("event.graph.>");

        assertThat(router.deregisterSubject("event.graph.>")).isTrue();
        assertThat(router.deregisterSubject("event.graph.>")).isFalse();
        assertThat(router.getPatterns()).isEmpty();
        assertThat(router.routeEvent(nodeAdded("n1"))).isEmpty();
    }

    @Test
    void rejectsMalformedPatterns() {
        var router = new SubjectRouter(RouterConfig.defaults());

        assertThatThrownBy(() -> router.registerSubject("event.>.graph"))
                .isInstanceOf(RoutingException.class);
        assertThat(router.getPatterns()).isEmpty();
    }

    @Test
    void receiveWaitsForAnEvent() throws InterruptedException {
        var router = new SubjectRouter(RouterConfig.defaults());
        SubjectReceiver receiver = router.registerSubject("event.workflow.*");

        assertThat(receiver.receive(Duration.ofMillis(20))).isEmpty();
        router.routeEvent(new WorkflowStarted(AggregateId.random(), "i1", "alice", Map.of(), "a", CLOCK.instant()));
        assertThat(receiver.receive(Duration.ofSeconds(1))).isPresent();
    }

    @Test
    void enablingDeadLettersRequiresAService() {
        assertThatThrownBy(() -> new SubjectRouter(RouterConfig.defaults().withDlq(3),
                new SequenceTracker(Duration.ofSeconds(1)), new RoutingEvents() {}, null, CLOCK))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    class LockFailures {

        @Test
        void sequenceFailurePropagatesAndDeliversNothing() {
            var failing = new SequenceTracker(Duration.ofMillis(50)) {
                @Override
                public SequenceStamp next(AggregateId aggregateId) {
                    throw new RoutingException("sequence lock unavailable");
                }
            };
            var router = new SubjectRouter(RouterConfig.defaults(), failing, new RoutingEvents() {}, null, CLOCK);
            SubjectReceiver receiver = router.registerSubject("event.graph.>");
            router.registerSubject("event.graph.node.added");
            Map<String, ChannelStats> before = router.getStats();

            assertThatThrownBy(() -> router.routeEvent(nodeAdded("n1")))
                    .isInstanceOf(RoutingException.class)
                    .hasMessageContaining("sequence lock unavailable");

            assertThat(receiver.tryReceive()).isEmpty();
            Map<String, ChannelStats> after = router.getStats();
            assertThat(after.keySet()).isEqualTo(before.keySet());
            after.forEach((pattern, stats) -> {
                assertThat(stats.sent()).isEqualTo(before.get(pattern).sent());
                assertThat(stats.dropped()).isZero();
            });
            // registry lock was released: the write path still works
            assertThat(router.deregisterSubject("event.graph.node.added")).isTrue();
        }

        @Test
        void heldSequenceLockTimesOutAndLeavesCountersUntouched() throws Exception {
            var tracker = new SequenceTracker(Duration.ofMillis(50));
            var router = new SubjectRouter(RouterConfig.defaults(), tracker, new RoutingEvents() {}, null, CLOCK);
            SubjectReceiver receiver = router.registerSubject("event.graph.>");

            var holding = new CountDownLatch(1);
            var release = new CountDownLatch(1);
            Map<AggregateId, Long> blockingRestore = new HashMap<>() {
                @Override
                public void forEach(BiConsumer<? super AggregateId, ? super Long> action) {
                    holding.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            };
            Thread holder = new Thread(() -> tracker.restore(0, blockingRestore), "sequence-lock-holder");
            holder.start();
            assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();

            try {
                assertThatThrownBy(() -> router.routeEvent(nodeAdded("n1")))
                        .isInstanceOf(RoutingException.class)
                        .hasMessageContaining("Timed out after 50ms acquiring sequence lock");
                assertThat(receiver.tryReceive()).isEmpty();
                assertThat(router.getStats().get("event.graph.>").sent()).isZero();
            } finally {
                release.countDown();
                holder.join(5_000);
            }

            router.routeEvent(nodeAdded("n2"));
            RoutedEvent routed = receiver.tryReceive().orElseThrow();
            assertThat(routed.globalSequence()).isEqualTo(1);
            assertThat(routed.aggregateSequence()).isEqualTo(1);
        }
    }

    @Nested
    class DeadLetters {

        private final InMemoryDeadLetterStore store = new InMemoryDeadLetterStore();
        private final TrackingEvents tracking = new TrackingEvents();
        private final SubjectRouter router = new SubjectRouter(
                RouterConfig.defaults().withChannelCapacity(1).withDlq(2),
                new SequenceTracker(Duration.ofSeconds(1)),
                tracking,
                new DeadLetterService(store, tracking),
                CLOCK);

        @Test
        void droppedEventIsDeadLetteredAndRedelivered() {
            SubjectReceiver receiver = router.registerSubject("event.graph.>");
            router.routeEvent(nodeAdded("n1"));
            router.routeEvent(nodeAdded("n2"));

            DeadLetterEntry entry = store.findAll().blockFirst();
            assertThat(entry).isNotNull();
            assertThat(entry.pattern()).isEqualTo("event.graph.>");
            assertThat(entry.subject()).isEqualTo("event.graph.node.added");
            assertThat(entry.errorMessage()).isEqualTo("channel full");
            assertThat(entry.routedEvent().globalSequence()).isEqualTo(2);
            assertThat(tracking.deadLettered).containsExactly("event.graph.>");

            receiver.drain();
            StepVerifier.create(router.redeliver(entry))
                    .expectNext(true)
                    .verifyComplete();

            RoutedEvent redelivered = receiver.tryReceive().orElseThrow();
            assertThat(redelivered.retryCount()).isEqualTo(1);
            assertThat(redelivered.globalSequence()).isEqualTo(2);
            StepVerifier.create(store.count()).expectNext(0L).verifyComplete();
        }

        @Test
        void failedRedeliveryMarksTheEntryRetried() {
            router.registerSubject("event.graph.>");
            router.routeEvent(nodeAdded("n1"));
            router.routeEvent(nodeAdded("n2"));
            DeadLetterEntry entry = store.findAll().blockFirst();

            StepVerifier.create(router.redeliver(entry))
                    .expectNext(false)
                    .verifyComplete();

            StepVerifier.create(store.findById(entry.id()))
                    .assertNext(stored -> {
                        assertThat(stored).isPresent();
                        assertThat(stored.get().retryCount()).isEqualTo(1);
                        assertThat(stored.get().lastRetriedAt()).isNotNull();
                    })
                    .verifyComplete();
        }

        @Test
        void givesUpAfterMaxRetries() {
            SubjectReceiver receiver = router.registerSubject("event.graph.>");
            router.routeEvent(nodeAdded("n1"));
            router.routeEvent(nodeAdded("n2"));
            DeadLetterEntry exhausted = store.findAll().blockFirst().withRetry().withRetry();
            receiver.drain();

            StepVerifier.create(router.redeliver(exhausted))
                    .expectNext(false)
                    .verifyComplete();
            assertThat(receiver.tryReceive()).isEmpty();
        }

        @Test
        void redeliveryFailsWhenDeadLettersAreDisabled() {
            var plain = new SubjectRouter(RouterConfig.defaults());
            var entry = DeadLetterEntry.create("event.graph.>",
                    new RoutedEvent(nodeAdded("n1"), "event.graph.node.added", 1, 1, 0, CLOCK.instant(),
                            MessageMetadata.root()),
                    "channel full");

            StepVerifier.create(plain.redeliver(entry))
                    .expectError(RoutingException.class)
                    .verify();
        }
    }

    static class TrackingEvents implements RoutingEvents {
        final List<String> unrouted = new ArrayList<>();
        final List<String> deadLettered = new ArrayList<>();

        @Override
        public void onNoSubscribers(String subject, String eventType) {
            unrouted.add(subject);
        }

        @Override
        public void onDeadLettered(String pattern, String subject, String reason) {
            deadLettered.add(pattern);
        }
    }
}
