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

import org.fireflyframework.eventbridge.consumer.EventSequencer;
import org.fireflyframework.eventbridge.consumer.SequencerConfig;
import org.fireflyframework.eventbridge.consumer.SequencerStats;
import org.fireflyframework.eventbridge.core.exception.SequenceBufferFullException;
import org.fireflyframework.eventbridge.core.exception.SequenceGapException;
import org.fireflyframework.eventbridge.core.model.AggregateId;
import org.fireflyframework.eventbridge.core.model.MessageMetadata;
import org.fireflyframework.eventbridge.event.NodeEvent;
import org.fireflyframework.eventbridge.routing.RoutedEvent;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventSequencerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private final AggregateId graphId = AggregateId.random();

    private RoutedEvent routed(AggregateId id, long aggregateSequence) {
        return new RoutedEvent(new NodeEvent.NodeRemoved(id, "n" + aggregateSequence), "event.graph.node.removed",
                aggregateSequence, aggregateSequence, 0, clock.instant(), MessageMetadata.root());
    }

    @Test
    void releasesInOrderEventsImmediately() {
        var sequencer = new EventSequencer(SequencerConfig.defaults(), clock);

        assertThat(sequencer.process(routed(graphId, 1))).hasSize(1);
        assertThat(sequencer.process(routed(graphId, 2))).hasSize(1);
        assertThat(sequencer.getStats().released()).isEqualTo(2);
    }

    @Test
    void buffersOutOfOrderEventsUntilTheGapCloses() {
        var sequencer = new EventSequencer(SequencerConfig.defaults(), clock);

        assertThat(sequencer.process(routed(graphId, 3))).isEmpty();
        assertThat(sequencer.process(routed(graphId, 2))).isEmpty();
        SequencerStats.AggregateStats pending = sequencer.getStats().aggregates().get(graphId);
        assertThat(pending.pendingCount()).isEqualTo(2);
        assertThat(pending.oldestPending()).isEqualTo(2L);

        List<RoutedEvent> released = sequencer.process(routed(graphId, 1));

        assertThat(released).extracting(RoutedEvent::aggregateSequence).containsExactly(1L, 2L, 3L);
        assertThat(sequencer.getStats().aggregates().get(graphId).nextSequence()).isEqualTo(4);
        assertThat(sequencer.getStats().aggregates().get(graphId).oldestPending()).isNull();
    }

    @Test
    void aggregatesAreSequencedIndependently() {
        var sequencer = new EventSequencer(SequencerConfig.defaults(), clock);
        var other = AggregateId.random();

        assertThat(sequencer.process(routed(graphId, 2))).isEmpty();
        assertThat(sequencer.process(routed(other, 1))).hasSize(1);
    }

    @Test
    void discardsDuplicates() {
        var sequencer = new EventSequencer(SequencerConfig.defaults(), clock);
        sequencer.process(routed(graphId, 1));
        sequencer.process(routed(graphId, 3));

        assertThat(sequencer.process(routed(graphId, 1))).isEmpty();
        assertThat(sequencer.process(routed(graphId, 3))).isEmpty();
        assertThat(sequencer.getStats().duplicates()).isEqualTo(2);
    }

    @Test
    void rejectsEventsTooFarAhead() {
        var sequencer = new EventSequencer(new SequencerConfig(10, 5, Duration.ofSeconds(30)), clock);

        assertThatThrownBy(() -> sequencer.process(routed(graphId, 7)))
                .isInstanceOf(SequenceGapException.class);
        assertThat(sequencer.process(routed(graphId, 6))).isEmpty();
    }

    @Test
    void rejectsEventsWhenTheBufferIsFull() {
        var sequencer = new EventSequencer(new SequencerConfig(2, 100, Duration.ofSeconds(30)), clock);
        sequencer.process(routed(graphId, 2));
        sequencer.process(routed(graphId, 3));

        assertThatThrownBy(() -> sequencer.process(routed(graphId, 4)))
                .isInstanceOf(SequenceBufferFullException.class);
        assertThat(sequencer.process(routed(graphId, 1))).hasSize(3);
    }

    @Test
    void timeoutSkipsMissingSequences() {
        var sequencer = new EventSequencer(new SequencerConfig(10, 100, Duration.ofSeconds(30)), clock);
        sequencer.process(routed(graphId, 3));
        sequencer.process(routed(graphId, 4));

        clock.advance(Duration.ofSeconds(30));
        assertThat(sequencer.checkTimeouts()).isEmpty();

        clock.advance(Duration.ofSeconds(1));
        List<RoutedEvent> forced = sequencer.checkTimeouts();

        assertThat(forced).extracting(RoutedEvent::aggregateSequence).containsExactly(3L, 4L);
        assertThat(sequencer.getStats().skipped()).isEqualTo(2);
        assertThat(sequencer.process(routed(graphId, 5))).hasSize(1);
        assertThat(sequencer.process(routed(graphId, 2))).isEmpty();
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
