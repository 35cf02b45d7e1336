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


package org.fireflyframework.eventbridge.consumer;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.eventbridge.core.exception.SequenceBufferFullException;
import org.fireflyframework.eventbridge.core.exception.SequenceGapException;
import org.fireflyframework.eventbridge.core.model.AggregateId;
import org.fireflyframework.eventbridge.routing.RoutedEvent;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Releases routed events per aggregate in {@code aggregateSequence} order.
 *
 * <p>Events arriving ahead of the next expected sequence are buffered until the gap closes;
 * events at or below an already released sequence are discarded as duplicates. A missing
 * sequence that does not arrive within {@link SequencerConfig#sequenceTimeout()} is skipped by
 * {@link #checkTimeouts()}.
 *
 * <p>Meant for consumers that receive an aggregate's whole stream (e.g. {@code event.graph.>});
 * a consumer of a subset of subjects sees permanent gaps and relies on the timeout.
 */
@Slf4j
public class EventSequencer {

    private final SequencerConfig config;
    private final Clock clock;
    private final Map<AggregateId, AggregateBuffer> buffers = new HashMap<>();
    private long released;
    private long duplicates;
    private long skipped;

    public EventSequencer(SequencerConfig config) {
        this(config, Clock.systemUTC());
    }

    public EventSequencer(SequencerConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Accepts one routed event and returns the events of its aggregate that became releasable,
     * in sequence order. The list is empty when the event was buffered or discarded.
     *
     * @throws SequenceGapException        the event is more than {@code maxSequenceGap} ahead
     * @throws SequenceBufferFullException the aggregate already buffers {@code maxBufferSize} events
     */
    public synchronized List<RoutedEvent> process(RoutedEvent event) {
        AggregateId aggregateId = event.aggregateId();
        AggregateBuffer buffer = buffers.computeIfAbsent(aggregateId, id -> new AggregateBuffer(clock.instant()));
        long sequence = event.aggregateSequence();

        if (sequence < buffer.nextSequence || buffer.pending.containsKey(sequence)) {
            log.debug("[sequencer] Discarding duplicate sequence {} for {} (expected {})",
                    sequence, aggregateId, buffer.nextSequence);
            duplicates++;
            return List.of();
        }
        if (sequence > buffer.nextSequence) {
            long gap = sequence - buffer.nextSequence;
            if (gap > config.maxSequenceGap()) {
                throw new SequenceGapException(aggregateId, buffer.nextSequence, sequence, config.maxSequenceGap());
            }
            if (buffer.pending.size() >= config.maxBufferSize()) {
                throw new SequenceBufferFullException(aggregateId, config.maxBufferSize());
            }
            buffer.pending.put(sequence, event);
            return List.of();
        }

        List<RoutedEvent> ready = new ArrayList<>();
        ready.add(event);
        buffer.nextSequence++;
        buffer.releaseConsecutive(ready);
        buffer.lastProgress = clock.instant();
        released += ready.size();
        return ready;
    }

    /**
     * Skips missing sequences of aggregates that made no progress within the sequence timeout and
     * returns the buffered events released by doing so.
     */
    public synchronized List<RoutedEvent> checkTimeouts() {
        Instant now = clock.instant();
        List<RoutedEvent> forced = new ArrayList<>();
        buffers.forEach((aggregateId, buffer) -> {
            if (buffer.pending.isEmpty()
                    || Duration.between(buffer.lastProgress, now).compareTo(config.sequenceTimeout()) <= 0) {
                return;
            }
            long target = buffer.pending.firstKey();
            log.warn("[sequencer] Forcing sequence progression for {} from {} to {}",
                    aggregateId, buffer.nextSequence, target);
            skipped += target - buffer.nextSequence;
            buffer.nextSequence = target;
            int before = forced.size();
            buffer.releaseConsecutive(forced);
            buffer.lastProgress = now;
            released += forced.size() - before;
        });
        return forced;
    }

    public synchronized SequencerStats getStats() {
        Map<AggregateId, SequencerStats.AggregateStats> aggregates = new HashMap<>();
        buffers.forEach((id, buffer) -> aggregates.put(id, new SequencerStats.AggregateStats(
                buffer.nextSequence,
                buffer.pending.size(),
                buffer.pending.isEmpty() ? null : buffer.pending.firstKey())));
        return new SequencerStats(aggregates, released, duplicates, skipped);
    }

    private static final class AggregateBuffer {
        private long nextSequence = 1;
        private final TreeMap<Long, RoutedEvent> pending = new TreeMap<>();
        private Instant lastProgress;

        private AggregateBuffer(Instant createdAt) {
            this.lastProgress = createdAt;
        }

        private void releaseConsecutive(List<RoutedEvent> sink) {
            RoutedEvent next;
            while ((next = pending.remove(nextSequence)) != null) {
                sink.add(next);
                nextSequence++;
            }
        }
    }
}
