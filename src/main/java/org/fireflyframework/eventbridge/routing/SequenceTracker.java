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


package org.fireflyframework.eventbridge.routing;

import org.fireflyframework.eventbridge.core.exception.RoutingException;
import org.fireflyframework.eventbridge.core.exception.SequenceOverflowException;
import org.fireflyframework.eventbridge.core.model.AggregateId;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hands out a global sequence shared by all aggregates and a sequence per aggregate.
 *
 * <p>Both counters start at zero, so the first stamp is {@code 1}. They are incremented together
 * under one lock: global order and per-aggregate order always agree. Overflow raises
 * {@link SequenceOverflowException} instead of wrapping.
 */
public class SequenceTracker {

    private final ReentrantLock lock = new ReentrantLock();
    private final Duration lockTimeout;
    private final Map<AggregateId, Long> aggregateSequences = new HashMap<>();
    private long globalSequence;

    public SequenceTracker(Duration lockTimeout) {
        this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout must not be null");
    }

    /**
     * Stamps the next global sequence and the next sequence of {@code aggregateId}.
     *
     * @throws RoutingException           the counter lock was not acquired within the lock timeout
     * @throws SequenceOverflowException a counter reached {@link Long#MAX_VALUE}
     */
    public SequenceStamp next(AggregateId aggregateId) {
        Objects.requireNonNull(aggregateId, "aggregateId must not be null");
        acquire();
        try {
            long nextGlobal = increment(globalSequence, "global");
            long nextAggregate = increment(aggregateSequences.getOrDefault(aggregateId, 0L), aggregateId.toString());
            globalSequence = nextGlobal;
            aggregateSequences.put(aggregateId, nextAggregate);
            return new SequenceStamp(nextGlobal, nextAggregate);
        } finally {
            lock.unlock();
        }
    }

    public long currentGlobal() {
        acquire();
        try {
            return globalSequence;
        } finally {
            lock.unlock();
        }
    }

    public long currentFor(AggregateId aggregateId) {
        acquire();
        try {
            return aggregateSequences.getOrDefault(aggregateId, 0L);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Continues counting from previously issued values, e.g. after rebuilding a router from a
     * stored event stream. Counters never move backwards.
     */
    public void restore(long global, Map<AggregateId, Long> perAggregate) {
        acquire();
        try {
            globalSequence = Math.max(globalSequence, global);
            perAggregate.forEach((id, value) -> aggregateSequences.merge(id, value, Math::max));
        } finally {
            lock.unlock();
        }
    }

    private static long increment(long current, String counter) {
        try {
            return Math.addExact(current, 1L);
        } catch (ArithmeticException e) {
            throw new SequenceOverflowException(counter, e);
        }
    }

    private void acquire() {
        try {
            if (!lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new RoutingException("Timed out after " + lockTimeout.toMillis() + "ms acquiring sequence lock");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RoutingException("Interrupted while acquiring sequence lock", e);
        }
    }
}
