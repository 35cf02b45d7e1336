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

import org.fireflyframework.eventbridge.core.model.AggregateId;

import java.util.Map;

/**
 * Point-in-time view of an {@link EventSequencer}.
 *
 * @param released   events handed out in order since creation
 * @param duplicates events discarded because their sequence was already released or buffered
 * @param skipped    missing sequences given up on by {@link EventSequencer#checkTimeouts()}
 */
public record SequencerStats(Map<AggregateId, AggregateStats> aggregates, long released, long duplicates, long skipped) {

    public SequencerStats {
        aggregates = Map.copyOf(aggregates);
    }

    /**
     * @param oldestPending lowest buffered sequence, {@code null} when nothing is buffered
     */
    public record AggregateStats(long nextSequence, int pendingCount, Long oldestPending) {}
}
