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


package org.fireflyframework.eventbridge.core.exception;

import org.fireflyframework.eventbridge.core.model.AggregateId;

/**
 * A consumer-side sequencer received an event too far ahead of the next expected sequence.
 */
public final class SequenceGapException extends EventBridgeException {
    private final AggregateId aggregateId;
    private final long expected;
    private final long received;

    public SequenceGapException(AggregateId aggregateId, long expected, long received, long maxGap) {
        super("Sequence gap too large for aggregate " + aggregateId + ": expected " + expected
                + ", received " + received + " (max gap " + maxGap + ")", "EVENTBRIDGE_SEQUENCE_GAP");
        this.aggregateId = aggregateId;
        this.expected = expected;
        this.received = received;
    }

    public AggregateId getAggregateId() { return aggregateId; }
    public long getExpected() { return expected; }
    public long getReceived() { return received; }
}
