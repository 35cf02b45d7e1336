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

import java.time.Duration;
import java.util.Objects;

/**
 * @param maxBufferSize   out-of-order events held per aggregate
 * @param maxSequenceGap  largest distance ahead of the expected sequence that is still buffered
 * @param sequenceTimeout how long an aggregate may wait for a missing sequence before it is skipped
 */
public record SequencerConfig(int maxBufferSize, long maxSequenceGap, Duration sequenceTimeout) {

    public SequencerConfig {
        Objects.requireNonNull(sequenceTimeout, "sequenceTimeout must not be null");
        if (maxBufferSize < 1) throw new IllegalArgumentException("maxBufferSize must be >= 1");
        if (maxSequenceGap < 1) throw new IllegalArgumentException("maxSequenceGap must be >= 1");
        if (sequenceTimeout.isNegative()) throw new IllegalArgumentException("sequenceTimeout must not be negative");
    }

    public static SequencerConfig defaults() {
        return new SequencerConfig(1000, 100, Duration.ofSeconds(30));
    }
}
