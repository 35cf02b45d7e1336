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


package org.fireflyframework.eventbridge.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry policy attached to a workflow step.
 *
 * @param maxAttempts       total attempts including the first one
 * @param backoff           delay before the first retry
 * @param backoffMultiplier factor applied to the delay after every retry
 */
public record RetryPolicy(
        int maxAttempts,
        Duration backoff,
        double backoffMultiplier
) {
    public static final RetryPolicy NO_RETRY = new RetryPolicy(1, Duration.ZERO, 1.0);

    public RetryPolicy {
        Objects.requireNonNull(backoff, "backoff must not be null");
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (backoff.isNegative()) throw new IllegalArgumentException("backoff must not be negative");
        if (backoffMultiplier < 1.0) throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
    }

    public static RetryPolicy exponential(int maxAttempts, Duration backoff) {
        return new RetryPolicy(maxAttempts, backoff, 2.0);
    }

    /**
     * Delay before the given retry, where retry {@code 1} is the first re-attempt.
     */
    public Duration delayBeforeRetry(int retry) {
        if (retry <= 1) return backoff;
        double delayMs = backoff.toMillis() * Math.pow(backoffMultiplier, retry - 1);
        return Duration.ofMillis(delayMs >= Long.MAX_VALUE ? Long.MAX_VALUE : (long) delayMs);
    }

    public boolean shouldRetry(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }
}
