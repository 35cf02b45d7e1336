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

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of a {@link SubjectRouter}.
 *
 * @param channelCapacity capacity of every subject channel
 * @param lockTimeout     how long to wait for the registry or sequence lock before failing
 * @param enableDlq       whether undeliverable events are stored as dead letters
 * @param maxRetries      redelivery attempts of a dead letter before giving up
 */
public record RouterConfig(
        int channelCapacity,
        Duration lockTimeout,
        boolean enableDlq,
        int maxRetries
) {
    public static final int DEFAULT_CHANNEL_CAPACITY = 10_000;

    public RouterConfig {
        Objects.requireNonNull(lockTimeout, "lockTimeout must not be null");
        if (channelCapacity < 1) throw new IllegalArgumentException("channelCapacity must be >= 1");
        if (lockTimeout.isNegative()) throw new IllegalArgumentException("lockTimeout must not be negative");
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
    }

    public static RouterConfig defaults() {
        return new RouterConfig(DEFAULT_CHANNEL_CAPACITY, Duration.ofSeconds(5), false, 3);
    }

    public RouterConfig withChannelCapacity(int capacity) {
        return new RouterConfig(capacity, lockTimeout, enableDlq, maxRetries);
    }

    public RouterConfig withDlq(int retries) {
        return new RouterConfig(channelCapacity, lockTimeout, true, retries);
    }
}
