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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Receiving handle for a registered subject pattern. Receivers of the same pattern share one
 * channel, so each routed event is taken by exactly one of them.
 *
 * <p>Closing the receiver releases its subscription; once a pattern has no open receivers,
 * events routed to it are counted as dropped.
 */
public final class SubjectReceiver implements AutoCloseable {

    private final SubjectChannel channel;
    private final AtomicBoolean closed = new AtomicBoolean();

    SubjectReceiver(SubjectChannel channel) {
        this.channel = channel;
    }

    public String pattern() {
        return channel.pattern();
    }

    /**
     * Takes the next available event without blocking.
     */
    public Optional<RoutedEvent> tryReceive() {
        ensureOpen();
        return Optional.ofNullable(channel.poll());
    }

    /**
     * Waits up to {@code timeout} for the next event.
     */
    public Optional<RoutedEvent> receive(Duration timeout) throws InterruptedException {
        ensureOpen();
        return Optional.ofNullable(channel.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
    }

    /**
     * Takes every currently available event without blocking, in channel order.
     */
    public List<RoutedEvent> drain() {
        ensureOpen();
        List<RoutedEvent> batch = new ArrayList<>();
        channel.drainTo(batch);
        return batch;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            channel.removeSubscriber();
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Receiver for '" + channel.pattern() + "' is closed");
        }
    }
}
