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

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Router-owned bounded channel behind one registered subject pattern. All receivers of the
 * pattern share the channel. Producers never block: a send either lands or is counted as dropped.
 */
final class SubjectChannel {

    enum SendResult { DELIVERED, FULL, NO_RECEIVERS }

    static final String FULL_ERROR = "channel full";
    static final String NO_RECEIVERS_ERROR = "no live receivers";

    private final String pattern;
    private final int capacity;
    private final BlockingQueue<RoutedEvent> queue;
    private final AtomicInteger subscribers = new AtomicInteger();
    private final AtomicLong sent = new AtomicLong();
    private final AtomicLong received = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicReference<String> lastError = new AtomicReference<>();

    SubjectChannel(String pattern, int capacity) {
        this.pattern = pattern;
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    String pattern() {
        return pattern;
    }

    SendResult trySend(RoutedEvent event) {
        if (subscribers.get() == 0) {
            recordDrop(NO_RECEIVERS_ERROR);
            return SendResult.NO_RECEIVERS;
        }
        if (!queue.offer(event)) {
            recordDrop(FULL_ERROR);
            return SendResult.FULL;
        }
        sent.incrementAndGet();
        return SendResult.DELIVERED;
    }

    RoutedEvent poll() {
        RoutedEvent event = queue.poll();
        if (event != null) {
            received.incrementAndGet();
        }
        return event;
    }

    RoutedEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        RoutedEvent event = queue.poll(timeout, unit);
        if (event != null) {
            received.incrementAndGet();
        }
        return event;
    }

    int drainTo(List<RoutedEvent> sink) {
        int count = queue.drainTo(sink);
        received.addAndGet(count);
        return count;
    }

    int addSubscriber() {
        return subscribers.incrementAndGet();
    }

    int removeSubscriber() {
        return subscribers.updateAndGet(n -> Math.max(0, n - 1));
    }

    ChannelStats stats() {
        return new ChannelStats(sent.get(), received.get(), dropped.get(), lastError.get(),
                subscribers.get(), queue.size(), capacity);
    }

    private void recordDrop(String reason) {
        dropped.incrementAndGet();
        lastError.set(reason);
    }
}
