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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.eventbridge.core.dlq.DeadLetterEntry;
import org.fireflyframework.eventbridge.core.dlq.DeadLetterService;
import org.fireflyframework.eventbridge.core.exception.RoutingException;
import org.fireflyframework.eventbridge.core.model.EventEnvelope;
import org.fireflyframework.eventbridge.core.model.MessageMetadata;
import org.fireflyframework.eventbridge.core.observability.RoutingEvents;
import org.fireflyframework.eventbridge.event.DomainEvent;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Routes domain events to every registered subject pattern that matches the event's subject.
 *
 * <p>The pattern registry is guarded by a read/write lock: routing takes the read lock,
 * registration and deregistration take the write lock. A lock that cannot be acquired within
 * {@link RouterConfig#lockTimeout()} fails the operation with a {@link RoutingException} and
 * leaves the registry untouched.
 *
 * <p>Delivery is fire-and-forget per channel. Sends never block; a full channel or a channel
 * without live receivers drops the event, counts it and, when the dead-letter queue is enabled,
 * stores it for {@link #redeliver(DeadLetterEntry)}. One slow consumer never stalls routing to others.
 */
@Slf4j
public class SubjectRouter {

    private final RouterConfig config;
    private final SequenceTracker sequences;
    private final RoutingEvents events;
    private final DeadLetterService deadLetters;
    private final Clock clock;
    private final ReadWriteLock registryLock = new ReentrantReadWriteLock();
    private final Map<String, SubjectChannel> channels = new LinkedHashMap<>();

    public SubjectRouter(RouterConfig config) {
        this(config, new SequenceTracker(config.lockTimeout()), new RoutingEvents() {}, null, Clock.systemUTC());
    }

    /**
     * @param deadLetters dead-letter service, required when {@link RouterConfig#enableDlq()} is set
     */
    public SubjectRouter(RouterConfig config, SequenceTracker sequences, RoutingEvents events,
                         DeadLetterService deadLetters, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.sequences = Objects.requireNonNull(sequences, "sequences must not be null");
        this.events = Objects.requireNonNull(events, "events must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (config.enableDlq() && deadLetters == null) {
            throw new IllegalArgumentException("Dead-letter queue is enabled but no DeadLetterService was given");
        }
        this.deadLetters = config.enableDlq() ? deadLetters : null;
    }

    /**
     * Subscribes to a subject pattern. Registering a pattern again adds a receiver to the
     * existing channel rather than creating a new one.
     *
     * @throws RoutingException the pattern is malformed or the registry lock was not acquired
     */
    public SubjectReceiver registerSubject(String pattern) {
        SubjectMatcher.validatePattern(pattern);
        Lock lock = acquire(registryLock.writeLock(), "register '" + pattern + "'");
        SubjectChannel channel;
        int subscribers;
        try {
            channel = channels.computeIfAbsent(pattern, p -> new SubjectChannel(p, config.channelCapacity()));
            subscribers = channel.addSubscriber();
        } finally {
            lock.unlock();
        }
        events.onSubjectRegistered(pattern, subscribers);
        return new SubjectReceiver(channel);
    }

    /**
     * Removes a pattern and its channel. Events still queued in it are discarded with it.
     *
     * @return whether the pattern was registered
     */
    public boolean deregisterSubject(String pattern) {
        Lock lock = acquire(registryLock.writeLock(), "deregister '" + pattern + "'");
        SubjectChannel removed;
        try {
            removed = channels.remove(pattern);
        } finally {
            lock.unlock();
        }
        if (removed != null) {
            events.onSubjectDeregistered(pattern);
        }
        return removed != null;
    }

    public List<String> routeEvent(DomainEvent event) {
        return routeEvent(event, MessageMetadata.root());
    }

    public List<String> route(EventEnvelope envelope) {
        return routeEvent(envelope.event(), envelope.metadata());
    }

    /**
     * Stamps sequence numbers on an event and offers it to every matching channel.
     *
     * @return the patterns the event was delivered to; empty when nothing matched or every matching channel dropped it
     * @throws RoutingException a registry or sequence lock was not acquired; nothing was stamped or delivered
     */
    public List<String> routeEvent(DomainEvent event, MessageMetadata metadata) {
        Objects.requireNonNull(event, "event must not be null");
        String subject = SubjectMapper.subjectOf(event);
        Lock lock = acquire(registryLock.readLock(), "route '" + subject + "'");
        RoutedEvent routed;
        List<String> delivered = new ArrayList<>();
        boolean matched = false;
        try {
            SequenceStamp stamp = sequences.next(event.aggregateId());
            routed = new RoutedEvent(event, subject, stamp.globalSequence(), stamp.aggregateSequence(),
                    0, clock.instant(), metadata);
            for (SubjectChannel channel : channels.values()) {
                if (!SubjectMatcher.matches(subject, channel.pattern())) {
                    continue;
                }
                matched = true;
                SubjectChannel.SendResult result = channel.trySend(routed);
                if (result == SubjectChannel.SendResult.DELIVERED) {
                    delivered.add(channel.pattern());
                    events.onDelivered(channel.pattern(), subject);
                } else {
                    handleDrop(channel.pattern(), routed, result);
                }
            }
        } finally {
            lock.unlock();
        }
        if (!matched) {
            events.onNoSubscribers(subject, event.eventType());
        }
        events.onRouted(subject, event.eventType(), routed.globalSequence(), delivered.size());
        return delivered;
    }

    /**
     * Offers a dead letter to its pattern again with an incremented retry count. The entry is removed
     * on success and marked as retried on failure. Entries that already used
     * {@link RouterConfig#maxRetries()} attempts are not retried.
     *
     * @return whether the event was delivered
     */
    public Mono<Boolean> redeliver(DeadLetterEntry entry) {
        if (deadLetters == null) {
            return Mono.error(new RoutingException("Dead-letter queue is disabled"));
        }
        return deadLetters.redeliver(entry, config.maxRetries(), retried -> sendTo(entry.pattern(), retried));
    }

    /**
     * Snapshot of every channel's statistics keyed by pattern. Returns an empty map when the
     * registry lock cannot be acquired.
     */
    public Map<String, ChannelStats> getStats() {
        Lock lock;
        try {
            lock = acquire(registryLock.readLock(), "read stats");
        } catch (RoutingException e) {
            log.warn("[subject-router] Statistics unavailable: {}", e.getMessage());
            return Map.of();
        }
        try {
            Map<String, ChannelStats> stats = new LinkedHashMap<>();
            channels.forEach((pattern, channel) -> stats.put(pattern, channel.stats()));
            return Collections.unmodifiableMap(stats);
        } finally {
            lock.unlock();
        }
    }

    public Set<String> getPatterns() {
        return getStats().keySet();
    }

    public long currentGlobalSequence() {
        return sequences.currentGlobal();
    }

    public RouterConfig getConfig() {
        return config;
    }

    private boolean sendTo(String pattern, RoutedEvent routed) {
        Lock lock = acquire(registryLock.readLock(), "redeliver to '" + pattern + "'");
        try {
            SubjectChannel channel = channels.get(pattern);
            if (channel == null) {
                return false;
            }
            SubjectChannel.SendResult result = channel.trySend(routed);
            if (result != SubjectChannel.SendResult.DELIVERED) {
                events.onDropped(pattern, routed.subject(), reasonOf(result));
                return false;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void handleDrop(String pattern, RoutedEvent routed, SubjectChannel.SendResult result) {
        String reason = reasonOf(result);
        events.onDropped(pattern, routed.subject(), reason);
        if (deadLetters != null) {
            deadLetters.deadLetter(DeadLetterEntry.create(pattern, routed, reason))
                    .subscribe(v -> {},
                            err -> log.warn("[dlq] Failed to store dead letter for '{}'", pattern, err));
        }
    }

    private static String reasonOf(SubjectChannel.SendResult result) {
        return result == SubjectChannel.SendResult.FULL ? SubjectChannel.FULL_ERROR : SubjectChannel.NO_RECEIVERS_ERROR;
    }

    private Lock acquire(Lock lock, String operation) {
        try {
            if (!lock.tryLock(config.lockTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                throw new RoutingException("Timed out after " + config.lockTimeout().toMillis()
                        + "ms acquiring subject registry lock to " + operation);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RoutingException("Interrupted while acquiring subject registry lock to " + operation, e);
        }
        return lock;
    }
}
