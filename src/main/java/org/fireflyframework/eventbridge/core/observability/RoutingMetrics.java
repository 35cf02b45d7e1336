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


package org.fireflyframework.eventbridge.core.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.concurrent.ConcurrentHashMap;

public class RoutingMetrics implements RoutingEvents {
    public static final String PREFIX = "firefly.eventbridge";
    private final MeterRegistry registry;
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();

    public RoutingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onSubjectRegistered(String pattern, int subscribers) {
        counter("subjects.registered", "pattern", pattern).increment();
    }

    @Override
    public void onRouted(String subject, String eventType, long globalSequence, int deliveries) {
        counter("events.routed", "eventType", eventType).increment();
    }

    @Override
    public void onDelivered(String pattern, String subject) {
        counter("events.delivered", "pattern", pattern).increment();
    }

    @Override
    public void onDropped(String pattern, String subject, String reason) {
        counter("events.dropped", "pattern", pattern, "reason", reason).increment();
    }

    @Override
    public void onNoSubscribers(String subject, String eventType) {
        counter("events.unrouted", "eventType", eventType).increment();
    }

    @Override
    public void onDeadLettered(String pattern, String subject, String reason) {
        counter("dlq.entries", "pattern", pattern).increment();
    }

    @Override
    public void onRedelivered(String pattern, String subject, int retryCount, boolean success) {
        counter("dlq.redeliveries", "pattern", pattern, "success", String.valueOf(success)).increment();
    }

    @Override
    public void onCommandHandled(String aggregateId, String commandType, int eventCount) {
        counter("commands.handled", "command", commandType, "success", "true").increment();
        counter("events.emitted", "command", commandType).increment(eventCount);
    }

    @Override
    public void onCommandRejected(String aggregateId, String commandType, Throwable error) {
        counter("commands.handled", "command", commandType, "success", "false").increment();
    }

    @Override
    public void onCommandUnrouted(String aggregateId, String commandType, int persistedEvents, Throwable error) {
        counter("commands.unrouted", "command", commandType).increment();
        counter("events.emitted", "command", commandType).increment(persistedEvents);
    }

    private Counter counter(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return counters.computeIfAbsent(key, k -> Counter.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }
}
