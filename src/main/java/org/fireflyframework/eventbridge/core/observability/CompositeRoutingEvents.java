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

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Consumer;

@Slf4j
public class CompositeRoutingEvents implements RoutingEvents {
    private final List<RoutingEvents> delegates;

    public CompositeRoutingEvents(List<RoutingEvents> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    private void safeForEach(Consumer<RoutingEvents> action) {
        for (var d : delegates) {
            try { action.accept(d); }
            catch (Exception e) { log.warn("[composite-events] Delegate {} failed: {}", d.getClass().getSimpleName(), e.getMessage()); }
        }
    }

    @Override public void onSubjectRegistered(String pattern, int subscribers) { safeForEach(d -> d.onSubjectRegistered(pattern, subscribers)); }
    @Override public void onSubjectDeregistered(String pattern) { safeForEach(d -> d.onSubjectDeregistered(pattern)); }
    @Override public void onRouted(String subject, String eventType, long globalSequence, int deliveries) { safeForEach(d -> d.onRouted(subject, eventType, globalSequence, deliveries)); }
    @Override public void onDelivered(String pattern, String subject) { safeForEach(d -> d.onDelivered(pattern, subject)); }
    @Override public void onDropped(String pattern, String subject, String reason) { safeForEach(d -> d.onDropped(pattern, subject, reason)); }
    @Override public void onNoSubscribers(String subject, String eventType) { safeForEach(d -> d.onNoSubscribers(subject, eventType)); }
    @Override public void onDeadLettered(String pattern, String subject, String reason) { safeForEach(d -> d.onDeadLettered(pattern, subject, reason)); }
    @Override public void onRedelivered(String pattern, String subject, int retryCount, boolean success) { safeForEach(d -> d.onRedelivered(pattern, subject, retryCount, success)); }
    @Override public void onCommandHandled(String aggregateId, String commandType, int eventCount) { safeForEach(d -> d.onCommandHandled(aggregateId, commandType, eventCount)); }
    @Override public void onCommandRejected(String aggregateId, String commandType, Throwable error) { safeForEach(d -> d.onCommandRejected(aggregateId, commandType, error)); }
    @Override public void onCommandUnrouted(String aggregateId, String commandType, int persistedEvents, Throwable error) { safeForEach(d -> d.onCommandUnrouted(aggregateId, commandType, persistedEvents, error)); }
}
