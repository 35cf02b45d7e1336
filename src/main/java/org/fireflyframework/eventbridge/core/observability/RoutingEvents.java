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

/**
 * Callbacks for everything the event bridge does. All methods are no-ops by default.
 */
public interface RoutingEvents {
    // Registry
    default void onSubjectRegistered(String pattern, int subscribers) {}
    default void onSubjectDeregistered(String pattern) {}

    // Routing
    default void onRouted(String subject, String eventType, long globalSequence, int deliveries) {}
    default void onDelivered(String pattern, String subject) {}
    default void onDropped(String pattern, String subject, String reason) {}
    default void onNoSubscribers(String subject, String eventType) {}

    // DLQ
    default void onDeadLettered(String pattern, String subject, String reason) {}
    default void onRedelivered(String pattern, String subject, int retryCount, boolean success) {}

    // Commands
    default void onCommandHandled(String aggregateId, String commandType, int eventCount) {}
    default void onCommandRejected(String aggregateId, String commandType, Throwable error) {}
    default void onCommandUnrouted(String aggregateId, String commandType, int persistedEvents, Throwable error) {}
}
