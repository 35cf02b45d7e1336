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

@Slf4j
public class RoutingLoggerEvents implements RoutingEvents {
    @Override
    public void onSubjectRegistered(String pattern, int subscribers) {
        log.info("[subject-router] subject.registered pattern={} subscribers={}", pattern, subscribers);
    }
    @Override
    public void onSubjectDeregistered(String pattern) {
        log.info("[subject-router] subject.deregistered pattern={}", pattern);
    }
    @Override
    public void onRouted(String subject, String eventType, long globalSequence, int deliveries) {
        log.debug("[subject-router] routed subject={} eventType={} globalSequence={} deliveries={}", subject, eventType, globalSequence, deliveries);
    }
    @Override
    public void onDropped(String pattern, String subject, String reason) {
        log.warn("[subject-router] dropped pattern={} subject={} reason={}", pattern, subject, reason);
    }
    @Override
    public void onNoSubscribers(String subject, String eventType) {
        log.debug("[subject-router] no.subscribers subject={} eventType={}", subject, eventType);
    }
    @Override
    public void onDeadLettered(String pattern, String subject, String reason) {
        log.error("[dlq] dead-lettered pattern={} subject={} reason={}", pattern, subject, reason);
    }
    @Override
    public void onRedelivered(String pattern, String subject, int retryCount, boolean success) {
        log.info("[dlq] redelivered pattern={} subject={} retryCount={} success={}", pattern, subject, retryCount, success);
    }
    @Override
    public void onCommandHandled(String aggregateId, String commandType, int eventCount) {
        log.info("[workflow] command.handled aggregateId={} command={} events={}", aggregateId, commandType, eventCount);
    }
    @Override
    public void onCommandRejected(String aggregateId, String commandType, Throwable error) {
        log.warn("[workflow] command.rejected aggregateId={} command={} error={}", aggregateId, commandType, error.getMessage());
    }
    @Override
    public void onCommandUnrouted(String aggregateId, String commandType, int persistedEvents, Throwable error) {
        log.error("[workflow] command.unrouted aggregateId={} command={} persistedEvents={} error={}", aggregateId, commandType, persistedEvents, error.getMessage());
    }
}
