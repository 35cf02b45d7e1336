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

package org.fireflyframework.eventbridge.core.exception;

/**
 * A command's events were appended to the event store but routing them failed. The command
 * took effect: retrying it would be rejected or duplicate its events. Consumers catch up by
 * re-routing the stored history from {@link #getVersion()} minus {@link #getPersistedEvents()}.
 */
public final class UnroutedEventsException extends EventBridgeException {
    private final int persistedEvents;
    private final long version;

    public UnroutedEventsException(String aggregateId, int persistedEvents, long version, Throwable cause) {
        super(persistedEvents + " event(s) of workflow " + aggregateId + " persisted at version " + version
                + " but not routed: " + cause.getMessage(), "EVENTBRIDGE_UNROUTED_EVENTS", cause);
        this.persistedEvents = persistedEvents;
        this.version = version;
    }

    public int getPersistedEvents() {
        return persistedEvents;
    }

    public long getVersion() {
        return version;
    }
}
