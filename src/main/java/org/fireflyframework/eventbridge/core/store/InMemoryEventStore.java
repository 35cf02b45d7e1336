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


package org.fireflyframework.eventbridge.core.store;

import org.fireflyframework.eventbridge.core.model.AggregateId;
import org.fireflyframework.eventbridge.event.DomainEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryEventStore implements EventStore {
    private final ConcurrentHashMap<AggregateId, List<DomainEvent>> streams = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> append(DomainEvent event) {
        return Mono.fromRunnable(() ->
                streams.computeIfAbsent(event.aggregateId(), id -> new CopyOnWriteArrayList<>()).add(event));
    }

    @Override
    public Flux<DomainEvent> read(AggregateId aggregateId) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(streams.getOrDefault(aggregateId, List.of()))));
    }

    public long count() {
        return streams.values().stream().mapToLong(List::size).sum();
    }

    public void clear() { streams.clear(); }
}
