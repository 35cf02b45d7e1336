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

/**
 * Durability boundary for domain events. Implementations keep the events of one aggregate in
 * append order.
 */
public interface EventStore {

    Mono<Void> append(DomainEvent event);

    /**
     * Appends events one after another, stopping at the first failure.
     */
    default Mono<Void> appendAll(List<? extends DomainEvent> events) {
        return Flux.fromIterable(events).concatMap(this::append).then();
    }

    /**
     * Events of one aggregate in append order; empty for an unknown aggregate.
     */
    Flux<DomainEvent> read(AggregateId aggregateId);

    default Mono<Boolean> isHealthy() {
        return Mono.just(true);
    }
}
