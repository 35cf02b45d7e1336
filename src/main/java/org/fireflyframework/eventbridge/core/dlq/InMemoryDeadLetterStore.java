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


package org.fireflyframework.eventbridge.core.dlq;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded in-memory store. Once {@code maxEntries} entries are held, saving a new entry evicts the
 * one with the lowest global sequence. Updates to an existing entry never evict.
 */
@Slf4j
public class InMemoryDeadLetterStore implements DeadLetterStore {
    public static final int DEFAULT_MAX_ENTRIES = 10_000;

    private final ConcurrentHashMap<String, DeadLetterEntry> store = new ConcurrentHashMap<>();
    private final int maxEntries;

    public InMemoryDeadLetterStore() {
        this(DEFAULT_MAX_ENTRIES);
    }

    public InMemoryDeadLetterStore(int maxEntries) {
        if (maxEntries < 1) throw new IllegalArgumentException("maxEntries must be >= 1");
        this.maxEntries = maxEntries;
    }

    @Override
    public Mono<Void> save(DeadLetterEntry entry) {
        return Mono.fromRunnable(() -> put(entry));
    }

    @Override
    public Mono<Optional<DeadLetterEntry>> findById(String id) {
        return Mono.fromCallable(() -> Optional.ofNullable(store.get(id)));
    }

    @Override
    public Flux<DeadLetterEntry> findAll() {
        return Flux.defer(() -> Flux.fromIterable(snapshot()));
    }

    @Override
    public Flux<DeadLetterEntry> findByPattern(String pattern) {
        return findAll().filter(e -> e.pattern().equals(pattern));
    }

    @Override
    public Flux<DeadLetterEntry> findBySubject(String subject) {
        return findAll().filter(e -> e.subject().equals(subject));
    }

    @Override
    public Mono<Void> delete(String id) {
        return Mono.fromRunnable(() -> store.remove(id));
    }

    @Override
    public Mono<Long> count() {
        return Mono.fromCallable(() -> (long) store.size());
    }

    public void clear() { store.clear(); }

    public int getMaxEntries() { return maxEntries; }

    private synchronized void put(DeadLetterEntry entry) {
        if (!store.containsKey(entry.id()) && store.size() >= maxEntries) {
            store.values().stream()
                    .min(Comparator.comparingLong(e -> e.routedEvent().globalSequence()))
                    .ifPresent(oldest -> {
                        store.remove(oldest.id());
                        log.warn("[dlq] Store full ({} entries), evicted {} (global #{}) for '{}'",
                                maxEntries, oldest.subject(), oldest.routedEvent().globalSequence(), oldest.pattern());
                    });
        }
        store.put(entry.id(), entry);
    }

    // oldest global sequence first
    private List<DeadLetterEntry> snapshot() {
        return store.values().stream()
                .sorted(Comparator.comparingLong(e -> e.routedEvent().globalSequence()))
                .toList();
    }
}
