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
import org.fireflyframework.eventbridge.core.observability.RoutingEvents;
import org.fireflyframework.eventbridge.routing.RoutedEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * Keeps events a channel could not accept and drives their redelivery. An entry is removed once
 * it is delivered and counts a retry every time it is not; after {@code maxRetries} failed
 * attempts it stays in the store as exhausted until {@link #purgeExhausted(int)} removes it.
 */
@Slf4j
public class DeadLetterService {
    private final DeadLetterStore store;
    private final RoutingEvents events;

    public DeadLetterService(DeadLetterStore store, RoutingEvents events) {
        this.store = store;
        this.events = events;
    }

    public Mono<Void> deadLetter(DeadLetterEntry entry) {
        return store.save(entry)
                .doOnSuccess(v -> events.onDeadLettered(entry.pattern(), entry.subject(), entry.errorMessage()));
    }

    /**
     * Offers the entry's event, with its retry count incremented, to {@code sender}.
     *
     * @param sender returns whether the event was accepted by its channel
     * @return whether the event was delivered; {@code false} without an attempt when the entry is exhausted
     */
    public Mono<Boolean> redeliver(DeadLetterEntry entry, int maxRetries, Predicate<RoutedEvent> sender) {
        if (isExhausted(entry, maxRetries)) {
            log.warn("[dlq] Giving up on {} for '{}' after {} retries", entry.subject(), entry.pattern(), entry.retryCount());
            return Mono.just(false);
        }
        return Mono.defer(() -> {
            RoutedEvent retried = entry.routedEvent().withRetry();
            boolean sent = sender.test(retried);
            events.onRedelivered(entry.pattern(), entry.subject(), retried.retryCount(), sent);
            if (sent) {
                return store.delete(entry.id()).thenReturn(true);
            }
            return markRetried(entry.id())
                    .doOnNext(updated -> {
                        if (isExhausted(updated, maxRetries)) {
                            log.warn("[dlq] {} for '{}' exhausted {} retries", updated.subject(), updated.pattern(), maxRetries);
                        }
                    })
                    .thenReturn(false);
        });
    }

    public Flux<DeadLetterEntry> getExhausted(int maxRetries) {
        return store.findAll().filter(entry -> isExhausted(entry, maxRetries));
    }

    /**
     * Deletes every entry that used up its retries.
     *
     * @return number of entries removed
     */
    public Mono<Long> purgeExhausted(int maxRetries) {
        return getExhausted(maxRetries)
                .concatMap(entry -> store.delete(entry.id()).thenReturn(entry))
                .count()
                .doOnNext(purged -> {
                    if (purged > 0) {
                        log.info("[dlq] Purged {} exhausted entries", purged);
                    }
                });
    }

    public Flux<DeadLetterEntry> getAllEntries() { return store.findAll(); }
    public Mono<Optional<DeadLetterEntry>> getEntry(String id) { return store.findById(id); }
    public Flux<DeadLetterEntry> getByPattern(String pattern) { return store.findByPattern(pattern); }
    public Flux<DeadLetterEntry> getBySubject(String subject) { return store.findBySubject(subject); }
    public Mono<Void> deleteEntry(String id) { return store.delete(id); }
    public Mono<Long> count() { return store.count(); }

    public Mono<DeadLetterEntry> markRetried(String id) {
        return store.findById(id)
                .flatMap(opt -> {
                    if (opt.isEmpty()) return Mono.empty();
                    var updated = opt.get().withRetry();
                    return store.save(updated).thenReturn(updated);
                });
    }

    private static boolean isExhausted(DeadLetterEntry entry, int maxRetries) {
        return entry.retryCount() >= maxRetries;
    }
}
