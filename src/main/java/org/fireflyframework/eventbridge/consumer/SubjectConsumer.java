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


package org.fireflyframework.eventbridge.consumer;

import org.fireflyframework.eventbridge.routing.RoutedEvent;
import org.fireflyframework.eventbridge.routing.SubjectReceiver;
import org.fireflyframework.eventbridge.routing.SubjectRouter;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Client-side handle over one receiver per subscribed pattern.
 *
 * <p>Channels of different patterns are independent, so arrival order across them says nothing.
 * {@link #pollEvents()} restores a single order by sorting each drained batch on
 * {@link RoutedEvent#globalSequence()}. An event matching several subscribed patterns is
 * delivered once per pattern.
 */
public class SubjectConsumer implements AutoCloseable {

    private static final Comparator<RoutedEvent> BY_GLOBAL_SEQUENCE =
            Comparator.comparingLong(RoutedEvent::globalSequence);

    private final List<SubjectReceiver> receivers;

    public SubjectConsumer(List<SubjectReceiver> receivers) {
        this.receivers = List.copyOf(receivers);
    }

    /**
     * Registers every pattern on the router and wraps the receivers.
     */
    public static SubjectConsumer subscribe(SubjectRouter router, String... patterns) {
        List<SubjectReceiver> receivers = new ArrayList<>();
        try {
            for (String pattern : patterns) {
                receivers.add(router.registerSubject(pattern));
            }
        } catch (RuntimeException e) {
            receivers.forEach(SubjectReceiver::close);
            throw e;
        }
        return new SubjectConsumer(receivers);
    }

    /**
     * Drains every receiver without blocking and returns the batch ordered by global sequence.
     */
    public List<RoutedEvent> pollEvents() {
        List<RoutedEvent> batch = new ArrayList<>();
        for (SubjectReceiver receiver : receivers) {
            batch.addAll(receiver.drain());
        }
        batch.sort(BY_GLOBAL_SEQUENCE);
        return batch;
    }

    /**
     * Polls every {@code interval} and emits each batch in order. The stream never completes on its own.
     */
    public Flux<RoutedEvent> stream(Duration interval) {
        return Flux.interval(interval)
                .onBackpressureDrop()
                .concatMapIterable(tick -> pollEvents());
    }

    public List<String> getPatterns() {
        return receivers.stream().map(SubjectReceiver::pattern).toList();
    }

    @Override
    public void close() {
        receivers.forEach(SubjectReceiver::close);
    }
}
