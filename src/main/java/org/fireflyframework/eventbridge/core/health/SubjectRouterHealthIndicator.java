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


package org.fireflyframework.eventbridge.core.health;

import org.fireflyframework.eventbridge.routing.ChannelStats;
import org.fireflyframework.eventbridge.routing.SubjectRouter;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Reports DOWN while any subject channel is at capacity, since further events to it are dropped.
 */
public class SubjectRouterHealthIndicator implements ReactiveHealthIndicator {

    private final SubjectRouter router;

    public SubjectRouterHealthIndicator(SubjectRouter router) {
        this.router = router;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(router::getStats)
                .map(stats -> {
                    List<String> saturated = stats.entrySet().stream()
                            .filter(e -> e.getValue().isFull())
                            .map(Map.Entry::getKey)
                            .sorted()
                            .toList();
                    long dropped = stats.values().stream().mapToLong(ChannelStats::dropped).sum();
                    Health.Builder builder = saturated.isEmpty() ? Health.up() : Health.down().withDetail("saturated", saturated);
                    return builder.withDetail("channels", stats.size()).withDetail("dropped", dropped).build();
                })
                .onErrorResume(e -> Mono.just(Health.down().withException(e).build()));
    }
}
