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


package org.fireflyframework.eventbridge.unit.core;

import org.fireflyframework.eventbridge.core.model.AggregateId;
import org.fireflyframework.eventbridge.core.store.InMemoryEventStore;
import org.fireflyframework.eventbridge.event.GraphEvent;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryEventStoreTest {

    private final InMemoryEventStore store = new InMemoryEventStore();

    @Test
    void readsBackPerAggregateInAppendOrder() {
        var a = AggregateId.random();
        var b = AggregateId.random();
        var renamed = new GraphEvent.GraphRenamed(a, "old", "new");
        var tagged = new GraphEvent.GraphTagged(a, "draft");

        StepVerifier.create(store.appendAll(List.of(renamed, new GraphEvent.GraphDeleted(b), tagged)))
                .verifyComplete();

        StepVerifier.create(store.read(a)).expectNext(renamed, tagged).verifyComplete();
        StepVerifier.create(store.read(AggregateId.random())).verifyComplete();
        assertThat(store.count()).isEqualTo(3);
    }

    @Test
    void clearDropsEverything() {
        store.append(new GraphEvent.GraphDeleted(AggregateId.random())).block();

        store.clear();

        assertThat(store.count()).isZero();
        StepVerifier.create(store.isHealthy()).expectNext(true).verifyComplete();
    }
}
