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

import org.fireflyframework.eventbridge.core.health.SubjectRouterHealthIndicator;
import org.fireflyframework.eventbridge.core.model.AggregateId;
import org.fireflyframework.eventbridge.event.GraphEvent;
import org.fireflyframework.eventbridge.routing.RouterConfig;
import org.fireflyframework.eventbridge.routing.SubjectReceiver;
import org.fireflyframework.eventbridge.routing.SubjectRouter;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SubjectRouterHealthIndicatorTest {

    private final SubjectRouter router = new SubjectRouter(RouterConfig.defaults().withChannelCapacity(1));
    private final SubjectRouterHealthIndicator indicator = new SubjectRouterHealthIndicator(router);

    @Test
    void upWhileChannelsHaveRoom() {
        router.registerSubject("event.graph.>");

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails()).containsEntry("channels", 1).containsEntry("dropped", 0L);
                })
                .verifyComplete();
    }

    @Test
    void downWhenAChannelIsSaturated() {
        SubjectReceiver receiver = router.registerSubject("event.graph.>");
        router.routeEvent(new GraphEvent.GraphDeleted(AggregateId.random()));

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails()).containsEntry("saturated", List.of("event.graph.>"));
                })
                .verifyComplete();

        receiver.drain();
        StepVerifier.create(indicator.health())
                .assertNext(health -> assertThat(health.getStatus()).isEqualTo(Status.UP))
                .verifyComplete();
    }
}
