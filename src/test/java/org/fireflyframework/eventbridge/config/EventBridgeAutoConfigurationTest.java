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


package org.fireflyframework.eventbridge.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.eventbridge.consumer.SequencerConfig;
import org.fireflyframework.eventbridge.core.dlq.DeadLetterService;
import org.fireflyframework.eventbridge.core.dlq.DeadLetterStore;
import org.fireflyframework.eventbridge.core.dlq.InMemoryDeadLetterStore;
import org.fireflyframework.eventbridge.core.health.SubjectRouterHealthIndicator;
import org.fireflyframework.eventbridge.core.observability.CompositeRoutingEvents;
import org.fireflyframework.eventbridge.core.observability.RoutingEvents;
import org.fireflyframework.eventbridge.core.observability.RoutingLoggerEvents;
import org.fireflyframework.eventbridge.core.observability.SubjectRouterEndpoint;
import org.fireflyframework.eventbridge.core.serialization.EventSerializer;
import org.fireflyframework.eventbridge.core.store.EventStore;
import org.fireflyframework.eventbridge.core.store.InMemoryEventStore;
import org.fireflyframework.eventbridge.routing.SubjectRouter;
import org.fireflyframework.eventbridge.workflow.service.WorkflowService;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies the beans contributed by {@link EventBridgeAutoConfiguration} and
 * {@link EventBridgeEndpointAutoConfiguration} and how properties switch them.
 */
class EventBridgeAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    EventBridgeAutoConfiguration.class, EventBridgeEndpointAutoConfiguration.class));

    @Test
    void defaultsProvideTheFullStack() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(SubjectRouter.class);
            assertThat(context).hasSingleBean(WorkflowService.class);
            assertThat(context).hasSingleBean(EventStore.class);
            assertThat(context).hasSingleBean(EventSerializer.class);
            assertThat(context).hasSingleBean(SequencerConfig.class);
            assertThat(context).hasSingleBean(SubjectRouterEndpoint.class);
            assertThat(context).hasSingleBean(SubjectRouterHealthIndicator.class);
            assertThat(context).doesNotHaveBean(DeadLetterService.class);

            assertThat(context.getBean("routingEvents", RoutingEvents.class)).isInstanceOf(RoutingLoggerEvents.class);
            assertThat(context.getBean(SubjectRouter.class).getConfig().enableDlq()).isFalse();
        });
    }

    @Test
    void propertiesAreBound() {
        contextRunner
                .withPropertyValues(
                        "firefly.eventbridge.router.channel-capacity=64",
                        "firefly.eventbridge.router.lock-timeout=250ms",
                        "firefly.eventbridge.sequencer.max-buffer-size=10",
                        "firefly.eventbridge.sequencer.sequence-timeout=2s")
                .run(context -> {
                    var config = context.getBean(SubjectRouter.class).getConfig();
                    assertThat(config.channelCapacity()).isEqualTo(64);
                    assertThat(config.lockTimeout()).isEqualTo(Duration.ofMillis(250));
                    var sequencer = context.getBean(SequencerConfig.class);
                    assertThat(sequencer.maxBufferSize()).isEqualTo(10);
                    assertThat(sequencer.maxSequenceGap()).isEqualTo(100);
                    assertThat(sequencer.sequenceTimeout()).isEqualTo(Duration.ofSeconds(2));
                });
    }

    @Test
    void deadLetterQueueIsOptIn() {
        contextRunner
                .withPropertyValues("firefly.eventbridge.dlq.enabled=true", "firefly.eventbridge.dlq.max-retries=5",
                        "firefly.eventbridge.dlq.max-entries=250")
                .run(context -> {
                    assertThat(context).hasSingleBean(DeadLetterService.class);
                    assertThat(context.getBean(DeadLetterStore.class))
                            .isInstanceOfSatisfying(InMemoryDeadLetterStore.class,
                                    store -> assertThat(store.getMaxEntries()).isEqualTo(250));
                    var config = context.getBean(SubjectRouter.class).getConfig();
                    assertThat(config.enableDlq()).isTrue();
                    assertThat(config.maxRetries()).isEqualTo(5);
                });
    }

    @Test
    void healthIndicatorCanBeDisabled() {
        contextRunner
                .withPropertyValues("firefly.eventbridge.health.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(SubjectRouterHealthIndicator.class));
    }

    @Test
    void meterRegistryAddsMetricsToTheComposite() {
        contextRunner
                .withUserConfiguration(MeterRegistryConfig.class)
                .run(context -> {
                    RoutingEvents events = context.getBean("routingEvents", RoutingEvents.class);
                    assertThat(events).isInstanceOf(CompositeRoutingEvents.class);
                    assertThat(context.getBean(RoutingEvents.class)).isSameAs(events);

                    context.getBean(SubjectRouter.class).registerSubject("event.graph.>");
                    MeterRegistry registry = context.getBean(MeterRegistry.class);
                    assertThat(registry.get("firefly.eventbridge.subjects.registered").counter().count()).isEqualTo(1.0);
                });
    }

    @Test
    void metricsCanBeDisabled() {
        contextRunner
                .withUserConfiguration(MeterRegistryConfig.class)
                .withPropertyValues("firefly.eventbridge.metrics.enabled=false")
                .run(context -> assertThat(context.getBean("routingEvents", RoutingEvents.class))
                        .isInstanceOf(RoutingLoggerEvents.class));
    }

    @Test
    void userEventStoreWins() {
        contextRunner
                .withUserConfiguration(CustomStoreConfig.class)
                .run(context -> assertThat(context.getBean(EventStore.class))
                        .isSameAs(context.getBean(CustomStoreConfig.class).store));
    }

    @Configuration(proxyBeanMethods = false)
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomStoreConfig {
        final InMemoryEventStore store = new InMemoryEventStore();

        @Bean
        EventStore customEventStore() {
            return store;
        }
    }
}
