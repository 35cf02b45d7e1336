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
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.eventbridge.consumer.SequencerConfig;
import org.fireflyframework.eventbridge.core.dlq.DeadLetterService;
import org.fireflyframework.eventbridge.core.dlq.DeadLetterStore;
import org.fireflyframework.eventbridge.core.dlq.InMemoryDeadLetterStore;
import org.fireflyframework.eventbridge.core.observability.CompositeRoutingEvents;
import org.fireflyframework.eventbridge.core.observability.RoutingEvents;
import org.fireflyframework.eventbridge.core.observability.RoutingLoggerEvents;
import org.fireflyframework.eventbridge.core.observability.RoutingMetrics;
import org.fireflyframework.eventbridge.core.serialization.EventSerializer;
import org.fireflyframework.eventbridge.core.store.EventStore;
import org.fireflyframework.eventbridge.core.store.InMemoryEventStore;
import org.fireflyframework.eventbridge.routing.RouterConfig;
import org.fireflyframework.eventbridge.routing.SequenceTracker;
import org.fireflyframework.eventbridge.routing.SubjectRouter;
import org.fireflyframework.eventbridge.workflow.service.WorkflowService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Main auto-configuration of the event bridge.
 *
 * <p>Wires observability, the event store, the dead-letter queue (opt-in), the sequence tracker,
 * the subject router and the workflow service. Every bean backs off when the application
 * defines its own.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(EventBridgeProperties.class)
public class EventBridgeAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public RoutingLoggerEvents routingLoggerEvents() {
        return new RoutingLoggerEvents();
    }

    /**
     * Composite of the logger and, when a {@link MeterRegistry} is present, the metrics recorder.
     * Primary so that components depending on {@link RoutingEvents} get the composite rather than the logger.
     */
    @Bean
    @Primary
    @ConditionalOnMissingBean(name = "routingEvents")
    public RoutingEvents routingEvents(ObjectProvider<RoutingLoggerEvents> loggerEvents,
                                       ObjectProvider<MeterRegistry> meterRegistry,
                                       EventBridgeProperties properties) {
        List<RoutingEvents> delegates = new ArrayList<>();
        RoutingLoggerEvents logger = loggerEvents.getIfAvailable();
        if (logger != null) {
            delegates.add(logger);
        }
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry != null && properties.getMetrics().isEnabled()) {
            log.info("[eventbridge] Micrometer metrics enabled under prefix {}", RoutingMetrics.PREFIX);
            delegates.add(new RoutingMetrics(registry));
        }
        if (delegates.size() == 1) {
            return delegates.get(0);
        }
        return new CompositeRoutingEvents(delegates);
    }

    @Bean
    @ConditionalOnMissingBean
    public EventStore eventStore() {
        log.info("[eventbridge] Using in-memory event store (default)");
        return new InMemoryEventStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterStore deadLetterStore(EventBridgeProperties properties) {
        return new InMemoryDeadLetterStore(properties.getDlq().getMaxEntries());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "firefly.eventbridge.dlq.enabled", havingValue = "true")
    public DeadLetterService deadLetterService(DeadLetterStore store, RoutingEvents events) {
        log.info("[eventbridge] Dead letter queue service initialized");
        return new DeadLetterService(store, events);
    }

    @Bean
    @ConditionalOnMissingBean
    public SequenceTracker sequenceTracker(EventBridgeProperties properties) {
        return new SequenceTracker(properties.getRouter().getLockTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public SubjectRouter subjectRouter(EventBridgeProperties properties,
                                       SequenceTracker sequenceTracker,
                                       RoutingEvents events,
                                       ObjectProvider<DeadLetterService> deadLetterService,
                                       ObjectProvider<Clock> clock) {
        RouterConfig config = properties.toRouterConfig();
        log.info("[eventbridge] Subject router initialized with channel capacity {} (dlq {})",
                config.channelCapacity(), config.enableDlq() ? "enabled" : "disabled");
        return new SubjectRouter(config, sequenceTracker, events, deadLetterService.getIfAvailable(),
                clock.getIfAvailable(Clock::systemUTC));
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowService workflowService(EventStore eventStore, SubjectRouter router, RoutingEvents events,
                                           ObjectProvider<Clock> clock) {
        return new WorkflowService(eventStore, router, events, clock.getIfAvailable(Clock::systemUTC));
    }

    @Bean
    @ConditionalOnMissingBean
    public EventSerializer eventSerializer() {
        return new EventSerializer();
    }

    @Bean
    @ConditionalOnMissingBean
    public SequencerConfig sequencerConfig(EventBridgeProperties properties) {
        return properties.toSequencerConfig();
    }
}
