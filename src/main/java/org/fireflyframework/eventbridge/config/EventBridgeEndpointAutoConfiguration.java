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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.eventbridge.core.health.SubjectRouterHealthIndicator;
import org.fireflyframework.eventbridge.core.observability.SubjectRouterEndpoint;
import org.fireflyframework.eventbridge.routing.SubjectRouter;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the actuator endpoint and health indicator.
 */
@Slf4j
@AutoConfiguration(after = EventBridgeAutoConfiguration.class)
public class EventBridgeEndpointAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public SubjectRouterEndpoint subjectRouterEndpoint(SubjectRouter router) {
        return new SubjectRouterEndpoint(router);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "firefly.eventbridge.health.enabled", havingValue = "true", matchIfMissing = true)
    public SubjectRouterHealthIndicator subjectRouterHealthIndicator(SubjectRouter router) {
        log.info("[eventbridge] Health indicator initialized");
        return new SubjectRouterHealthIndicator(router);
    }
}
