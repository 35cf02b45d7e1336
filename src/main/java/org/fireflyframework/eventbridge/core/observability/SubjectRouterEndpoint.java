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


package org.fireflyframework.eventbridge.core.observability;

import org.fireflyframework.eventbridge.routing.ChannelStats;
import org.fireflyframework.eventbridge.routing.SubjectRouter;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.boot.actuate.endpoint.annotation.Selector;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Spring Boot Actuator endpoint exposing the subject registry and per-channel statistics
 * at {@code /actuator/subject-routes}.
 */
@Endpoint(id = "subject-routes")
public class SubjectRouterEndpoint {

    private final SubjectRouter router;

    public SubjectRouterEndpoint(SubjectRouter router) {
        this.router = router;
    }

    @ReadOperation
    public Map<String, Object> routes() {
        Map<String, ChannelStats> stats = router.getStats();
        Map<String, Object> channels = new LinkedHashMap<>();
        stats.forEach((pattern, s) -> channels.put(pattern, describe(s)));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("channelCount", stats.size());
        result.put("sent", stats.values().stream().mapToLong(ChannelStats::sent).sum());
        result.put("dropped", stats.values().stream().mapToLong(ChannelStats::dropped).sum());
        result.put("globalSequence", router.currentGlobalSequence());
        result.put("channels", channels);
        return result;
    }

    /**
     * Statistics of one pattern, or an error entry when the pattern is not registered.
     */
    @ReadOperation
    public Map<String, Object> route(@Selector String pattern) {
        ChannelStats stats = router.getStats().get(pattern);
        if (stats == null) {
            return Map.of("error", "Unknown pattern: " + pattern);
        }
        return describe(stats);
    }

    private static Map<String, Object> describe(ChannelStats stats) {
        Map<String, Object> channel = new LinkedHashMap<>();
        channel.put("sent", stats.sent());
        channel.put("received", stats.received());
        channel.put("dropped", stats.dropped());
        channel.put("queued", stats.queued());
        channel.put("capacity", stats.capacity());
        channel.put("subscribers", stats.subscribers());
        if (stats.lastError() != null) {
            channel.put("lastError", stats.lastError());
        }
        return channel;
    }
}
