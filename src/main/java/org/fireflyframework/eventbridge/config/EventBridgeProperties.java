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

import org.fireflyframework.eventbridge.consumer.SequencerConfig;
import org.fireflyframework.eventbridge.core.dlq.InMemoryDeadLetterStore;
import org.fireflyframework.eventbridge.routing.RouterConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;

/**
 * Configuration properties of the event bridge.
 *
 * <p>Example YAML:
 * <pre>{@code
 * firefly:
 *   eventbridge:
 *     router:
 *       channel-capacity: 10000
 *       lock-timeout: 5s
 *     dlq:
 *       enabled: false
 *       max-retries: 3
 *       max-entries: 10000
 *     sequencer:
 *       max-buffer-size: 1000
 *       max-sequence-gap: 100
 *       sequence-timeout: 30s
 *     metrics:
 *       enabled: true
 *     health:
 *       enabled: true
 * }</pre>
 */
@ConfigurationProperties(prefix = "firefly.eventbridge")
public class EventBridgeProperties {

    @NestedConfigurationProperty
    private RouterProperties router = new RouterProperties();

    @NestedConfigurationProperty
    private DlqProperties dlq = new DlqProperties();

    @NestedConfigurationProperty
    private SequencerProperties sequencer = new SequencerProperties();

    @NestedConfigurationProperty
    private MetricsProperties metrics = new MetricsProperties();

    @NestedConfigurationProperty
    private HealthProperties health = new HealthProperties();

    // --- Getters and Setters ---

    public RouterProperties getRouter() { return router; }
    public void setRouter(RouterProperties router) { this.router = router; }

    public DlqProperties getDlq() { return dlq; }
    public void setDlq(DlqProperties dlq) { this.dlq = dlq; }

    public SequencerProperties getSequencer() { return sequencer; }
    public void setSequencer(SequencerProperties sequencer) { this.sequencer = sequencer; }

    public MetricsProperties getMetrics() { return metrics; }
    public void setMetrics(MetricsProperties metrics) { this.metrics = metrics; }

    public HealthProperties getHealth() { return health; }
    public void setHealth(HealthProperties health) { this.health = health; }

    public RouterConfig toRouterConfig() {
        return new RouterConfig(router.getChannelCapacity(), router.getLockTimeout(), dlq.isEnabled(), dlq.getMaxRetries());
    }

    public SequencerConfig toSequencerConfig() {
        return new SequencerConfig(sequencer.getMaxBufferSize(), sequencer.getMaxSequenceGap(), sequencer.getSequenceTimeout());
    }

    // --- Nested Property Classes ---

    public static class RouterProperties {
        private int channelCapacity = RouterConfig.DEFAULT_CHANNEL_CAPACITY;
        private Duration lockTimeout = Duration.ofSeconds(5);

        public int getChannelCapacity() { return channelCapacity; }
        public void setChannelCapacity(int channelCapacity) { this.channelCapacity = channelCapacity; }
        public Duration getLockTimeout() { return lockTimeout; }
        public void setLockTimeout(Duration lockTimeout) { this.lockTimeout = lockTimeout; }
    }

    /**
     * Dead-letter queue settings. With {@code enabled} set, every dropped event is kept until it is
     * redelivered or purged; a consumer that never drains its channel keeps adding entries, so the
     * in-memory store holds at most {@code maxEntries} and evicts the oldest beyond that.
     */
    public static class DlqProperties {
        private boolean enabled = false;
        private int maxRetries = 3;
        private int maxEntries = InMemoryDeadLetterStore.DEFAULT_MAX_ENTRIES;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public int getMaxEntries() { return maxEntries; }
        public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }
    }

    public static class SequencerProperties {
        private int maxBufferSize = 1000;
        private long maxSequenceGap = 100;
        private Duration sequenceTimeout = Duration.ofSeconds(30);

        public int getMaxBufferSize() { return maxBufferSize; }
        public void setMaxBufferSize(int maxBufferSize) { this.maxBufferSize = maxBufferSize; }
        public long getMaxSequenceGap() { return maxSequenceGap; }
        public void setMaxSequenceGap(long maxSequenceGap) { this.maxSequenceGap = maxSequenceGap; }
        public Duration getSequenceTimeout() { return sequenceTimeout; }
        public void setSequenceTimeout(Duration sequenceTimeout) { this.sequenceTimeout = sequenceTimeout; }
    }

    public static class MetricsProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class HealthProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
