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


package org.fireflyframework.eventbridge.routing;

/**
 * Point-in-time statistics of one subject channel.
 *
 * @param sent        events accepted by the channel
 * @param received    events taken from the channel by receivers
 * @param dropped     events that could not be delivered (channel full or no live receiver)
 * @param lastError   reason of the most recent drop, {@code null} if none
 * @param subscribers live receivers
 * @param queued      events waiting in the channel
 * @param capacity    channel capacity
 */
public record ChannelStats(
        long sent,
        long received,
        long dropped,
        String lastError,
        int subscribers,
        int queued,
        int capacity
) {
    public boolean isFull() {
        return queued >= capacity;
    }
}
