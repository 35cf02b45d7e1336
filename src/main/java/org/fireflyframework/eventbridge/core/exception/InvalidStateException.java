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


package org.fireflyframework.eventbridge.core.exception;

/**
 * A command is not accepted in the aggregate's current state. The aggregate is left unchanged.
 */
public final class InvalidStateException extends EventBridgeException {
    private final String currentState;

    public InvalidStateException(String currentState, String message) {
        super(message + " (current state: " + currentState + ")", "EVENTBRIDGE_INVALID_STATE");
        this.currentState = currentState;
    }

    public String getCurrentState() {
        return currentState;
    }
}
