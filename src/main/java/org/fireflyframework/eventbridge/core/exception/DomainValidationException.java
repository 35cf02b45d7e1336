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
 * A command was well-formed for the current state but the aggregate's content does not satisfy
 * a business rule, e.g. validating a workflow that has no steps.
 */
public final class DomainValidationException extends EventBridgeException {

    public DomainValidationException(String message) {
        super(message, "EVENTBRIDGE_VALIDATION_ERROR");
    }
}
