package me.golemcore.orchestrator.domain.exception;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Base type for every failure an orchestrator operation reports to its caller.
 * Carries an {@link ErrorCode} so adapters can map it without inspecting the
 * concrete type.
 */
public class OrchestrationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode code;

    public OrchestrationException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public OrchestrationException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
