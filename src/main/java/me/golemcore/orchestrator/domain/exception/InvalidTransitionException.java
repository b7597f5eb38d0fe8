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

import me.golemcore.orchestrator.domain.model.SessionState;

/**
 * Requested state change is not an edge of the session state machine.
 */
public class InvalidTransitionException extends OrchestrationException {

    private static final long serialVersionUID = 1L;

    private final transient SessionState source;
    private final transient SessionState target;

    public InvalidTransitionException(SessionState source, SessionState target) {
        super(ErrorCode.INVALID_TRANSITION, "Invalid transition: "
                + source.getWireName() + " -> " + target.getWireName());
        this.source = source;
        this.target = target;
    }

    public InvalidTransitionException(SessionState source, String message) {
        super(ErrorCode.INVALID_TRANSITION, message);
        this.source = source;
        this.target = null;
    }

    public SessionState getSource() {
        return source;
    }

    public SessionState getTarget() {
        return target;
    }
}
