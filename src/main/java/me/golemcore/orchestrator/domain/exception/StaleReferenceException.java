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

import me.golemcore.orchestrator.domain.model.SessionId;

/**
 * The id was issued once, but its slot has since been released or recycled.
 */
public class StaleReferenceException extends OrchestrationException {

    private static final long serialVersionUID = 1L;

    public StaleReferenceException(SessionId id) {
        super(ErrorCode.STALE_REFERENCE, "Stale session reference: " + id);
    }
}
