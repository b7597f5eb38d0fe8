package me.golemcore.orchestrator.domain.model;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Opaque session handle packing a slot index (low bits) and a generation (high
 * bits) into one unsigned 32-bit value.
 *
 * <p>
 * The bit split is owned by
 * {@link me.golemcore.orchestrator.domain.service.GenerationalIdAllocator};
 * outside the allocator the id is only compared, stored and rendered. On the
 * wire and on disk it is the unsigned decimal value.
 */
public record SessionId(int value) {

    private static final long MAX_UNSIGNED = 0xFFFF_FFFFL;

    @JsonValue
    public long asLong() {
        return Integer.toUnsignedLong(value);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static SessionId fromLong(long raw) {
        if (raw < 0 || raw > MAX_UNSIGNED) {
            throw new IllegalArgumentException("Session id out of range: " + raw);
        }
        return new SessionId((int) raw);
    }

    /**
     * Parses the unsigned decimal form, optionally prefixed with {@code #}.
     *
     * @throws IllegalArgumentException
     *             if the text is not a valid unsigned 32-bit number
     */
    public static SessionId parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Session id is required");
        }
        String trimmed = text.trim();
        if (trimmed.startsWith("#")) {
            trimmed = trimmed.substring(1);
        }
        try {
            return new SessionId(Integer.parseUnsignedInt(trimmed));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid session id: " + text, e);
        }
    }

    @Override
    public String toString() {
        return Integer.toUnsignedString(value);
    }
}
