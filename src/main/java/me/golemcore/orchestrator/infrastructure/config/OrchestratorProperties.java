package me.golemcore.orchestrator.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties for the orchestrator, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code orchestrator.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - where channel and session records live</li>
 * <li>{@link IdsProperties} - session id bit layout</li>
 * <li>{@link SchedulerProperties} - tick rate, admission and timeouts</li>
 * <li>{@link EventsProperties} - event history and subscriber queues</li>
 * <li>{@link WebSocketProperties} - real-time protocol endpoint</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "orchestrator")
@Data
public class OrchestratorProperties {

    private StorageProperties storage = new StorageProperties();
    private IdsProperties ids = new IdsProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();
    private EventsProperties events = new EventsProperties();
    private WebSocketProperties websocket = new WebSocketProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private DirectoriesProperties directories = new DirectoriesProperties();
        private boolean backupOnWrite = false;
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/orchestrator";
    }

    @Data
    public static class DirectoriesProperties {
        private String channels = "channels";
        private String sessions = "sessions";
        private String ids = "ids";
    }

    @Data
    public static class IdsProperties {
        /**
         * Number of low bits holding the slot index. The remaining high bits of the
         * 32-bit id hold the generation.
         */
        private int indexBits = 16;
    }

    @Data
    public static class SchedulerProperties {
        private boolean enabled = true;
        private long tickIntervalMillis = 100;
        private int maxConcurrentRunning = 4;
        private long toolTimeoutSeconds = 300;
        private long humanInputTimeoutSeconds = 3600;
        private long controlTimeoutSeconds = 10;
    }

    @Data
    public static class EventsProperties {
        private int bufferCapacity = 1000;
        private int historySize = 100;
        private int subscriberQueueSize = 256;
    }

    @Data
    public static class WebSocketProperties {
        private String path = "/ws/orchestrator";
        private String defaultInvitePrompt = "You have been invited to the channel";
    }
}
