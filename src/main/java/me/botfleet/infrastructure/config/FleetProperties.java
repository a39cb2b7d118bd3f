package me.botfleet.infrastructure.config;

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

import java.time.Duration;

/**
 * Configuration properties for the fleet, bound from application.properties.
 *
 * <p>
 * All settings live under the {@code fleet.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - workspace location</li>
 * <li>{@link OrchestratorProperties} - lifecycle timeouts and heartbeat</li>
 * <li>{@link ReloadProperties} - fleet document watcher</li>
 * <li>{@link SupervisionProperties} - optional crash restart</li>
 * <li>{@link DiscordProperties} - gateway adapter endpoints</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * <li>{@link DashboardProperties} - log capture for the dashboard</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "fleet")
@Data
public class FleetProperties {

    private StorageProperties storage = new StorageProperties();
    private OrchestratorProperties orchestrator = new OrchestratorProperties();
    private ReloadProperties reload = new ReloadProperties();
    private SupervisionProperties supervision = new SupervisionProperties();
    private DiscordProperties discord = new DiscordProperties();
    private HttpProperties http = new HttpProperties();
    private DashboardProperties dashboard = new DashboardProperties();

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.botfleet/workspace";
    }

    // ==================== ORCHESTRATOR ====================

    @Data
    public static class OrchestratorProperties {
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration stopTimeout = Duration.ofSeconds(10);
        private Duration heartbeatInterval = Duration.ofSeconds(15);
        private Duration heartbeatStaleAfter = Duration.ofSeconds(60);

        /**
         * Start every {@code autoStart} instance once the application is ready.
         */
        private boolean reconcileOnBoot = true;

        /**
         * Threads for blocking knowledge-store work.
         */
        private int ioThreads = 4;
    }

    @Data
    public static class ReloadProperties {
        private boolean enabled = true;
        private Duration pollInterval = Duration.ofSeconds(2);
    }

    @Data
    public static class SupervisionProperties {
        private AutoRestartProperties autoRestart = new AutoRestartProperties();
    }

    @Data
    public static class AutoRestartProperties {
        private boolean enabled = false;
        private int maxAttempts = 3;
        private Duration delay = Duration.ofSeconds(5);
    }

    // ==================== DISCORD ====================

    @Data
    public static class DiscordProperties {
        private String apiBaseUrl = "https://discord.com/api/v10";

        /**
         * GUILDS | GUILD_MESSAGES | DIRECT_MESSAGES | MESSAGE_CONTENT.
         */
        private int gatewayIntents = 37377;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== DASHBOARD ====================

    @Data
    public static class DashboardProperties {
        private LogsProperties logs = new LogsProperties();
    }

    @Data
    public static class LogsProperties {
        private boolean enabled = true;
        private int maxEntries = 10000;
        private int defaultPageSize = 200;
        private int maxPageSize = 1000;
        private int maxMessageChars = 8000;
        private int maxExceptionChars = 16000;
    }
}
