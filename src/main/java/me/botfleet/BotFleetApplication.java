package me.botfleet;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Bot Fleet: runs many Discord personality bots side by side in one process.
 *
 * <p>
 * Each bot instance is declared in the fleet document with a template, a
 * credential reference and an optional personality override. The
 * {@code InstanceOrchestrator} owns the live registry and drives every
 * instance through the lifecycle state machine; the management API and the
 * {@code /ws/status} feed expose the observed state.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Inbound            → REST controllers, status/log WebSockets, config watcher
 * Domain             → InstanceOrchestrator, FleetConfigService, vault, templates
 * Outbound adapters  → Discord gateway, local storage, knowledge store
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code fleet.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class BotFleetApplication {

    public static void main(String[] args) {
        SpringApplication.run(BotFleetApplication.class, args);
    }

}
