package me.botfleet.domain.service;

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

import me.botfleet.domain.model.InstanceConfig;
import me.botfleet.domain.model.LifecycleState;
import me.botfleet.port.outbound.ChatGatewayPort.GatewayConnection;
import me.botfleet.port.outbound.KnowledgeStorePort.KnowledgeHandle;

import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * Runtime record of one started instance. Confined to the orchestrator
 * thread.
 */
final class LiveInstance {

    final String id;
    final String taskId;
    final Path isolationPath;

    InstanceConfig config;
    LifecycleState state = LifecycleState.STOPPED;
    KnowledgeHandle knowledge;
    GatewayConnection connection;
    CompletableFuture<GatewayConnection> pendingConnect;
    ScheduledFuture<?> heartbeatTask;
    Instant startedAt;
    Instant heartbeatAt;
    boolean stopRequested;

    LiveInstance(InstanceConfig config, String taskId, Path isolationPath) {
        this.id = config.getId();
        this.config = config;
        this.taskId = taskId;
        this.isolationPath = isolationPath;
    }

    String credentialRef() {
        return config.getCredentialRef();
    }

    void cancelHeartbeat() {
        if (heartbeatTask != null) {
            heartbeatTask.cancel(false);
            heartbeatTask = null;
        }
    }
}
