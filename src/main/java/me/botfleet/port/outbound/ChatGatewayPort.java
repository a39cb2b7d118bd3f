package me.botfleet.port.outbound;

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

import me.botfleet.domain.model.BehaviorDescriptor;
import me.botfleet.port.outbound.KnowledgeStorePort.KnowledgeHandle;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Port to the chat platform client (Discord, etc.). Implementations perform
 * their network I/O on their own threads and report results through futures.
 */
public interface ChatGatewayPort {

    /**
     * Returns the platform identifier (e.g., "discord").
     */
    String getPlatform();

    /**
     * Connects a new session with the given token.
     *
     * @return future completed with a ready connection, or completed
     *         exceptionally with
     *         {@link me.botfleet.domain.model.GatewayConnectException}
     */
    CompletableFuture<GatewayConnection> connect(String credential, BehaviorDescriptor behavior,
            KnowledgeHandle knowledge);

    /**
     * One live session. Its {@link #closeFuture()} is the instance's task: it
     * completes normally after a requested disconnect and exceptionally when
     * the session dies on its own.
     */
    interface GatewayConnection {

        String sessionId();

        boolean isReady();

        /**
         * Requests a graceful disconnect. The returned future completes when
         * the session is closed, or exceptionally with
         * {@link java.util.concurrent.TimeoutException} when it is still open
         * after {@code timeout}; the caller then calls {@link #abort()}.
         */
        CompletableFuture<Void> disconnect(Duration timeout);

        /**
         * Tears the session down without waiting for the remote side.
         */
        void abort();

        CompletableFuture<Void> closeFuture();

        /**
         * Swaps the behavior of a live session without reconnecting.
         */
        void applyBehavior(BehaviorDescriptor behavior);
    }
}
