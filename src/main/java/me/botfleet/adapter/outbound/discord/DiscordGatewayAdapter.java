package me.botfleet.adapter.outbound.discord;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.botfleet.domain.model.BehaviorDescriptor;
import me.botfleet.domain.model.GatewayConnectException;
import me.botfleet.infrastructure.config.FleetProperties;
import me.botfleet.port.outbound.ChatGatewayPort;
import me.botfleet.port.outbound.KnowledgeStorePort.KnowledgeHandle;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Discord gateway client.
 *
 * <p>
 * Connecting is a two-step handshake:
 * <ol>
 * <li>{@code GET /gateway/bot} with {@code Authorization: Bot <token>}
 * validates the token and returns the WebSocket URL</li>
 * <li>the gateway WebSocket is opened; the session identifies on HELLO and is
 * ready on the READY dispatch (see {@link DiscordGatewaySession})</li>
 * </ol>
 *
 * <p>
 * Only session liveness is handled here. Message handling belongs to the bot
 * runtime and is not part of this adapter.
 */
@Component
@Slf4j
public class DiscordGatewayAdapter implements ChatGatewayPort {

    static final String GATEWAY_QUERY = "?v=10&encoding=json";
    static final String INTENTS_SETTING = "DISCORD_INTENTS";

    private final FleetProperties properties;
    private final OkHttpClient restClient;
    private final OkHttpClient socketClient;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService heartbeatScheduler;

    public DiscordGatewayAdapter(FleetProperties properties, OkHttpClient baseHttpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.restClient = baseHttpClient;
        this.socketClient = baseHttpClient.newBuilder()
                .readTimeout(0, TimeUnit.MILLISECONDS)
                .pingInterval(30, TimeUnit.SECONDS)
                .build();
        this.heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "discord-heartbeat");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public String getPlatform() {
        return "discord";
    }

    @Override
    public CompletableFuture<GatewayConnection> connect(String credential, BehaviorDescriptor behavior,
            KnowledgeHandle knowledge) {
        if (credential == null || credential.isBlank()) {
            return CompletableFuture.failedFuture(new GatewayConnectException("Bot token is empty", true));
        }

        return CompletableFuture.supplyAsync(() -> {
            try {
                return fetchGatewayUrl(credential);
            } catch (GatewayConnectException e) {
                throw new CompletionException(e);
            }
        }).thenCompose(url -> {
            DiscordGatewaySession session = new DiscordGatewaySession(credential, gatewayIntents(behavior),
                    behavior, knowledge, objectMapper, heartbeatScheduler);
            Request request = new Request.Builder().url(url + GATEWAY_QUERY).build();
            socketClient.newWebSocket(request, session);
            log.debug("[Discord] Opening gateway session for {}", behavior.identity());
            return session.ready();
        });
    }

    /**
     * Intents from the instance's template setting, falling back to
     * {@code fleet.discord.gateway-intents}.
     */
    int gatewayIntents(BehaviorDescriptor behavior) {
        String configured = behavior.setting(INTENTS_SETTING);
        if (configured != null && !configured.isBlank()) {
            try {
                return Integer.parseInt(configured.trim());
            } catch (NumberFormatException e) {
                log.warn("[Discord] Ignoring invalid {} '{}' for {}", INTENTS_SETTING, configured,
                        behavior.identity());
            }
        }
        return properties.getDiscord().getGatewayIntents();
    }

    /**
     * Validates the token and resolves the gateway URL.
     */
    String fetchGatewayUrl(String credential) throws GatewayConnectException {
        Request request = new Request.Builder()
                .url(properties.getDiscord().getApiBaseUrl() + "/gateway/bot")
                .header("Authorization", "Bot " + credential)
                .get()
                .build();

        try (Response response = restClient.newCall(request).execute()) {
            if (response.code() == 401 || response.code() == 403) {
                throw new GatewayConnectException("Discord rejected the bot token (HTTP " + response.code() + ")",
                        true);
            }
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new GatewayConnectException("Gateway lookup failed: HTTP " + response.code(), false);
            }
            JsonNode node = objectMapper.readTree(body.string());
            String url = node.path("url").asText(null);
            if (url == null || url.isBlank()) {
                throw new GatewayConnectException("Gateway lookup returned no url", false);
            }
            return url;
        } catch (IOException e) {
            throw new GatewayConnectException("Gateway lookup failed: " + e.getMessage(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        heartbeatScheduler.shutdownNow();
    }
}
