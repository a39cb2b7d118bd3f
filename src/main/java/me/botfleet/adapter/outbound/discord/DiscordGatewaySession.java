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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.botfleet.domain.model.BehaviorDescriptor;
import me.botfleet.domain.model.GatewayConnectException;
import me.botfleet.port.outbound.ChatGatewayPort.GatewayConnection;
import me.botfleet.port.outbound.KnowledgeStorePort.KnowledgeHandle;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * One Discord gateway WebSocket session.
 *
 * <p>
 * Opcodes handled: HELLO (10) starts the heartbeat and sends IDENTIFY (2),
 * DISPATCH READY (0) completes {@link #ready()}, HEARTBEAT (1) is answered at
 * once, RECONNECT (7) and INVALID_SESSION (9) end the session. Any close that
 * was not requested through {@link #disconnect(Duration)} or {@link #abort()}
 * completes {@link #closeFuture()} exceptionally.
 */
@Slf4j
public class DiscordGatewaySession extends WebSocketListener implements GatewayConnection {

    static final int OP_DISPATCH = 0;
    static final int OP_HEARTBEAT = 1;
    static final int OP_IDENTIFY = 2;
    static final int OP_PRESENCE_UPDATE = 3;
    static final int OP_RECONNECT = 7;
    static final int OP_INVALID_SESSION = 9;
    static final int OP_HELLO = 10;
    static final int OP_HEARTBEAT_ACK = 11;

    static final int NORMAL_CLOSURE = 1000;

    /** Close codes that mean the token or intents can never work. */
    private static final Set<Integer> FATAL_CLOSE_CODES = Set.of(4004, 4013, 4014);

    private final String token;
    private final int intents;
    private final KnowledgeHandle knowledge;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService scheduler;

    private final CompletableFuture<GatewayConnection> ready = new CompletableFuture<>();
    private final CompletableFuture<Void> closed = new CompletableFuture<>();

    private volatile BehaviorDescriptor behavior;
    private volatile WebSocket socket;
    private volatile Long sequence;
    private volatile String sessionId;
    private volatile boolean closeRequested;
    private volatile ScheduledFuture<?> heartbeat;

    public DiscordGatewaySession(String token, int intents, BehaviorDescriptor behavior, KnowledgeHandle knowledge,
            ObjectMapper objectMapper, ScheduledExecutorService scheduler) {
        this.token = token;
        this.intents = intents;
        this.behavior = behavior;
        this.knowledge = knowledge;
        this.objectMapper = objectMapper;
        this.scheduler = scheduler;
    }

    CompletableFuture<GatewayConnection> ready() {
        return ready;
    }

    // ==================== WebSocketListener ====================

    @Override
    public void onOpen(WebSocket webSocket, Response response) {
        this.socket = webSocket;
        log.debug("[Discord] Socket open for {} (store {})", behavior.identity(),
                knowledge != null ? knowledge.path() : "none");
    }

    @Override
    public void onMessage(WebSocket webSocket, String text) {
        this.socket = webSocket;
        handlePayload(text);
    }

    @Override
    public void onClosing(WebSocket webSocket, int code, String reason) {
        webSocket.close(NORMAL_CLOSURE, null);
    }

    @Override
    public void onClosed(WebSocket webSocket, int code, String reason) {
        stopHeartbeat();
        if (!ready.isDone()) {
            ready.completeExceptionally(new GatewayConnectException(
                    "Gateway closed during handshake: " + code + " " + reason, FATAL_CLOSE_CODES.contains(code)));
        }
        if (closeRequested) {
            closed.complete(null);
        } else {
            closed.completeExceptionally(new IOException("Gateway closed unexpectedly: " + code + " " + reason));
        }
    }

    @Override
    public void onFailure(WebSocket webSocket, Throwable t, Response response) {
        stopHeartbeat();
        if (!ready.isDone()) {
            ready.completeExceptionally(new GatewayConnectException("Gateway connection failed: " + t.getMessage(), t));
        }
        if (closeRequested) {
            closed.complete(null);
        } else {
            closed.completeExceptionally(t);
        }
    }

    // ==================== GatewayConnection ====================

    @Override
    public String sessionId() {
        return sessionId;
    }

    @Override
    public boolean isReady() {
        return ready.isDone() && !ready.isCompletedExceptionally() && !closed.isDone();
    }

    @Override
    public CompletableFuture<Void> disconnect(Duration timeout) {
        closeRequested = true;
        stopHeartbeat();
        WebSocket current = socket;
        if (current == null || !current.close(NORMAL_CLOSURE, "shutdown")) {
            closed.complete(null);
        }
        return closed.handle((ignored, error) -> (Void) null)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void abort() {
        closeRequested = true;
        stopHeartbeat();
        WebSocket current = socket;
        if (current != null) {
            current.cancel();
        }
        closed.complete(null);
    }

    @Override
    public CompletableFuture<Void> closeFuture() {
        return closed;
    }

    @Override
    public void applyBehavior(BehaviorDescriptor behavior) {
        this.behavior = behavior;
        if (isReady()) {
            sendPresence();
        }
    }

    // ==================== protocol ====================

    void handlePayload(String text) {
        JsonNode payload;
        try {
            payload = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.warn("[Discord] Unparseable gateway payload for {}: {}", behavior.identity(), e.getMessage());
            return;
        }

        JsonNode seq = payload.get("s");
        if (seq != null && seq.isNumber()) {
            sequence = seq.asLong();
        }

        int op = payload.path("op").asInt(-1);
        JsonNode data = payload.path("d");
        switch (op) {
        case OP_HELLO:
            startHeartbeat(data.path("heartbeat_interval").asLong(41250));
            send(identifyPayload());
            break;
        case OP_DISPATCH:
            if ("READY".equals(payload.path("t").asText())) {
                sessionId = data.path("session_id").asText(null);
                log.info("[Discord] Session ready for {} (session {})", behavior.identity(), sessionId);
                ready.complete(this);
                sendPresence();
            }
            break;
        case OP_HEARTBEAT:
            sendHeartbeat();
            break;
        case OP_HEARTBEAT_ACK:
            break;
        case OP_RECONNECT:
        case OP_INVALID_SESSION:
            log.warn("[Discord] Gateway ended session for {} (op {})", behavior.identity(), op);
            endSession("Gateway requested reconnect (op " + op + ")");
            break;
        default:
            log.trace("[Discord] Ignoring op {}", op);
        }
    }

    private void endSession(String reason) {
        stopHeartbeat();
        WebSocket current = socket;
        if (current != null) {
            current.close(4000, "reconnect");
        }
        if (!ready.isDone()) {
            ready.completeExceptionally(new GatewayConnectException(reason, false));
        }
        closed.completeExceptionally(new IOException(reason));
    }

    private void startHeartbeat(long intervalMillis) {
        stopHeartbeat();
        heartbeat = scheduler.scheduleAtFixedRate(this::sendHeartbeat, intervalMillis, intervalMillis,
                TimeUnit.MILLISECONDS);
    }

    private void stopHeartbeat() {
        ScheduledFuture<?> current = heartbeat;
        if (current != null) {
            current.cancel(false);
            heartbeat = null;
        }
    }

    private void sendHeartbeat() {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("op", OP_HEARTBEAT);
        Long current = sequence;
        if (current != null) {
            payload.put("d", current);
        } else {
            payload.putNull("d");
        }
        send(payload);
    }

    ObjectNode identifyPayload() {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("op", OP_IDENTIFY);
        ObjectNode data = payload.putObject("d");
        data.put("token", token);
        data.put("intents", intents);
        ObjectNode props = data.putObject("properties");
        props.put("os", System.getProperty("os.name", "linux").toLowerCase(Locale.ROOT));
        props.put("browser", "botfleet");
        props.put("device", "botfleet");
        return payload;
    }

    private void sendPresence() {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("op", OP_PRESENCE_UPDATE);
        ObjectNode data = payload.putObject("d");
        data.putNull("since");
        ArrayNode activities = data.putArray("activities");
        ObjectNode activity = activities.addObject();
        activity.put("name", behavior.displayName() != null ? behavior.displayName() : behavior.personalityId());
        activity.put("type", 0);
        data.put("status", "online");
        data.put("afk", false);
        send(payload);
    }

    private void send(ObjectNode payload) {
        WebSocket current = socket;
        if (current == null) {
            return;
        }
        if (!current.send(payload.toString())) {
            log.debug("[Discord] Send dropped for {} (socket closing)", behavior.identity());
        }
    }
}
