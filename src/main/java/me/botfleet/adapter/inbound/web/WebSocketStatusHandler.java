package me.botfleet.adapter.inbound.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.botfleet.domain.model.InstanceTransition;
import me.botfleet.domain.service.StatusBus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pushes every lifecycle transition to connected dashboards. Delivery is
 * at-most-once with no replay; clients reconcile against the instances list
 * after (re)connecting.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSocketStatusHandler implements WebSocketHandler {

    private final StatusBus statusBus;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String sessionId = session.getId();
        log.info("[StatusWS] Connection established: session={}", sessionId);

        Flux<WebSocketMessage> outbound = statusBus.stream()
                .map(this::toPayloadJson)
                .map(session::textMessage);

        return session.send(outbound)
                .and(session.receive().then())
                .doFinally(signal -> log.info("[StatusWS] Connection closed: session={}, signal={}",
                        sessionId, signal));
    }

    String toPayloadJson(InstanceTransition transition) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "transition");
        payload.put("instanceId", transition.instanceId());
        payload.put("oldState", transition.oldState());
        payload.put("newState", transition.newState());
        payload.put("timestamp", transition.timestamp());
        payload.put("reason", transition.reason());
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
