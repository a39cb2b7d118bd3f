package me.botfleet.adapter.inbound.web.config;

import lombok.RequiredArgsConstructor;
import me.botfleet.adapter.inbound.web.WebSocketLogsHandler;
import me.botfleet.adapter.inbound.web.WebSocketStatusHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.server.support.WebSocketHandlerAdapter;

import java.util.Map;

/**
 * WebFlux WebSocket routes for the status feed and the log tail.
 */
@Configuration
@RequiredArgsConstructor
public class WebSocketConfig {

    private final WebSocketStatusHandler webSocketStatusHandler;
    private final WebSocketLogsHandler webSocketLogsHandler;

    @Bean
    public HandlerMapping webSocketHandlerMapping() {
        SimpleUrlHandlerMapping mapping = new SimpleUrlHandlerMapping();
        mapping.setUrlMap(Map.of(
                "/ws/status", webSocketStatusHandler,
                "/ws/logs", webSocketLogsHandler));
        mapping.setOrder(-1);
        return mapping;
    }

    @Bean
    public WebSocketHandlerAdapter webSocketHandlerAdapter() {
        return new WebSocketHandlerAdapter();
    }
}
