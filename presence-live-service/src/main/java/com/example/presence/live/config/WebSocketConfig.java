package com.example.presence.live.config;

import com.example.presence.live.transport.EventPresenceWebSocketHandler;
import com.example.presence.live.transport.UserNotificationWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.WebSocketHandler;

import java.util.Map;

@Configuration
public class WebSocketConfig {

    @Bean
    public HandlerMapping webSocketHandlerMapping(EventPresenceWebSocketHandler eventHandler,
                                                  UserNotificationWebSocketHandler userHandler) {
        Map<String, WebSocketHandler> handlers = Map.of(
                "/ws/events/{eventId}", eventHandler,
                "/ws/users", userHandler);
        // Ahead of the annotated controllers
        return new SimpleUrlHandlerMapping(handlers, -1);
    }
}
