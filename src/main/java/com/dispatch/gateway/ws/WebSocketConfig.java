package com.dispatch.gateway.ws;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {
    private final RunSessionSocketHandler handler;

    @Value("${dispatch.ws.path:/ws/runs}")
    private String wsPath;

    @Value("${dispatch.ws.allowed-origins:*}")
    private String[] allowedOrigins;

    public WebSocketConfig(RunSessionSocketHandler handler) {
        this.handler = handler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, wsPath).setAllowedOrigins(allowedOrigins);
    }
}
