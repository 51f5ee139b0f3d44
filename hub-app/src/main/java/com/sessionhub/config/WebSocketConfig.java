package com.sessionhub.config;

import com.sessionhub.trigger.websocket.SessionObserverWebSocketHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * 观察端 WebSocket 端点注册。
 */
@Slf4j
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final WebSocketHandler observerHandler;
    private final String path;
    private final String[] allowedOrigins;

    public WebSocketConfig(SessionObserverWebSocketHandler observerHandler,
                           @Value("${session-hub.websocket.path:/ws}") String path,
                           @Value("${session-hub.websocket.allowed-origins:*}") String[] allowedOrigins) {
        this.observerHandler = observerHandler;
        this.path = path;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(observerHandler, path).setAllowedOriginPatterns(allowedOrigins);
        log.info("Observer websocket endpoint registered. path={}", path);
    }
}
