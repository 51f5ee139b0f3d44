package com.sessionhub.trigger.websocket;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * 基于 Spring WebSocketSession 的推送通道，发送超时或缓冲超限时丢弃最旧消息。
 */
@Slf4j
public class WebSocketObserverChannel implements ObserverChannel {

    private final WebSocketSession session;

    public WebSocketObserverChannel(WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimitBytes) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimitBytes,
                ConcurrentWebSocketSessionDecorator.OverflowStrategy.DROP);
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String payload) throws IOException {
        session.sendMessage(new TextMessage(payload));
    }

    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException ex) {
            log.debug("Close observer channel failed. channelId={}, error={}", getId(), ex.getMessage());
        }
    }
}
