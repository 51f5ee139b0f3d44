package com.sessionhub.trigger.websocket;

import com.sessionhub.api.dto.SessionRefDTO;
import com.sessionhub.api.protocol.ObserverMessageCodec;
import com.sessionhub.api.protocol.inbound.DeleteSessionMessage;
import com.sessionhub.api.protocol.inbound.ObserverInboundMessage;
import com.sessionhub.api.protocol.inbound.ValidateSessionsMessage;
import com.sessionhub.api.protocol.outbound.AuthorizedUsersMessage;
import com.sessionhub.api.protocol.outbound.ErrorMessage;
import com.sessionhub.api.protocol.outbound.ObserverOutboundMessage;
import com.sessionhub.api.protocol.outbound.SessionsValidatedMessage;
import com.sessionhub.trigger.application.command.SessionLifecycleCoordinator;
import com.sessionhub.trigger.application.query.SessionQueryService;
import com.sessionhub.trigger.event.SessionNotificationFanout;
import com.sessionhub.types.exception.AppException;
import com.sessionhub.types.exception.SessionCreationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.ArrayList;
import java.util.List;

/**
 * 观察端 WebSocket 入口。
 * <p>
 * 建连即注册到扇出并推送一次快照；入站消息按 action 分发，
 * 协议错误只回给发起方一条 error 消息，连接保持。
 * </p>
 */
@Slf4j
@Component
public class SessionObserverWebSocketHandler extends TextWebSocketHandler {

    public static final String INTERNAL_ERROR_MESSAGE = "Internal error";

    private final ObserverMessageCodec messageCodec;
    private final SessionLifecycleCoordinator lifecycleCoordinator;
    private final SessionQueryService sessionQueryService;
    private final SessionNotificationFanout notificationFanout;
    private final int sendTimeLimitMs;
    private final int bufferSizeLimitBytes;

    public SessionObserverWebSocketHandler(ObserverMessageCodec messageCodec,
                                           SessionLifecycleCoordinator lifecycleCoordinator,
                                           SessionQueryService sessionQueryService,
                                           SessionNotificationFanout notificationFanout,
                                           @Value("${session-hub.fanout.send-time-limit-ms:5000}") int sendTimeLimitMs,
                                           @Value("${session-hub.fanout.buffer-size-limit-bytes:524288}") int bufferSizeLimitBytes) {
        this.messageCodec = messageCodec;
        this.lifecycleCoordinator = lifecycleCoordinator;
        this.sessionQueryService = sessionQueryService;
        this.notificationFanout = notificationFanout;
        this.sendTimeLimitMs = sendTimeLimitMs <= 0 ? 5000 : sendTimeLimitMs;
        this.bufferSizeLimitBytes = bufferSizeLimitBytes <= 0 ? 512 * 1024 : bufferSizeLimitBytes;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        notificationFanout.register(new WebSocketObserverChannel(session, sendTimeLimitMs, bufferSizeLimitBytes));
        notificationFanout.sendSnapshot(session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String channelId = session.getId();
        ObserverInboundMessage inbound;
        try {
            inbound = messageCodec.decodeInbound(message.getPayload());
        } catch (AppException ex) {
            log.warn("Observer protocol error. channelId={}, error={}", channelId, ex.getInfo());
            replyError(channelId, ex.getInfo());
            return;
        }
        try {
            ObserverOutboundMessage reply = dispatch(channelId, inbound);
            if (reply != null) {
                notificationFanout.sendTo(channelId, reply);
            }
        } catch (SessionCreationException ex) {
            replyError(channelId, ex.getInfo());
        } catch (AppException ex) {
            log.warn("Observer request rejected. channelId={}, action={}, error={}",
                    channelId, inbound.getAction(), ex.getInfo());
            replyError(channelId, ex.getInfo());
        } catch (Exception ex) {
            log.error("Observer request failed. channelId={}, action={}, error={}",
                    channelId, inbound.getAction(), ex.getMessage(), ex);
            replyError(channelId, INTERNAL_ERROR_MESSAGE);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Observer transport error. channelId={}, error={}", session.getId(), exception.getMessage());
        notificationFanout.unregister(session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        notificationFanout.unregister(session.getId());
    }

    private ObserverOutboundMessage dispatch(String channelId, ObserverInboundMessage inbound) {
        return switch (inbound.getAction()) {
            case CREATE_SESSION -> {
                lifecycleCoordinator.createSession(channelId);
                yield null;
            }
            case GET_INITIAL_DATA -> {
                notificationFanout.sendSnapshot(channelId);
                yield new AuthorizedUsersMessage(sessionQueryService.listAuthorizedUsers());
            }
            case DELETE_SESSION -> {
                lifecycleCoordinator.deleteSession(((DeleteSessionMessage) inbound).getSessionId());
                yield null;
            }
            case VALIDATE_SESSIONS -> new SessionsValidatedMessage(
                    sessionQueryService.validateSessions(collectSessionIds((ValidateSessionsMessage) inbound)));
        };
    }

    private List<String> collectSessionIds(ValidateSessionsMessage message) {
        List<String> sessionIds = new ArrayList<>();
        if (message.getSessions() == null) {
            return sessionIds;
        }
        for (SessionRefDTO ref : message.getSessions()) {
            if (ref != null && StringUtils.isNotBlank(ref.getSessionId())) {
                sessionIds.add(ref.getSessionId());
            }
        }
        return sessionIds;
    }

    private void replyError(String channelId, String message) {
        notificationFanout.sendTo(channelId, new ErrorMessage(StringUtils.defaultIfBlank(message, INTERNAL_ERROR_MESSAGE)));
    }
}
