package com.sessionhub.test;

import com.sessionhub.api.protocol.outbound.AuthenticatedMessage;
import com.sessionhub.api.protocol.outbound.ObserverOutboundMessage;
import com.sessionhub.api.protocol.outbound.QrMessage;
import com.sessionhub.api.protocol.outbound.SessionCreatedMessage;
import com.sessionhub.api.protocol.outbound.SessionsUpdateMessage;
import com.sessionhub.observer.store.ObserverSessionStore;
import com.sessionhub.test.support.FakeAutomationClient;
import com.sessionhub.test.support.SessionHubTestContext;
import com.sessionhub.trigger.http.AuthorizedUserController;
import com.sessionhub.trigger.http.GlobalApiExceptionHandler;
import com.sessionhub.trigger.http.HealthController;
import com.sessionhub.trigger.http.SessionController;
import com.sessionhub.types.enums.SessionStatusEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 观察端创建会话、扫码登录、就绪、经 REST 删除的完整链路。
 */
public class SessionLifecycleEndToEndTest {

    private SessionHubTestContext context;
    private MockMvc mockMvc;
    private WebSocketSession session;
    private List<String> sent;

    @BeforeEach
    public void setUp() throws Exception {
        context = new SessionHubTestContext();
        mockMvc = MockMvcBuilders.standaloneSetup(
                        new SessionController(context.queryService, context.coordinator),
                        new AuthorizedUserController(context.queryService),
                        new HealthController(context.queryService))
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
        sent = new CopyOnWriteArrayList<>();
        session = Mockito.mock(WebSocketSession.class);
        when(session.getId()).thenReturn("ws-e2e");
        when(session.isOpen()).thenReturn(true);
        doAnswer(invocation -> {
            WebSocketMessage<?> message = invocation.getArgument(0);
            sent.add(String.valueOf(message.getPayload()));
            return null;
        }).when(session).sendMessage(any());
        context.webSocketHandler.afterConnectionEstablished(session);
    }

    @Test
    public void shouldDriveSessionFromCreationToDeletion() throws Exception {
        context.webSocketHandler.handleMessage(session, new TextMessage("{\"action\":\"create_session\"}"));
        SessionCreatedMessage created = lastOf(SessionCreatedMessage.class);
        Assertions.assertEquals(SessionStatusEnum.PENDING, created.getStatus());
        String sessionId = created.getSessionId();
        FakeAutomationClient client = context.clientFactory.clientOf(sessionId);

        client.emitQr("ABC");
        Assertions.assertEquals("ABC", lastOf(QrMessage.class).getQrCode());

        client.emitAuthenticated("8613800000000");
        int qrCount = countOf(QrMessage.class);
        client.emitQr("LATE");
        Assertions.assertEquals(qrCount, countOf(QrMessage.class));
        Assertions.assertEquals("8613800000000", lastOf(AuthenticatedMessage.class).getPhoneNumber());

        client.emitReady();
        Assertions.assertEquals(SessionStatusEnum.READY,
                lastOf(SessionsUpdateMessage.class).getSessions().get(0).getStatus());
        Assertions.assertEquals(SessionStatusEnum.READY, context.repository.findBySessionId(sessionId).getStatus());

        ObserverSessionStore observerView = replayInto(new ObserverSessionStore());
        Assertions.assertEquals(SessionStatusEnum.READY, observerView.get(sessionId).getStatus());
        Assertions.assertNull(observerView.get(sessionId).getQrCode());

        mockMvc.perform(get("/api/authorized-users"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(1)))
                .andExpect(jsonPath("$.data[0].number").value("8613800000000"));

        mockMvc.perform(delete("/api/sessions/" + sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value(true));

        mockMvc.perform(get("/api/sessions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(0)));
        Assertions.assertEquals(1, client.getDestroyCount());
        Assertions.assertNull(context.repository.findBySessionId(sessionId));
        Assertions.assertTrue(lastOf(SessionsUpdateMessage.class).getSessions().isEmpty());
        Assertions.assertTrue(replayInto(new ObserverSessionStore()).list().isEmpty());
    }

    private ObserverSessionStore replayInto(ObserverSessionStore store) {
        for (ObserverOutboundMessage message : received()) {
            store.apply(message);
        }
        return store;
    }

    private List<ObserverOutboundMessage> received() {
        List<ObserverOutboundMessage> messages = new ArrayList<>();
        for (String payload : sent) {
            messages.add(context.codec.decodeOutbound(payload));
        }
        return messages;
    }

    private int countOf(Class<? extends ObserverOutboundMessage> type) {
        return (int) received().stream().filter(type::isInstance).count();
    }

    private <T extends ObserverOutboundMessage> T lastOf(Class<T> type) {
        T last = null;
        for (ObserverOutboundMessage message : received()) {
            if (type.isInstance(message)) {
                last = type.cast(message);
            }
        }
        return last;
    }
}
