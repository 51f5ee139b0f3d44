package com.sessionhub.test.observer;

import com.sessionhub.api.dto.AuthorizedUserDTO;
import com.sessionhub.api.dto.SessionSummaryDTO;
import com.sessionhub.api.dto.ValidatedSessionDTO;
import com.sessionhub.api.protocol.outbound.AuthenticatedMessage;
import com.sessionhub.api.protocol.outbound.AuthorizedUsersMessage;
import com.sessionhub.api.protocol.outbound.DisconnectedMessage;
import com.sessionhub.api.protocol.outbound.ObserverOutboundMessage;
import com.sessionhub.api.protocol.outbound.QrExpiredMessage;
import com.sessionhub.api.protocol.outbound.QrMessage;
import com.sessionhub.api.protocol.outbound.ReadyMessage;
import com.sessionhub.api.protocol.outbound.SessionCreatedMessage;
import com.sessionhub.api.protocol.outbound.SessionsUpdateMessage;
import com.sessionhub.api.protocol.outbound.SessionsValidatedMessage;
import com.sessionhub.api.protocol.outbound.StateChangeMessage;
import com.sessionhub.observer.store.ObservedSession;
import com.sessionhub.observer.store.ObserverSessionStore;
import com.sessionhub.types.enums.SessionStatusEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

public class ObserverSessionStoreTest {

    @Test
    public void shouldResetStateOnSnapshot() {
        ObserverSessionStore store = new ObserverSessionStore();
        store.apply(new QrMessage("session_old", "OLD"));

        store.apply(new SessionsUpdateMessage(List.of(summary("session_1", SessionStatusEnum.READY))));

        Assertions.assertNull(store.get("session_old"));
        Assertions.assertEquals(SessionStatusEnum.READY, store.get("session_1").getStatus());
        Assertions.assertEquals(1, store.list().size());
    }

    @Test
    public void shouldFollowIncrementalLifecycle() {
        ObserverSessionStore store = new ObserverSessionStore();

        store.apply(new SessionCreatedMessage("session_1", SessionStatusEnum.PENDING));
        store.apply(new QrMessage("session_1", "ABC"));
        Assertions.assertEquals("ABC", store.get("session_1").getQrCode());

        store.apply(new AuthenticatedMessage("session_1", "8613800000000", "8613800000000@c.us"));
        ObservedSession authenticated = store.get("session_1");
        Assertions.assertEquals(SessionStatusEnum.AUTHENTICATED, authenticated.getStatus());
        Assertions.assertEquals("8613800000000", authenticated.getPhoneNumber());
        Assertions.assertNull(authenticated.getQrCode());

        store.apply(new ReadyMessage("session_1"));
        Assertions.assertEquals(SessionStatusEnum.READY, store.get("session_1").getStatus());

        Assertions.assertTrue(store.apply(new DisconnectedMessage("session_1", "LOGOUT", LocalDateTime.now())));
        Assertions.assertNull(store.get("session_1"));
    }

    @Test
    public void shouldBeIdempotent() {
        ObserverSessionStore once = new ObserverSessionStore();
        ObserverSessionStore twice = new ObserverSessionStore();
        List<ObserverOutboundMessage> messages = List.of(
                new QrMessage("session_1", "ABC"),
                new AuthenticatedMessage("session_2", "100", "100@c.us"));

        messages.forEach(once::apply);
        messages.forEach(twice::apply);
        messages.forEach(twice::apply);

        Assertions.assertEquals(once.asMap(), twice.asMap());
    }

    @Test
    public void shouldCommuteForDistinctSessions() {
        ObserverOutboundMessage first = new QrMessage("session_1", "ABC");
        ObserverOutboundMessage second = new ReadyMessage("session_2");
        ObserverSessionStore forward = new ObserverSessionStore();
        ObserverSessionStore backward = new ObserverSessionStore();

        forward.apply(first);
        forward.apply(second);
        backward.apply(second);
        backward.apply(first);

        Assertions.assertEquals(forward.asMap(), backward.asMap());
    }

    @Test
    public void shouldOnlyClearQrOfKnownSession() {
        ObserverSessionStore store = new ObserverSessionStore();
        store.apply(new QrMessage("session_1", "ABC"));

        Assertions.assertFalse(store.apply(new QrExpiredMessage("session_unknown", "QR code expired")));
        Assertions.assertTrue(store.apply(new QrExpiredMessage("session_1", "QR code expired")));

        Assertions.assertNull(store.get("session_unknown"));
        Assertions.assertNull(store.get("session_1").getQrCode());
        Assertions.assertEquals(SessionStatusEnum.PENDING, store.get("session_1").getStatus());
    }

    @Test
    public void shouldIgnoreMessagesWithoutViewChange() {
        ObserverSessionStore store = new ObserverSessionStore();

        Assertions.assertFalse(store.apply(new StateChangeMessage("session_1", "CONNECTED")));
        Assertions.assertFalse(store.apply(null));
        Assertions.assertTrue(store.list().isEmpty());
    }

    @Test
    public void shouldDropUnconfirmedCachedSessionsAfterValidation() {
        ObserverSessionStore store = new ObserverSessionStore();
        store.loadCached(List.of(
                ObservedSession.builder().sessionId("session_alive").status(SessionStatusEnum.READY).build(),
                ObservedSession.builder().sessionId("session_gone").status(SessionStatusEnum.READY).build()));
        Assertions.assertEquals(List.of("session_alive", "session_gone"), store.unconfirmedIds());

        store.apply(new SessionsValidatedMessage(List.of(ValidatedSessionDTO.builder()
                .id("100@c.us")
                .sessionId("session_alive")
                .number("100")
                .status(SessionStatusEnum.READY)
                .build())));

        Assertions.assertNull(store.get("session_gone"));
        Assertions.assertEquals("100", store.get("session_alive").getPhoneNumber());
        Assertions.assertTrue(store.unconfirmedIds().isEmpty());
    }

    @Test
    public void shouldConfirmCachedSessionOnIncrement() {
        ObserverSessionStore store = new ObserverSessionStore();
        store.loadCached(List.of(ObservedSession.builder().sessionId("session_1").status(SessionStatusEnum.READY).build()));

        store.apply(new ReadyMessage("session_1"));

        Assertions.assertTrue(store.unconfirmedIds().isEmpty());
    }

    @Test
    public void shouldMergeAuthorizedUsers() {
        ObserverSessionStore store = new ObserverSessionStore();
        LocalDateTime lastActive = LocalDateTime.of(2024, 5, 1, 10, 0);
        store.apply(new SessionsUpdateMessage(List.of(summary("session_1", SessionStatusEnum.PENDING))));

        store.apply(new AuthorizedUsersMessage(List.of(AuthorizedUserDTO.builder()
                .id("100@c.us")
                .sessionId("session_2")
                .number("100")
                .status(SessionStatusEnum.READY)
                .lastActive(lastActive)
                .build())));

        Assertions.assertEquals(2, store.list().size());
        Assertions.assertEquals(lastActive, store.get("session_2").getLastActiveAt());
        Assertions.assertEquals(SessionStatusEnum.PENDING, store.get("session_1").getStatus());
    }

    private SessionSummaryDTO summary(String sessionId, SessionStatusEnum status) {
        return SessionSummaryDTO.builder().sessionId(sessionId).status(status).build();
    }
}
