package com.sessionhub.test.observer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sessionhub.api.dto.SessionSummaryDTO;
import com.sessionhub.api.protocol.ObserverMessageCodec;
import com.sessionhub.api.protocol.outbound.ObserverOutboundMessage;
import com.sessionhub.api.protocol.outbound.QrMessage;
import com.sessionhub.api.protocol.outbound.SessionsUpdateMessage;
import com.sessionhub.observer.connection.ObserverConnectionListener;
import com.sessionhub.observer.connection.ObserverConnectionManager;
import com.sessionhub.observer.connection.ReconnectBackoffPolicy;
import com.sessionhub.observer.store.ObservedSession;
import com.sessionhub.observer.store.ObserverSessionCache;
import com.sessionhub.observer.store.ObserverSessionStore;
import com.sessionhub.test.support.FakeObserverTransport;
import com.sessionhub.test.support.ManualObserverScheduler;
import com.sessionhub.types.enums.ObserverConnectionStateEnum;
import com.sessionhub.types.enums.SessionStatusEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class ObserverConnectionManagerTest {

    private final ObserverMessageCodec codec = ObserverMessageCodec.withDefaults();
    private final ObjectMapper objectMapper = new ObjectMapper();

    private FakeObserverTransport transport;
    private ManualObserverScheduler scheduler;
    private InMemoryCache cache;
    private ObserverConnectionManager manager;
    private List<ObserverConnectionStateEnum> states;
    private List<ObserverOutboundMessage> messages;
    private List<Integer> giveUps;

    @BeforeEach
    public void setUp() {
        transport = new FakeObserverTransport();
        scheduler = new ManualObserverScheduler();
        cache = new InMemoryCache();
        ReconnectBackoffPolicy policy = new ReconnectBackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(3), 3);
        manager = new ObserverConnectionManager(URI.create("ws://localhost:3001/ws"), transport, scheduler, policy,
                codec, new ObserverSessionStore(), cache);
        states = new CopyOnWriteArrayList<>();
        messages = new CopyOnWriteArrayList<>();
        giveUps = new CopyOnWriteArrayList<>();
        manager.addListener(new ObserverConnectionListener() {
            @Override
            public void onStateChanged(ObserverConnectionStateEnum state) {
                states.add(state);
            }

            @Override
            public void onMessage(ObserverOutboundMessage message) {
                messages.add(message);
            }

            @Override
            public void onGiveUp(int attempts) {
                giveUps.add(attempts);
            }
        });
    }

    @Test
    public void shouldRequestInitialDataOnConnect() throws Exception {
        manager.start();
        Assertions.assertEquals(ObserverConnectionStateEnum.CONNECTING, manager.getState());

        FakeObserverTransport.FakeConnection connection = transport.lastAttempt().succeed();

        Assertions.assertEquals(ObserverConnectionStateEnum.CONNECTED, manager.getState());
        Assertions.assertEquals(List.of(ObserverConnectionStateEnum.CONNECTING, ObserverConnectionStateEnum.CONNECTED),
                states);
        Assertions.assertEquals(1, connection.sent().size());
        Assertions.assertEquals("get_initial_data", actionOf(connection.sent().get(0)));
    }

    @Test
    public void shouldValidateCachedSessionsAfterConnect() throws Exception {
        cache.sessions.add(ObservedSession.builder().sessionId("session_cached").status(SessionStatusEnum.READY).build());

        manager.start();
        Assertions.assertEquals(SessionStatusEnum.READY, manager.getSessionStore().get("session_cached").getStatus());
        FakeObserverTransport.FakeConnection connection = transport.lastAttempt().succeed();

        Assertions.assertEquals(2, connection.sent().size());
        JsonNode validate = objectMapper.readTree(connection.sent().get(1));
        Assertions.assertEquals("validate_sessions", validate.get("action").asText());
        Assertions.assertEquals("session_cached", validate.get("sessions").get(0).get("sessionId").asText());
    }

    @Test
    public void shouldBackOffExponentiallyAndGiveUpOnce() {
        manager.start();
        transport.lastAttempt().fail();
        Assertions.assertTrue(scheduler.runNext());
        transport.lastAttempt().fail();
        Assertions.assertTrue(scheduler.runNext());
        transport.lastAttempt().fail();
        Assertions.assertTrue(scheduler.runNext());
        transport.lastAttempt().fail();

        Assertions.assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(3)),
                scheduler.requestedDelays());
        Assertions.assertEquals(List.of(3), giveUps);
        Assertions.assertEquals(4, transport.attemptCount());
        Assertions.assertEquals(ObserverConnectionStateEnum.DISCONNECTED, manager.getState());
        Assertions.assertFalse(scheduler.runNext());

        transport.attempt(2).transportError();
        Assertions.assertEquals(1, giveUps.size());
    }

    @Test
    public void shouldResetBackoffAfterSuccessfulConnect() {
        manager.start();
        transport.lastAttempt().fail();
        scheduler.runNext();
        transport.lastAttempt().succeed();

        transport.lastAttempt().serverClose();

        Assertions.assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(1)), scheduler.requestedDelays());
        Assertions.assertEquals(ObserverConnectionStateEnum.DISCONNECTED, manager.getState());
    }

    @Test
    public void shouldHandleCloseAndErrorOfSameConnectionOnce() {
        manager.start();
        FakeObserverTransport.Attempt attempt = transport.lastAttempt();
        attempt.succeed();

        attempt.serverClose();
        attempt.transportError();

        Assertions.assertEquals(1, scheduler.pendingCount());
        Assertions.assertEquals(1, scheduler.requestedDelays().size());
    }

    @Test
    public void shouldApplyMessagesToStoreAndCache() {
        manager.start();
        FakeObserverTransport.Attempt attempt = transport.lastAttempt();
        attempt.succeed();

        attempt.receive(codec.encode(new SessionsUpdateMessage(List.of(SessionSummaryDTO.builder()
                .sessionId("session_1")
                .status(SessionStatusEnum.PENDING)
                .build()))));
        attempt.receive(codec.encode(new QrMessage("session_1", "ABC")));
        attempt.receive("{garbage");

        Assertions.assertEquals("ABC", manager.getSessionStore().get("session_1").getQrCode());
        Assertions.assertEquals(2, messages.size());
        Assertions.assertEquals("ABC", cache.sessions.get(0).getQrCode());
    }

    @Test
    public void shouldStopWithoutReconnecting() {
        manager.start();
        FakeObserverTransport.Attempt attempt = transport.lastAttempt();
        FakeObserverTransport.FakeConnection connection = attempt.succeed();

        manager.stop();
        attempt.serverClose();

        Assertions.assertTrue(connection.isClosed());
        Assertions.assertEquals(ObserverConnectionStateEnum.DISCONNECTED, manager.getState());
        Assertions.assertEquals(0, scheduler.pendingCount());
        Assertions.assertFalse(manager.requestCreateSession());
        Assertions.assertTrue(giveUps.isEmpty());
    }

    @Test
    public void shouldSendRequestsOnlyWhileConnected() throws Exception {
        Assertions.assertFalse(manager.requestDeleteSession("session_1"));

        manager.start();
        FakeObserverTransport.FakeConnection connection = transport.lastAttempt().succeed();

        Assertions.assertTrue(manager.requestCreateSession());
        Assertions.assertTrue(manager.requestDeleteSession("session_1"));
        Assertions.assertEquals("create_session", actionOf(connection.sent().get(1)));
        JsonNode delete = objectMapper.readTree(connection.sent().get(2));
        Assertions.assertEquals("delete_session", delete.get("action").asText());
        Assertions.assertEquals("session_1", delete.get("sessionId").asText());
    }

    private String actionOf(String payload) throws Exception {
        return objectMapper.readTree(payload).get("action").asText();
    }

    private static final class InMemoryCache implements ObserverSessionCache {

        private final List<ObservedSession> sessions = new ArrayList<>();

        @Override
        public List<ObservedSession> load() {
            return new ArrayList<>(sessions);
        }

        @Override
        public void save(List<ObservedSession> snapshot) {
            sessions.clear();
            sessions.addAll(snapshot);
        }
    }
}
