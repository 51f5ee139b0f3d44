package com.sessionhub.observer.connection;

import com.sessionhub.api.dto.SessionRefDTO;
import com.sessionhub.api.protocol.ObserverMessageCodec;
import com.sessionhub.api.protocol.inbound.CreateSessionMessage;
import com.sessionhub.api.protocol.inbound.DeleteSessionMessage;
import com.sessionhub.api.protocol.inbound.GetInitialDataMessage;
import com.sessionhub.api.protocol.inbound.ObserverInboundMessage;
import com.sessionhub.api.protocol.inbound.ValidateSessionsMessage;
import com.sessionhub.api.protocol.outbound.ObserverOutboundMessage;
import com.sessionhub.observer.scheduler.ObserverScheduler;
import com.sessionhub.observer.store.ObservedSession;
import com.sessionhub.observer.store.ObserverSessionCache;
import com.sessionhub.observer.store.ObserverSessionStore;
import com.sessionhub.observer.transport.ObserverConnection;
import com.sessionhub.observer.transport.ObserverTransport;
import com.sessionhub.observer.transport.ObserverTransportListener;
import com.sessionhub.types.enums.ObserverConnectionStateEnum;
import com.sessionhub.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * 观察端连接管理器。
 * <p>
 * 状态机：DISCONNECTED → CONNECTING → CONNECTED，关闭或错误回到 DISCONNECTED 并按
 * {@link ReconnectBackoffPolicy} 安排下一次连接；连续失败次数达到上限后停止并回调一次放弃。
 * 每次连上都重新请求 get_initial_data，本地缓存里未确认的会话通过 validate_sessions 校验。
 * 每次连接尝试有独立序号，过期尝试的回调一律忽略，同一连接的 close 与 error 只处理一次。
 * </p>
 */
@Slf4j
public class ObserverConnectionManager {

    private final URI endpoint;
    private final ObserverTransport transport;
    private final ObserverScheduler scheduler;
    private final ReconnectBackoffPolicy backoffPolicy;
    private final ObserverMessageCodec messageCodec;
    private final ObserverSessionStore sessionStore;
    private final ObserverSessionCache sessionCache;
    private final List<ObserverConnectionListener> listeners = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();
    private ObserverConnectionStateEnum state = ObserverConnectionStateEnum.DISCONNECTED;
    private long attemptSequence;
    private int failedAttempts;
    private boolean running;
    private boolean gaveUp;
    private ObserverConnection connection;
    private ObserverScheduler.Cancellable pendingRetry;

    public ObserverConnectionManager(URI endpoint,
                                     ObserverTransport transport,
                                     ObserverScheduler scheduler,
                                     ReconnectBackoffPolicy backoffPolicy,
                                     ObserverMessageCodec messageCodec,
                                     ObserverSessionStore sessionStore,
                                     ObserverSessionCache sessionCache) {
        this.endpoint = endpoint;
        this.transport = transport;
        this.scheduler = scheduler;
        this.backoffPolicy = backoffPolicy;
        this.messageCodec = messageCodec;
        this.sessionStore = sessionStore;
        this.sessionCache = sessionCache;
    }

    public void addListener(ObserverConnectionListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public void start() {
        synchronized (lock) {
            if (running) {
                return;
            }
            running = true;
            gaveUp = false;
            failedAttempts = 0;
        }
        if (sessionCache != null) {
            sessionStore.loadCached(sessionCache.load());
        }
        connect();
    }

    public void stop() {
        ObserverConnection current;
        boolean stateChanged;
        synchronized (lock) {
            running = false;
            attemptSequence++;
            if (pendingRetry != null) {
                pendingRetry.cancel();
                pendingRetry = null;
            }
            current = connection;
            connection = null;
            stateChanged = transitTo(ObserverConnectionStateEnum.DISCONNECTED);
        }
        if (current != null) {
            current.close();
        }
        if (stateChanged) {
            notifyState(ObserverConnectionStateEnum.DISCONNECTED);
        }
    }

    public ObserverConnectionStateEnum getState() {
        synchronized (lock) {
            return state;
        }
    }

    public ObserverSessionStore getSessionStore() {
        return sessionStore;
    }

    public boolean requestCreateSession() {
        return send(new CreateSessionMessage());
    }

    public boolean requestDeleteSession(String sessionId) {
        return send(new DeleteSessionMessage(sessionId));
    }

    public boolean requestInitialData() {
        return send(new GetInitialDataMessage());
    }

    /**
     * 未连接时返回 false，不排队。
     */
    public boolean send(ObserverInboundMessage message) {
        ObserverConnection current;
        synchronized (lock) {
            current = state == ObserverConnectionStateEnum.CONNECTED ? connection : null;
        }
        if (current == null) {
            return false;
        }
        try {
            current.send(messageCodec.encode(message));
            return true;
        } catch (RuntimeException ex) {
            log.warn("Observer send failed. action={}, error={}", message.getAction(), ex.getMessage());
            return false;
        }
    }

    private void connect() {
        long sequence;
        boolean stateChanged;
        synchronized (lock) {
            if (!running) {
                return;
            }
            pendingRetry = null;
            sequence = ++attemptSequence;
            stateChanged = transitTo(ObserverConnectionStateEnum.CONNECTING);
        }
        if (stateChanged) {
            notifyState(ObserverConnectionStateEnum.CONNECTING);
        }
        CompletableFuture<ObserverConnection> future;
        try {
            future = transport.connect(endpoint, new AttemptListener(sequence));
        } catch (RuntimeException ex) {
            onConnectionLost(sequence, ex);
            return;
        }
        future.whenComplete((opened, error) -> {
            if (error != null) {
                onConnectionLost(sequence, error);
            } else {
                onConnected(sequence, opened);
            }
        });
    }

    private void onConnected(long sequence, ObserverConnection opened) {
        synchronized (lock) {
            if (sequence != attemptSequence || !running) {
                opened.close();
                return;
            }
            connection = opened;
            failedAttempts = 0;
            transitTo(ObserverConnectionStateEnum.CONNECTED);
        }
        notifyState(ObserverConnectionStateEnum.CONNECTED);
        log.info("Observer connected. endpoint={}", endpoint);
        requestInitialData();
        List<String> unconfirmed = sessionStore.unconfirmedIds();
        if (!unconfirmed.isEmpty()) {
            send(new ValidateSessionsMessage(unconfirmed.stream()
                    .map(SessionRefDTO::new)
                    .collect(Collectors.toList())));
        }
    }

    private void onConnectionLost(long sequence, Throwable error) {
        boolean giveUp = false;
        boolean stateChanged;
        int attempts;
        synchronized (lock) {
            if (sequence != attemptSequence) {
                return;
            }
            attemptSequence++;
            connection = null;
            stateChanged = transitTo(ObserverConnectionStateEnum.DISCONNECTED);
            if (!running) {
                return;
            }
            if (backoffPolicy.hasAttemptsLeft(failedAttempts)) {
                failedAttempts++;
                Duration delay = backoffPolicy.delayForAttempt(failedAttempts);
                pendingRetry = scheduler.schedule(this::connect, delay);
                log.info("Observer disconnected, retry scheduled. attempt={}, delayMs={}, error={}",
                        failedAttempts, delay.toMillis(), error == null ? "-" : error.getMessage());
            } else {
                running = false;
                giveUp = !gaveUp;
                gaveUp = true;
            }
            attempts = failedAttempts;
        }
        if (stateChanged) {
            notifyState(ObserverConnectionStateEnum.DISCONNECTED);
        }
        if (giveUp) {
            log.warn("Observer gave up reconnecting. endpoint={}, attempts={}", endpoint, attempts);
            for (ObserverConnectionListener listener : listeners) {
                listener.onGiveUp(attempts);
            }
        }
    }

    private void onText(long sequence, String text) {
        synchronized (lock) {
            if (sequence != attemptSequence) {
                return;
            }
        }
        ObserverOutboundMessage message;
        try {
            message = messageCodec.decodeOutbound(text);
        } catch (AppException ex) {
            log.warn("Observer received undecodable message. error={}", ex.getInfo());
            return;
        }
        if (sessionStore.apply(message) && sessionCache != null) {
            List<ObservedSession> snapshot = sessionStore.list();
            sessionCache.save(snapshot);
        }
        for (ObserverConnectionListener listener : listeners) {
            listener.onMessage(message);
        }
    }

    /**
     * 调用方需持有 lock。
     */
    private boolean transitTo(ObserverConnectionStateEnum next) {
        if (state == next) {
            return false;
        }
        state = next;
        return true;
    }

    private void notifyState(ObserverConnectionStateEnum next) {
        for (ObserverConnectionListener listener : listeners) {
            listener.onStateChanged(next);
        }
    }

    private final class AttemptListener implements ObserverTransportListener {

        private final long sequence;

        private AttemptListener(long sequence) {
            this.sequence = sequence;
        }

        @Override
        public void onText(String text) {
            ObserverConnectionManager.this.onText(sequence, text);
        }

        @Override
        public void onClosed(int statusCode, String reason) {
            onConnectionLost(sequence, null);
        }

        @Override
        public void onError(Throwable error) {
            onConnectionLost(sequence, error);
        }
    }
}
