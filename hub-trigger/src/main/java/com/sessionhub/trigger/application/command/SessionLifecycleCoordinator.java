package com.sessionhub.trigger.application.command;

import com.sessionhub.api.protocol.outbound.AuthFailureMessage;
import com.sessionhub.api.protocol.outbound.AuthenticatedMessage;
import com.sessionhub.api.protocol.outbound.DisconnectedMessage;
import com.sessionhub.api.protocol.outbound.IncomingChatMessage;
import com.sessionhub.api.protocol.outbound.QrExpiredMessage;
import com.sessionhub.api.protocol.outbound.QrMessage;
import com.sessionhub.api.protocol.outbound.ReadyMessage;
import com.sessionhub.api.protocol.outbound.SessionCreatedMessage;
import com.sessionhub.api.protocol.outbound.StateChangeMessage;
import com.sessionhub.domain.session.adapter.gateway.IAutomationClient;
import com.sessionhub.domain.session.adapter.gateway.IAutomationClientFactory;
import com.sessionhub.domain.session.adapter.gateway.IAutomationEventListener;
import com.sessionhub.domain.session.adapter.repository.ISessionRecordRepository;
import com.sessionhub.domain.session.model.entity.SessionEntity;
import com.sessionhub.domain.session.model.entity.SessionRecordEntity;
import com.sessionhub.domain.session.model.valobj.AutomationEvent;
import com.sessionhub.domain.session.model.valobj.SessionChange;
import com.sessionhub.domain.session.model.valobj.SessionPatch;
import com.sessionhub.domain.session.service.SessionRegistry;
import com.sessionhub.domain.session.service.SessionTransitionDomainService;
import com.sessionhub.trigger.application.common.StripedSerialExecutor;
import com.sessionhub.trigger.event.SessionNotificationFanout;
import com.sessionhub.types.common.Constants;
import com.sessionhub.types.enums.ResponseCode;
import com.sessionhub.types.enums.SessionStatusEnum;
import com.sessionhub.types.exception.AppException;
import com.sessionhub.types.exception.SessionCreationException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;

/**
 * 会话生命周期协调器：消费自动化客户端事件，驱动注册表状态迁移，并调度持久化与通知。
 * <p>
 * 迁移规则由 {@link SessionTransitionDomainService} 计算；前置条件不满足的事件记 WARN 后忽略。
 * 持久化在按会话串行的执行器上异步完成，失败只记日志不回滚；
 * 通知全部交给 {@link SessionNotificationFanout} 入队，不在事件线程上阻塞。
 * </p>
 */
@Slf4j
@Service
public class SessionLifecycleCoordinator {

    public static final String QR_EXPIRED_MESSAGE = "QR code expired";
    public static final String SESSION_CREATE_FAILED_MESSAGE = "Failed to create session";
    private static final String DEFAULT_AUTH_FAILURE_MESSAGE = "Authentication failed";
    private static final String DEFAULT_DISCONNECT_REASON = "unknown";
    private static final int SIDE_EFFECT_STRIPES = 16;

    private final SessionRegistry sessionRegistry;
    private final SessionTransitionDomainService transitionDomainService;
    private final ISessionRecordRepository sessionRecordRepository;
    private final IAutomationClientFactory automationClientFactory;
    private final SessionNotificationFanout notificationFanout;
    private final TaskScheduler qrExpiryScheduler;
    private final StripedSerialExecutor sideEffectExecutor;
    private final Clock clock;
    private final Duration qrTtl;
    private final MeterRegistry meterRegistry;
    private volatile boolean shuttingDown;

    public SessionLifecycleCoordinator(SessionRegistry sessionRegistry,
                                       SessionTransitionDomainService transitionDomainService,
                                       ISessionRecordRepository sessionRecordRepository,
                                       IAutomationClientFactory automationClientFactory,
                                       SessionNotificationFanout notificationFanout,
                                       @Qualifier("qrExpiryScheduler") TaskScheduler qrExpiryScheduler,
                                       @Qualifier("sessionSideEffectExecutor") Executor sideEffectExecutor,
                                       Clock clock,
                                       ObjectProvider<MeterRegistry> meterRegistryProvider,
                                       @Value("${session-hub.qr-ttl-seconds:" + Constants.DEFAULT_QR_TTL_SECONDS + "}") long qrTtlSeconds) {
        this.sessionRegistry = sessionRegistry;
        this.transitionDomainService = transitionDomainService;
        this.sessionRecordRepository = sessionRecordRepository;
        this.automationClientFactory = automationClientFactory;
        this.notificationFanout = notificationFanout;
        this.qrExpiryScheduler = qrExpiryScheduler;
        this.sideEffectExecutor = new StripedSerialExecutor("session-side-effect", sideEffectExecutor, SIDE_EFFECT_STRIPES);
        this.clock = clock;
        this.qrTtl = Duration.ofSeconds(qrTtlSeconds <= 0 ? Constants.DEFAULT_QR_TTL_SECONDS : qrTtlSeconds);
        this.meterRegistry = meterRegistryProvider.getIfAvailable(SimpleMeterRegistry::new);
    }

    @PostConstruct
    public void start() {
        notificationFanout.addChannelClosedListener(this::onObserverClosed);
    }

    /**
     * 创建会话并启动自动化客户端。
     * session_created 先于该会话的任何事件推送给创建方。
     *
     * @return 新会话 ID
     * @throws SessionCreationException 客户端创建或启动失败，此时会话已被清理
     */
    public String createSession(String observerChannelId) {
        SessionEntity session = sessionRegistry.create(observerChannelId);
        String sessionId = session.getId();
        GatedEventListener listener = new GatedEventListener(sessionId, false);
        try {
            IAutomationClient client = automationClientFactory.create(sessionId, session.getClientId());
            sessionRegistry.update(sessionId, SessionPatch.builder().automationClient(client).build());
            client.initialize(listener);
        } catch (Exception ex) {
            listener.discard();
            teardown(sessionId, "provisioning failed");
            log.error("Session provisioning failed. sessionId={}, error={}", sessionId, ex.getMessage(), ex);
            throw new SessionCreationException(SESSION_CREATE_FAILED_MESSAGE, ex);
        }
        SessionEntity created = sessionRegistry.get(sessionId);
        if (created != null) {
            persistAsync(created);
        }
        notificationFanout.sendTo(observerChannelId, new SessionCreatedMessage(sessionId, SessionStatusEnum.PENDING));
        listener.open();
        log.info("Session created. sessionId={}, clientId={}, observerChannelId={}",
                sessionId, session.getClientId(), observerChannelId);
        return sessionId;
    }

    /**
     * 显式删除：销毁客户端、移除注册表项并删除持久化记录。会话不存在时只清理持久化记录。
     *
     * @return 注册表中是否存在该会话
     */
    public boolean deleteSession(String sessionId) {
        if (StringUtils.isBlank(sessionId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "sessionId is required");
        }
        SessionEntity removed = teardown(sessionId, "deleted");
        deleteRecordAsync(sessionId);
        return removed != null;
    }

    /**
     * 观察端断开只解除弱引用，会话本身继续存活。
     */
    public void onObserverClosed(String channelId) {
        for (SessionEntity session : sessionRegistry.listByObserverChannel(channelId)) {
            sessionRegistry.apply(session.getId(),
                    current -> transitionDomainService.planDetachObserver(current, channelId));
        }
    }

    /**
     * 按持久化的 READY 记录恢复会话；恢复失败的记录会被删除。
     *
     * @return 成功恢复的会话数
     */
    public int restorePersistedSessions() {
        List<SessionRecordEntity> records;
        try {
            records = sessionRecordRepository.findByStatus(SessionStatusEnum.READY);
        } catch (Exception ex) {
            log.warn("Load persisted sessions failed, skip restore. error={}", ex.getMessage());
            return 0;
        }
        int restored = 0;
        for (SessionRecordEntity record : records) {
            if (restoreSession(record)) {
                restored++;
            }
        }
        log.info("Persisted sessions restored. candidates={}, restored={}", records.size(), restored);
        return restored;
    }

    /**
     * 停机时取消所有二维码定时器并销毁客户端，持久化记录保留以便下次启动恢复。
     */
    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
        List<SessionEntity> sessions = sessionRegistry.listAll();
        for (SessionEntity session : sessions) {
            teardown(session.getId(), "shutdown");
        }
        if (!sessions.isEmpty()) {
            log.info("Session hub shutdown, sessions released. count={}", sessions.size());
        }
    }

    private boolean restoreSession(SessionRecordEntity record) {
        SessionEntity session = transitionDomainService.restore(record, now());
        if (session == null) {
            return false;
        }
        String sessionId = session.getId();
        SessionEntity previous = sessionRegistry.put(session);
        if (previous != null) {
            cancelQuietly(previous.getQrExpiryHandle());
            destroyQuietly(previous);
        }
        try {
            IAutomationClient client = automationClientFactory.create(sessionId, session.getClientId());
            sessionRegistry.update(sessionId, SessionPatch.builder().automationClient(client).build());
            client.initialize(new GatedEventListener(sessionId, true));
            log.info("Session restored. sessionId={}, clientId={}", sessionId, session.getClientId());
            return true;
        } catch (Exception ex) {
            log.warn("Session restore failed, purging record. sessionId={}, error={}", sessionId, ex.getMessage());
            teardown(sessionId, "restore failed");
            deleteRecordAsync(sessionId);
            return false;
        }
    }

    private void handleEvent(String sessionId, AutomationEvent event) {
        if (event == null || event.getType() == null) {
            return;
        }
        boolean applied;
        try {
            applied = switch (event.getType()) {
                case QR -> onQr(sessionId, event);
                case AUTHENTICATED -> onAuthenticated(sessionId, event);
                case READY -> onReady(sessionId, event);
                case AUTH_FAILURE -> onAuthFailure(sessionId, event);
                case DISCONNECTED -> onDisconnected(sessionId, event);
                case STATE_CHANGE -> onStateChange(sessionId, event);
                case MESSAGE -> onMessage(sessionId, event);
            };
        } catch (Exception ex) {
            log.warn("Automation event handling failed. sessionId={}, type={}, error={}",
                    sessionId, event.getType(), ex.getMessage(), ex);
            return;
        }
        if (applied) {
            Counter.builder("hub.session.transition.total")
                    .tag("event", event.getType().getEventName())
                    .register(meterRegistry)
                    .increment();
        }
    }

    private boolean onQr(String sessionId, AutomationEvent event) {
        LocalDateTime now = now();
        SessionChange change = sessionRegistry.apply(sessionId,
                current -> transitionDomainService.planQr(current, event.getQrCode(), now));
        if (change == null) {
            return ignore(sessionId, event);
        }
        cancelQuietly(change.getBefore().getQrExpiryHandle());
        long generation = change.getAfter().getQrGeneration();
        ScheduledFuture<?> handle = qrExpiryScheduler.schedule(() -> expireQr(sessionId, generation),
                clock.instant().plus(qrTtl));
        SessionChange stored = sessionRegistry.apply(sessionId,
                current -> transitionDomainService.planQrExpiryHandle(current, generation, handle));
        if (stored == null) {
            cancelQuietly(handle);
        }
        persistAsync(change.getAfter());
        notificationFanout.broadcast(new QrMessage(sessionId, event.getQrCode()));
        log.info("QR received. sessionId={}, generation={}", sessionId, generation);
        return true;
    }

    private void expireQr(String sessionId, long generation) {
        SessionChange change = sessionRegistry.apply(sessionId,
                current -> transitionDomainService.planQrExpiry(current, generation));
        if (change == null) {
            log.debug("Stale QR expiry ignored. sessionId={}, generation={}", sessionId, generation);
            return;
        }
        persistAsync(change.getAfter());
        notificationFanout.broadcast(new QrExpiredMessage(sessionId, QR_EXPIRED_MESSAGE));
        log.info("QR expired. sessionId={}, generation={}", sessionId, generation);
    }

    private boolean onAuthenticated(String sessionId, AutomationEvent event) {
        LocalDateTime now = now();
        SessionChange change = sessionRegistry.apply(sessionId,
                current -> transitionDomainService.planAuthenticated(current, event.getPhoneNumber(), now));
        if (change == null) {
            return ignore(sessionId, event);
        }
        cancelQuietly(change.getBefore().getQrExpiryHandle());
        persistAsync(change.getAfter());
        notificationFanout.broadcast(new AuthenticatedMessage(sessionId,
                change.getAfter().getPhoneNumber(), event.getSerializedId()));
        log.info("Session authenticated. sessionId={}, phoneNumber={}", sessionId, change.getAfter().getPhoneNumber());
        return true;
    }

    private boolean onReady(String sessionId, AutomationEvent event) {
        LocalDateTime now = now();
        SessionChange change = sessionRegistry.apply(sessionId,
                current -> transitionDomainService.planReady(current, event.getPhoneNumber(), now));
        if (change == null) {
            return ignore(sessionId, event);
        }
        persistAsync(change.getAfter());
        notificationFanout.broadcast(new ReadyMessage(sessionId));
        log.info("Session ready. sessionId={}", sessionId);
        return true;
    }

    private boolean onAuthFailure(String sessionId, AutomationEvent event) {
        if (!transitionDomainService.acceptsAuthFailure(sessionRegistry.get(sessionId))) {
            return ignore(sessionId, event);
        }
        String message = StringUtils.defaultIfBlank(event.getMessage(), DEFAULT_AUTH_FAILURE_MESSAGE);
        notificationFanout.broadcast(new AuthFailureMessage(sessionId, message));
        log.warn("Session auth failure. sessionId={}, message={}", sessionId, message);
        return true;
    }

    private boolean onDisconnected(String sessionId, AutomationEvent event) {
        String reason = StringUtils.defaultIfBlank(event.getReason(), DEFAULT_DISCONNECT_REASON);
        SessionEntity removed = teardown(sessionId, reason);
        if (removed == null) {
            return ignore(sessionId, event);
        }
        deleteRecordAsync(sessionId);
        notificationFanout.broadcast(new DisconnectedMessage(sessionId, reason, now()));
        return true;
    }

    private boolean onStateChange(String sessionId, AutomationEvent event) {
        SessionEntity session = sessionRegistry.get(sessionId);
        if (session == null) {
            return ignore(sessionId, event);
        }
        log.info("Session state changed. sessionId={}, state={}", sessionId, event.getState());
        notificationFanout.sendTo(session.getObserverChannelId(), new StateChangeMessage(sessionId, event.getState()));
        return true;
    }

    private boolean onMessage(String sessionId, AutomationEvent event) {
        if (event.isFromMe()) {
            return false;
        }
        SessionEntity session = sessionRegistry.get(sessionId);
        if (session == null) {
            return ignore(sessionId, event);
        }
        notificationFanout.sendTo(session.getObserverChannelId(),
                new IncomingChatMessage(sessionId, event.getFrom(), event.getBody(), event.getTimestamp()));
        return true;
    }

    private boolean ignore(String sessionId, AutomationEvent event) {
        SessionEntity current = sessionRegistry.get(sessionId);
        log.warn("Automation event ignored, precondition not met. sessionId={}, type={}, status={}",
                sessionId, event.getType(), current == null ? "absent" : current.getStatus());
        return false;
    }

    /**
     * 移除会话并释放其资源，幂等；只有真正移除的调用会销毁客户端。
     */
    private SessionEntity teardown(String sessionId, String reason) {
        SessionEntity removed = sessionRegistry.remove(sessionId);
        if (removed == null) {
            return null;
        }
        cancelQuietly(removed.getQrExpiryHandle());
        destroyQuietly(removed);
        log.info("Session torn down. sessionId={}, status={}, reason={}", sessionId, removed.getStatus(), reason);
        return removed;
    }

    private void destroyQuietly(SessionEntity session) {
        IAutomationClient client = session.getAutomationClient();
        if (client == null) {
            return;
        }
        try {
            client.destroy();
        } catch (Exception ex) {
            log.warn("Automation client destroy failed. sessionId={}, error={}", session.getId(), ex.getMessage());
        }
    }

    private void cancelQuietly(Future<?> handle) {
        if (handle != null) {
            handle.cancel(false);
        }
    }

    /**
     * 写入在会话所在条带上执行；执行时会话已被移除则跳过，避免删除之后又把记录写回。
     */
    private void persistAsync(SessionEntity snapshot) {
        SessionRecordEntity record = SessionRecordEntity.snapshotOf(snapshot);
        sideEffectExecutor.execute(snapshot.getId(), () -> {
            if (!shuttingDown && !sessionRegistry.contains(record.getSessionId())) {
                log.debug("Session gone, record write skipped. sessionId={}, status={}",
                        record.getSessionId(), record.getStatus());
                return;
            }
            try {
                sessionRecordRepository.upsert(record);
            } catch (Exception ex) {
                log.warn("Persist session record failed. sessionId={}, status={}, error={}",
                        record.getSessionId(), record.getStatus(), ex.getMessage());
            }
        });
    }

    private void deleteRecordAsync(String sessionId) {
        sideEffectExecutor.execute(sessionId, () -> {
            try {
                sessionRecordRepository.deleteBySessionId(sessionId);
            } catch (Exception ex) {
                log.warn("Delete session record failed. sessionId={}, error={}", sessionId, ex.getMessage());
            }
        });
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    /**
     * 创建期间先缓存客户端事件，待 session_created 入队后再按序放行。
     */
    private final class GatedEventListener implements IAutomationEventListener {

        private final String sessionId;
        private List<AutomationEvent> buffered = new ArrayList<>();
        private boolean open;
        private boolean discarded;

        private GatedEventListener(String sessionId, boolean open) {
            this.sessionId = sessionId;
            this.open = open;
        }

        @Override
        public synchronized void onEvent(AutomationEvent event) {
            if (discarded) {
                return;
            }
            if (!open) {
                buffered.add(event);
                return;
            }
            handleEvent(sessionId, event);
        }

        private synchronized void open() {
            if (open || discarded) {
                return;
            }
            open = true;
            List<AutomationEvent> pending = buffered;
            buffered = null;
            for (AutomationEvent event : pending) {
                handleEvent(sessionId, event);
            }
        }

        private synchronized void discard() {
            discarded = true;
            buffered = null;
        }
    }
}
