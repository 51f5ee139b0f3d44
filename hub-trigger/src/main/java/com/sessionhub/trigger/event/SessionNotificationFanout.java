package com.sessionhub.trigger.event;

import com.sessionhub.api.dto.SessionSummaryDTO;
import com.sessionhub.api.protocol.ObserverMessageCodec;
import com.sessionhub.api.protocol.outbound.ObserverOutboundMessage;
import com.sessionhub.api.protocol.outbound.SessionsUpdateMessage;
import com.sessionhub.domain.session.model.valobj.SessionChange;
import com.sessionhub.domain.session.service.ISessionChangeListener;
import com.sessionhub.domain.session.service.SessionRegistry;
import com.sessionhub.trigger.application.common.SerialTaskQueue;
import com.sessionhub.trigger.application.common.SessionViewAssembler;
import com.sessionhub.trigger.websocket.ObserverChannel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * 会话通知扇出。
 * <p>
 * 每个观察端通道一个有界串行队列：同一通道内消息有序，通道之间互不影响；
 * 已关闭或积压超限的通道直接跳过，发送失败的通道被摘除。
 * 注册表变更只触发一次合并后的 sessions_update 快照广播，快照在投递线程上生成。
 * </p>
 */
@Slf4j
@Component
public class SessionNotificationFanout implements ISessionChangeListener {

    private final SessionRegistry sessionRegistry;
    private final SessionViewAssembler sessionViewAssembler;
    private final ObserverMessageCodec messageCodec;
    private final Executor deliveryExecutor;
    private final int maxPendingPerChannel;
    private final ConcurrentMap<String, ChannelState> channels = new ConcurrentHashMap<>();
    private final List<Consumer<String>> channelClosedListeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean snapshotScheduled = new AtomicBoolean(false);
    private final Object snapshotLock = new Object();
    private final Counter pushAttemptCounter;
    private final Counter pushFailCounter;
    private final Counter pushSkipCounter;

    public SessionNotificationFanout(SessionRegistry sessionRegistry,
                                     SessionViewAssembler sessionViewAssembler,
                                     ObserverMessageCodec messageCodec,
                                     @Qualifier("fanoutExecutor") Executor deliveryExecutor,
                                     ObjectProvider<MeterRegistry> meterRegistryProvider,
                                     @Value("${session-hub.fanout.max-pending-per-channel:64}") int maxPendingPerChannel) {
        this.sessionRegistry = sessionRegistry;
        this.sessionViewAssembler = sessionViewAssembler;
        this.messageCodec = messageCodec;
        this.deliveryExecutor = deliveryExecutor;
        this.maxPendingPerChannel = maxPendingPerChannel <= 0 ? 64 : maxPendingPerChannel;
        MeterRegistry meterRegistry = meterRegistryProvider.getIfAvailable(SimpleMeterRegistry::new);
        this.pushAttemptCounter = Counter.builder("hub.fanout.push.attempt.total").register(meterRegistry);
        this.pushFailCounter = Counter.builder("hub.fanout.push.fail.total").register(meterRegistry);
        this.pushSkipCounter = Counter.builder("hub.fanout.push.skip.total").register(meterRegistry);
    }

    @PostConstruct
    public void start() {
        sessionRegistry.registerChangeListener(this);
    }

    public void addChannelClosedListener(Consumer<String> listener) {
        if (listener != null) {
            channelClosedListeners.add(listener);
        }
    }

    public void register(ObserverChannel channel) {
        ChannelState previous = channels.put(channel.getId(),
                new ChannelState(channel, new SerialTaskQueue("observer-" + channel.getId(), deliveryExecutor,
                        maxPendingPerChannel)));
        if (previous != null && previous.channel != channel) {
            previous.channel.close();
        }
        log.info("Observer channel registered. channelId={}, channels={}", channel.getId(), channels.size());
    }

    /**
     * 摘除通道并通知关闭监听者，重复调用无副作用。
     */
    public void unregister(String channelId) {
        if (channelId == null) {
            return;
        }
        ChannelState removed = channels.remove(channelId);
        if (removed != null) {
            notifyClosed(channelId);
        }
    }

    private void drop(ChannelState state) {
        if (channels.remove(state.channel.getId(), state)) {
            notifyClosed(state.channel.getId());
        }
    }

    private void notifyClosed(String channelId) {
        log.info("Observer channel unregistered. channelId={}, channels={}", channelId, channels.size());
        for (Consumer<String> listener : channelClosedListeners) {
            try {
                listener.accept(channelId);
            } catch (Exception ex) {
                log.warn("Channel closed listener failed. channelId={}, error={}", channelId, ex.getMessage());
            }
        }
    }

    public int channelCount() {
        return channels.size();
    }

    /**
     * 投递给当前所有打开的通道，返回成功入队的通道数。
     */
    public int broadcast(ObserverOutboundMessage message) {
        if (message == null || channels.isEmpty()) {
            return 0;
        }
        String payload = messageCodec.encode(message);
        int enqueued = 0;
        for (ChannelState state : channels.values()) {
            if (enqueue(state, payload, message)) {
                enqueued++;
            }
        }
        return enqueued;
    }

    public boolean sendTo(String channelId, ObserverOutboundMessage message) {
        if (channelId == null || message == null) {
            return false;
        }
        ChannelState state = channels.get(channelId);
        if (state == null) {
            log.debug("Observer channel absent, message suppressed. channelId={}, action={}",
                    channelId, message.getAction());
            return false;
        }
        return enqueue(state, messageCodec.encode(message), message);
    }

    public boolean sendSnapshot(String channelId) {
        synchronized (snapshotLock) {
            return sendTo(channelId, buildSnapshot());
        }
    }

    /**
     * 合并快照广播：已有待执行的快照任务时不重复提交。
     * <p>
     * 快照的构建与入队在同一把锁内完成，入队顺序与构建顺序一致，
     * 较旧的快照不会排在较新的快照之后。
     * </p>
     */
    public void broadcastSnapshot() {
        if (channels.isEmpty() || !snapshotScheduled.compareAndSet(false, true)) {
            return;
        }
        try {
            deliveryExecutor.execute(() -> {
                snapshotScheduled.set(false);
                synchronized (snapshotLock) {
                    broadcast(buildSnapshot());
                }
            });
        } catch (RejectedExecutionException ex) {
            snapshotScheduled.set(false);
            log.warn("Snapshot broadcast rejected by executor: {}", ex.getMessage());
        }
    }

    @Override
    public void onSessionChanged(SessionChange change) {
        SessionSummaryDTO before = sessionViewAssembler.toSummary(change.getBefore());
        SessionSummaryDTO after = sessionViewAssembler.toSummary(change.getAfter());
        if (!Objects.equals(before, after)) {
            broadcastSnapshot();
        }
    }

    private SessionsUpdateMessage buildSnapshot() {
        return new SessionsUpdateMessage(sessionViewAssembler.toSummaries(sessionRegistry.listAll()));
    }

    private boolean enqueue(ChannelState state, String payload, ObserverOutboundMessage message) {
        if (!state.channel.isOpen()) {
            pushSkipCounter.increment();
            drop(state);
            return false;
        }
        boolean accepted = state.queue.offer(() -> deliver(state, payload));
        if (!accepted) {
            pushSkipCounter.increment();
            log.debug("Observer channel backpressured, message skipped. channelId={}, action={}, pending={}",
                    state.channel.getId(), message.getAction(), state.queue.pendingSize());
        }
        return accepted;
    }

    private void deliver(ChannelState state, String payload) {
        if (channels.get(state.channel.getId()) != state) {
            return;
        }
        pushAttemptCounter.increment();
        try {
            state.channel.send(payload);
        } catch (IOException | RuntimeException ex) {
            pushFailCounter.increment();
            log.debug("Observer push failed, dropping channel. channelId={}, error={}",
                    state.channel.getId(), ex.getMessage());
            state.channel.close();
            drop(state);
        }
    }

    private static final class ChannelState {
        private final ObserverChannel channel;
        private final SerialTaskQueue queue;

        private ChannelState(ObserverChannel channel, SerialTaskQueue queue) {
            this.channel = channel;
            this.queue = queue;
        }
    }
}
