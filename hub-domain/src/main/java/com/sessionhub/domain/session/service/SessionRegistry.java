package com.sessionhub.domain.session.service;

import com.sessionhub.domain.session.model.entity.SessionEntity;
import com.sessionhub.domain.session.model.valobj.SessionChange;
import com.sessionhub.domain.session.model.valobj.SessionPatch;
import com.sessionhub.types.common.Constants;
import com.sessionhub.types.enums.SessionStatusEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * 会话注册表：进程内唯一的会话归属方。
 * <p>
 * 同一会话的写入通过 {@link ConcurrentHashMap#computeIfPresent} 串行化，不同会话互不阻塞；
 * 读取返回副本，调用方拿不到半更新状态。每次成功写入后同步回调 {@link ISessionChangeListener}。
 * </p>
 *
 * @author sessionhub
 * @since 2026-10-19
 */
@Slf4j
@Service
public class SessionRegistry {

    private final ConcurrentMap<String, SessionEntity> sessions = new ConcurrentHashMap<>();
    private final List<ISessionChangeListener> changeListeners = new CopyOnWriteArrayList<>();
    private final Clock clock;
    private final String idPrefix;

    public SessionRegistry(Clock clock,
                           @Value("${session-hub.id-prefix:" + Constants.SESSION_ID_PREFIX + "}") String idPrefix) {
        this.clock = clock;
        this.idPrefix = StringUtils.defaultIfBlank(idPrefix, Constants.SESSION_ID_PREFIX);
    }

    public void registerChangeListener(ISessionChangeListener listener) {
        if (listener != null) {
            changeListeners.add(listener);
        }
    }

    /**
     * 分配新 ID 并登记 PENDING 会话。同一毫秒内重复创建时追加序号保证唯一。
     */
    public SessionEntity create(String observerChannelId) {
        LocalDateTime now = LocalDateTime.now(clock);
        String baseId = idPrefix + clock.millis();
        String sessionId = baseId;
        int sequence = 1;
        while (true) {
            SessionEntity session = SessionEntity.builder()
                    .id(sessionId)
                    .clientId(Constants.CLIENT_ID_PREFIX + sessionId)
                    .status(SessionStatusEnum.PENDING)
                    .observerChannelId(observerChannelId)
                    .createdAt(now)
                    .lastActiveAt(now)
                    .build();
            if (sessions.putIfAbsent(sessionId, session) == null) {
                SessionEntity snapshot = session.copy();
                notifyChanged(new SessionChange(null, snapshot));
                return snapshot;
            }
            sessionId = baseId + "_" + sequence++;
        }
    }

    /**
     * 按给定 ID 登记会话（启动恢复使用），返回被覆盖的旧会话，没有则为 null。
     */
    public SessionEntity put(SessionEntity session) {
        if (session == null || StringUtils.isBlank(session.getId())) {
            throw new IllegalArgumentException("Session id is required");
        }
        SessionEntity stored = session.copy();
        SessionEntity previous = sessions.put(stored.getId(), stored);
        SessionEntity previousSnapshot = previous == null ? null : previous.copy();
        notifyChanged(new SessionChange(previousSnapshot, stored.copy()));
        return previousSnapshot;
    }

    public SessionEntity get(String sessionId) {
        if (sessionId == null) {
            return null;
        }
        SessionEntity session = sessions.get(sessionId);
        return session == null ? null : session.copy();
    }

    public boolean contains(String sessionId) {
        return sessionId != null && sessions.containsKey(sessionId);
    }

    public SessionChange update(String sessionId, SessionPatch patch) {
        return apply(sessionId, current -> patch);
    }

    /**
     * 在会话的写锁内基于当前快照计算补丁并合并。
     *
     * @param planner 返回 null 表示不修改
     * @return 变更前后快照；会话不存在或未修改时返回 null
     */
    public SessionChange apply(String sessionId, Function<SessionEntity, SessionPatch> planner) {
        if (sessionId == null) {
            return null;
        }
        SessionChange[] holder = new SessionChange[1];
        sessions.computeIfPresent(sessionId, (key, current) -> {
            SessionPatch patch = planner.apply(current.copy());
            if (patch == null) {
                return current;
            }
            SessionEntity next = current.copy();
            patch.applyTo(next);
            holder[0] = new SessionChange(current.copy(), next.copy());
            return next;
        });
        if (holder[0] != null) {
            notifyChanged(holder[0]);
        }
        return holder[0];
    }

    /**
     * 移除会话，幂等。只有真正移除的那次调用拿到被移除的快照。
     */
    public SessionEntity remove(String sessionId) {
        if (sessionId == null) {
            return null;
        }
        SessionEntity removed = sessions.remove(sessionId);
        if (removed == null) {
            return null;
        }
        SessionEntity snapshot = removed.copy();
        notifyChanged(new SessionChange(snapshot, null));
        return snapshot;
    }

    public List<SessionEntity> listByState(SessionStatusEnum status) {
        List<SessionEntity> result = new ArrayList<>();
        for (SessionEntity session : sessions.values()) {
            if (session.getStatus() == status) {
                result.add(session.copy());
            }
        }
        result.sort(Comparator.comparing(SessionEntity::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())));
        return result;
    }

    public List<SessionEntity> listByObserverChannel(String channelId) {
        List<SessionEntity> result = new ArrayList<>();
        for (SessionEntity session : sessions.values()) {
            if (session.isObservedBy(channelId)) {
                result.add(session.copy());
            }
        }
        return result;
    }

    public List<SessionEntity> listAll() {
        List<SessionEntity> result = new ArrayList<>(sessions.size());
        for (SessionEntity session : sessions.values()) {
            result.add(session.copy());
        }
        result.sort(Comparator.comparing(SessionEntity::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())));
        return result;
    }

    public int size() {
        return sessions.size();
    }

    private void notifyChanged(SessionChange change) {
        for (ISessionChangeListener listener : changeListeners) {
            try {
                listener.onSessionChanged(change);
            } catch (Exception ex) {
                log.warn("Session change listener failed. sessionId={}, error={}",
                        change.getSessionId(), ex.getMessage());
            }
        }
    }
}
