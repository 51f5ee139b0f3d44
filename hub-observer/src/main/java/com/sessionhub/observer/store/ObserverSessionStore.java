package com.sessionhub.observer.store;

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
import com.sessionhub.types.enums.SessionStatusEnum;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * 观察端本地会话视图。
 * <p>
 * sessions_update 是权威快照，整体替换本地状态；其余消息是按 sessionId 的增量，
 * 只覆盖自身携带的字段（后写者胜）。同一条消息重复应用结果不变，
 * 不同会话的增量以任意顺序应用结果相同。
 * 从本地缓存载入的会话在被服务端确认前标记为未确认，快照或校验结果会剔除未被确认的条目。
 * </p>
 */
public class ObserverSessionStore {

    private final Map<String, ObservedSession> sessions = new LinkedHashMap<>();
    private final Set<String> unconfirmedIds = new LinkedHashSet<>();

    /**
     * 合并本地缓存，已存在的会话以服务端数据为准。
     */
    public synchronized void loadCached(List<ObservedSession> cached) {
        if (cached == null) {
            return;
        }
        for (ObservedSession session : cached) {
            if (session == null || StringUtils.isBlank(session.getSessionId())
                    || sessions.containsKey(session.getSessionId())) {
                continue;
            }
            sessions.put(session.getSessionId(), session.copy());
            unconfirmedIds.add(session.getSessionId());
        }
    }

    /**
     * @return 本地视图是否可能发生变化
     */
    public synchronized boolean apply(ObserverOutboundMessage message) {
        if (message == null) {
            return false;
        }
        return switch (message.getAction()) {
            case SESSION_CREATED -> {
                SessionCreatedMessage created = (SessionCreatedMessage) message;
                yield merge(created.getSessionId(), session -> session.setStatus(
                        created.getStatus() == null ? SessionStatusEnum.PENDING : created.getStatus()));
            }
            case QR -> {
                QrMessage qr = (QrMessage) message;
                yield merge(qr.getSessionId(), session -> {
                    session.setStatus(SessionStatusEnum.PENDING);
                    session.setQrCode(qr.getQrCode());
                });
            }
            case QR_EXPIRED -> {
                String sessionId = ((QrExpiredMessage) message).getSessionId();
                yield sessions.containsKey(sessionId) && merge(sessionId, session -> session.setQrCode(null));
            }
            case AUTHENTICATED -> {
                AuthenticatedMessage authenticated = (AuthenticatedMessage) message;
                yield merge(authenticated.getSessionId(), session -> {
                    session.setStatus(SessionStatusEnum.AUTHENTICATED);
                    session.setPhoneNumber(authenticated.getPhoneNumber());
                    session.setQrCode(null);
                });
            }
            case READY -> merge(((ReadyMessage) message).getSessionId(), session -> {
                session.setStatus(SessionStatusEnum.READY);
                session.setQrCode(null);
            });
            case DISCONNECTED -> remove(((DisconnectedMessage) message).getSessionId());
            case SESSIONS_UPDATE -> resetTo(((SessionsUpdateMessage) message).getSessions());
            case AUTHORIZED_USERS -> mergeAuthorizedUsers(((AuthorizedUsersMessage) message).getUsers());
            case SESSIONS_VALIDATED -> applyValidated(((SessionsValidatedMessage) message).getSessions());
            case AUTH_FAILURE, STATE_CHANGE, MESSAGE, ERROR -> false;
        };
    }

    public synchronized List<ObservedSession> list() {
        List<ObservedSession> result = new ArrayList<>(sessions.size());
        for (ObservedSession session : sessions.values()) {
            result.add(session.copy());
        }
        return result;
    }

    /**
     * 与顺序无关的视图，便于比较两份状态。
     */
    public synchronized Map<String, ObservedSession> asMap() {
        Map<String, ObservedSession> result = new HashMap<>();
        for (Map.Entry<String, ObservedSession> entry : sessions.entrySet()) {
            result.put(entry.getKey(), entry.getValue().copy());
        }
        return result;
    }

    public synchronized ObservedSession get(String sessionId) {
        ObservedSession session = sessions.get(sessionId);
        return session == null ? null : session.copy();
    }

    public synchronized List<String> unconfirmedIds() {
        return new ArrayList<>(unconfirmedIds);
    }

    private boolean merge(String sessionId, Consumer<ObservedSession> mutator) {
        if (StringUtils.isBlank(sessionId)) {
            return false;
        }
        ObservedSession session = sessions.computeIfAbsent(sessionId,
                key -> ObservedSession.builder().sessionId(key).build());
        mutator.accept(session);
        unconfirmedIds.remove(sessionId);
        return true;
    }

    private boolean remove(String sessionId) {
        unconfirmedIds.remove(sessionId);
        return sessionId != null && sessions.remove(sessionId) != null;
    }

    private boolean resetTo(List<SessionSummaryDTO> snapshot) {
        sessions.clear();
        unconfirmedIds.clear();
        if (snapshot == null) {
            return true;
        }
        for (SessionSummaryDTO summary : snapshot) {
            if (summary == null || StringUtils.isBlank(summary.getSessionId())) {
                continue;
            }
            sessions.put(summary.getSessionId(), ObservedSession.builder()
                    .sessionId(summary.getSessionId())
                    .status(summary.getStatus())
                    .phoneNumber(summary.getPhoneNumber())
                    .qrCode(summary.getQrCode())
                    .lastActiveAt(summary.getLastActiveAt())
                    .build());
        }
        return true;
    }

    private boolean mergeAuthorizedUsers(List<AuthorizedUserDTO> users) {
        if (users == null || users.isEmpty()) {
            return false;
        }
        boolean changed = false;
        for (AuthorizedUserDTO user : users) {
            if (user == null) {
                continue;
            }
            changed |= merge(user.getSessionId(), session -> {
                session.setStatus(user.getStatus() == null ? SessionStatusEnum.READY : user.getStatus());
                session.setPhoneNumber(user.getNumber());
                session.setQrCode(null);
                if (user.getLastActive() != null) {
                    session.setLastActiveAt(user.getLastActive());
                }
            });
        }
        return changed;
    }

    private boolean applyValidated(List<ValidatedSessionDTO> validated) {
        Set<String> confirmed = new HashSet<>();
        if (validated != null) {
            for (ValidatedSessionDTO dto : validated) {
                if (dto == null || StringUtils.isBlank(dto.getSessionId())) {
                    continue;
                }
                confirmed.add(dto.getSessionId());
                merge(dto.getSessionId(), session -> {
                    session.setStatus(dto.getStatus() == null ? SessionStatusEnum.READY : dto.getStatus());
                    session.setPhoneNumber(dto.getNumber());
                });
            }
        }
        for (String sessionId : new ArrayList<>(unconfirmedIds)) {
            if (!confirmed.contains(sessionId)) {
                sessions.remove(sessionId);
            }
        }
        unconfirmedIds.clear();
        return true;
    }
}
