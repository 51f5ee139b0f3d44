package com.sessionhub.domain.session.service;

import com.sessionhub.domain.session.model.entity.SessionEntity;
import com.sessionhub.domain.session.model.entity.SessionRecordEntity;
import com.sessionhub.domain.session.model.valobj.SessionPatch;
import com.sessionhub.types.common.Constants;
import com.sessionhub.types.enums.SessionStatusEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.concurrent.Future;

/**
 * 会话状态迁移领域服务：根据当前快照和外部事件计算补丁，不做任何副作用。
 * 前置条件不满足时返回 null，由调用方忽略该事件。
 */
@Service
public class SessionTransitionDomainService {

    public SessionPatch planQr(SessionEntity current, String qrCode, LocalDateTime now) {
        if (current == null || current.getStatus() != SessionStatusEnum.PENDING || StringUtils.isBlank(qrCode)) {
            return null;
        }
        return SessionPatch.builder()
                .qrCode(qrCode)
                .qrGeneratedAt(now)
                .qrGeneration(current.getQrGeneration() + 1)
                .lastActiveAt(now)
                .build();
    }

    /**
     * 过期只作用于定时器对应的那一代二维码。
     */
    public SessionPatch planQrExpiry(SessionEntity current, long generation) {
        if (current == null
                || current.getStatus() != SessionStatusEnum.PENDING
                || !current.hasQrPayload()
                || current.getQrGeneration() != generation) {
            return null;
        }
        return SessionPatch.builder().clearQr(true).build();
    }

    public SessionPatch planQrExpiryHandle(SessionEntity current, long generation, Future<?> handle) {
        if (current == null
                || current.getStatus() != SessionStatusEnum.PENDING
                || !current.hasQrPayload()
                || current.getQrGeneration() != generation
                || handle == null) {
            return null;
        }
        return SessionPatch.builder().qrExpiryHandle(handle).build();
    }

    public SessionPatch planAuthenticated(SessionEntity current, String phoneNumber, LocalDateTime now) {
        if (current == null || current.getStatus() != SessionStatusEnum.PENDING) {
            return null;
        }
        return SessionPatch.builder()
                .status(SessionStatusEnum.AUTHENTICATED)
                .phoneNumber(StringUtils.defaultIfBlank(phoneNumber, Constants.UNKNOWN_PHONE_NUMBER))
                .clearQr(true)
                .lastActiveAt(now)
                .build();
    }

    public SessionPatch planReady(SessionEntity current, String phoneNumber, LocalDateTime now) {
        if (current == null || current.getStatus() != SessionStatusEnum.AUTHENTICATED) {
            return null;
        }
        String resolvedPhone = StringUtils.isNotBlank(phoneNumber) ? phoneNumber : null;
        return SessionPatch.builder()
                .status(SessionStatusEnum.READY)
                .phoneNumber(resolvedPhone)
                .lastActiveAt(now)
                .build();
    }

    public boolean acceptsAuthFailure(SessionEntity current) {
        return current != null
                && (current.getStatus() == SessionStatusEnum.PENDING
                || current.getStatus() == SessionStatusEnum.AUTHENTICATED);
    }

    public SessionPatch planDetachObserver(SessionEntity current, String channelId) {
        if (current == null || !current.isObservedBy(channelId)) {
            return null;
        }
        return SessionPatch.builder().detachObserver(true).build();
    }

    /**
     * 由持久化记录重建就绪会话，非 READY 记录不恢复。
     */
    public SessionEntity restore(SessionRecordEntity record, LocalDateTime now) {
        if (record == null || !record.isReady() || StringUtils.isBlank(record.getSessionId())) {
            return null;
        }
        return SessionEntity.builder()
                .id(record.getSessionId())
                .clientId(StringUtils.defaultIfBlank(record.getClientId(),
                        Constants.CLIENT_ID_PREFIX + record.getSessionId()))
                .status(SessionStatusEnum.READY)
                .phoneNumber(record.getPhoneNumber())
                .createdAt(record.getCreatedAt() == null ? now : record.getCreatedAt())
                .lastActiveAt(record.getLastActiveAt() == null ? now : record.getLastActiveAt())
                .build();
    }
}
