package com.sessionhub.domain.session.model.valobj;

import com.sessionhub.domain.session.adapter.gateway.IAutomationClient;
import com.sessionhub.domain.session.model.entity.SessionEntity;
import com.sessionhub.types.enums.SessionStatusEnum;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.concurrent.Future;

/**
 * 会话局部更新。为 null 的字段保持原值，clear/detach 标记显式清空。
 */
@Getter
@Builder
@ToString
public class SessionPatch {

    private final SessionStatusEnum status;
    private final String phoneNumber;
    private final String qrCode;
    private final LocalDateTime qrGeneratedAt;
    private final Long qrGeneration;
    private final boolean clearQr;
    private final String observerChannelId;
    private final boolean detachObserver;
    private final LocalDateTime lastActiveAt;
    @ToString.Exclude
    private final IAutomationClient automationClient;
    @ToString.Exclude
    private final Future<?> qrExpiryHandle;

    /**
     * 合并到目标实体。非 PENDING 状态下二维码载荷总是被清空。
     *
     * @throws IllegalStateException 状态迁移不合法
     */
    public void applyTo(SessionEntity target) {
        if (status != null && status != target.getStatus()) {
            if (target.getStatus() == null || !target.getStatus().canTransitTo(status)) {
                throw new IllegalStateException("Illegal session status transition: "
                        + target.getStatus() + " -> " + status + ", sessionId=" + target.getId());
            }
            target.setStatus(status);
        }
        if (phoneNumber != null) {
            target.setPhoneNumber(phoneNumber);
        }
        if (clearQr) {
            target.clearQrPayload();
        }
        if (qrCode != null) {
            target.setQrCode(qrCode);
        }
        if (qrGeneratedAt != null) {
            target.setQrGeneratedAt(qrGeneratedAt);
        }
        if (qrGeneration != null) {
            target.setQrGeneration(qrGeneration);
        }
        if (qrExpiryHandle != null) {
            target.setQrExpiryHandle(qrExpiryHandle);
        }
        if (detachObserver) {
            target.setObserverChannelId(null);
        } else if (observerChannelId != null) {
            target.setObserverChannelId(observerChannelId);
        }
        if (lastActiveAt != null) {
            target.setLastActiveAt(lastActiveAt);
        }
        if (automationClient != null) {
            target.setAutomationClient(automationClient);
        }
        if (target.getStatus() != SessionStatusEnum.PENDING) {
            target.clearQrPayload();
        }
    }
}
