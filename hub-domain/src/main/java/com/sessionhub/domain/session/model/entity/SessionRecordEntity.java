package com.sessionhub.domain.session.model.entity;

import com.sessionhub.types.enums.SessionStatusEnum;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 会话持久化记录，按 sessionId 唯一。
 *
 * @author sessionhub
 * @since 2026-10-19
 */
@Data
public class SessionRecordEntity {

    private Long id;

    private String sessionId;

    /**
     * 外部客户端身份，恢复时据此重新创建自动化客户端
     */
    private String clientId;

    private SessionStatusEnum status;

    private String phoneNumber;

    private String qrCode;

    private LocalDateTime lastActiveAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public static SessionRecordEntity snapshotOf(SessionEntity session) {
        SessionRecordEntity record = new SessionRecordEntity();
        record.setSessionId(session.getId());
        record.setClientId(session.getClientId());
        record.setStatus(session.getStatus());
        record.setPhoneNumber(session.getPhoneNumber());
        record.setQrCode(session.getQrCode());
        record.setLastActiveAt(session.getLastActiveAt());
        record.setCreatedAt(session.getCreatedAt());
        return record;
    }

    public boolean isReady() {
        return status == SessionStatusEnum.READY;
    }
}
