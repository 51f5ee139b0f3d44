package com.sessionhub.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 会话记录 PO，对应表 hub_session_record
 *
 * @author sessionhub
 * @since 2026-10-19
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionRecordPO {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 会话 ID（唯一）
     */
    private String sessionId;

    /**
     * 外部客户端身份
     */
    private String clientId;

    /**
     * 状态编码：pending / authenticated / ready
     */
    private String status;

    private String phoneNumber;

    private String qrCode;

    private LocalDateTime lastActiveAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
