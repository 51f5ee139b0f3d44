package com.sessionhub.api.dto;

import com.sessionhub.types.enums.SessionStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 会话摘要（REST 列表与 sessions_update 快照共用）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionSummaryDTO {

    private String sessionId;
    private SessionStatusEnum status;
    private String phoneNumber;
    /**
     * 仅 pending 且二维码未过期时非空
     */
    private String qrCode;
    private LocalDateTime lastActiveAt;
}
