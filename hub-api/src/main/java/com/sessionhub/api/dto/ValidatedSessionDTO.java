package com.sessionhub.api.dto;

import com.sessionhub.types.enums.SessionStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 校验通过的持久化会话。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidatedSessionDTO {

    private String id;
    private String sessionId;
    private String name;
    private String number;
    private SessionStatusEnum status;
}
