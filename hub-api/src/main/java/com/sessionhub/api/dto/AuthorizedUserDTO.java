package com.sessionhub.api.dto;

import com.sessionhub.types.enums.SessionStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 已就绪账号视图。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthorizedUserDTO {

    private String id;
    private String sessionId;
    private String name;
    private String number;
    private SessionStatusEnum status;
    private LocalDateTime lastActive;
}
