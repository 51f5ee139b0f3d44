package com.sessionhub.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 会话引用。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionRefDTO {

    private String sessionId;
}
