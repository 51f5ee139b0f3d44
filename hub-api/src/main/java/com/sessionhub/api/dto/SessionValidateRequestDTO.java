package com.sessionhub.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 会话校验请求。
 */
@Data
public class SessionValidateRequestDTO {

    private List<String> sessionIds;
}
