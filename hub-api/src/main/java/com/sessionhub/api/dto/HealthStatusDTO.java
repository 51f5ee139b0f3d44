package com.sessionhub.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 健康检查结果。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthStatusDTO {

    /** 进程状态，固定为 healthy */
    private String status;

    /** 是否存在就绪会话：active / inactive */
    private String sessionStatus;

    /** 就绪会话数 */
    private Integer activeSessions;
}
