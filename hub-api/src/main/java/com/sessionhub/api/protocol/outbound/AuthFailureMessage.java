package com.sessionhub.api.protocol.outbound;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.sessionhub.types.enums.OutboundActionEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * 认证失败，会话保留，客户端可自行重试。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
@JsonTypeName(OutboundActionEnum.AUTH_FAILURE_NAME)
public class AuthFailureMessage extends ObserverOutboundMessage {

    private String sessionId;

    private String message;

    @Override
    public OutboundActionEnum getAction() {
        return OutboundActionEnum.AUTH_FAILURE;
    }
}
