package com.sessionhub.api.protocol.inbound;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.sessionhub.types.enums.InboundActionEnum;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 请求创建新会话。
 */
@ToString
@EqualsAndHashCode(callSuper = false)
@JsonTypeName(InboundActionEnum.CREATE_SESSION_NAME)
public class CreateSessionMessage extends ObserverInboundMessage {

    @Override
    public InboundActionEnum getAction() {
        return InboundActionEnum.CREATE_SESSION;
    }
}
