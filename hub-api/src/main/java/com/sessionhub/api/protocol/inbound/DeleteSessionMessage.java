package com.sessionhub.api.protocol.inbound;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.sessionhub.types.enums.InboundActionEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * 删除会话。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
@JsonTypeName(InboundActionEnum.DELETE_SESSION_NAME)
public class DeleteSessionMessage extends ObserverInboundMessage {

    private String sessionId;

    @Override
    public InboundActionEnum getAction() {
        return InboundActionEnum.DELETE_SESSION;
    }
}
