package com.sessionhub.api.protocol.outbound;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.sessionhub.types.enums.OutboundActionEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * 自动化客户端内部连接状态变化。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
@JsonTypeName(OutboundActionEnum.STATE_CHANGE_NAME)
public class StateChangeMessage extends ObserverOutboundMessage {

    private String sessionId;

    private String state;

    @Override
    public OutboundActionEnum getAction() {
        return OutboundActionEnum.STATE_CHANGE;
    }
}
