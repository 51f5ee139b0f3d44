package com.sessionhub.api.protocol.inbound;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.sessionhub.types.enums.InboundActionEnum;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 请求全量快照（连接建立或重连后发送）。
 */
@ToString
@EqualsAndHashCode(callSuper = false)
@JsonTypeName(InboundActionEnum.GET_INITIAL_DATA_NAME)
public class GetInitialDataMessage extends ObserverInboundMessage {

    @Override
    public InboundActionEnum getAction() {
        return InboundActionEnum.GET_INITIAL_DATA;
    }
}
