package com.sessionhub.api.protocol.outbound;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.sessionhub.types.enums.OutboundActionEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * 会话收到的聊天消息。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
@JsonTypeName(OutboundActionEnum.MESSAGE_NAME)
public class IncomingChatMessage extends ObserverOutboundMessage {

    private String sessionId;

    private String from;

    private String body;

    private Long timestamp;

    @Override
    public OutboundActionEnum getAction() {
        return OutboundActionEnum.MESSAGE;
    }
}
