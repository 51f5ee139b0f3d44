package com.sessionhub.api.protocol.outbound;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.sessionhub.types.enums.OutboundActionEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 会话断开（终态）。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
@JsonTypeName(OutboundActionEnum.DISCONNECTED_NAME)
public class DisconnectedMessage extends ObserverOutboundMessage {

    private String sessionId;

    private String reason;

    private LocalDateTime timestamp;

    @Override
    public OutboundActionEnum getAction() {
        return OutboundActionEnum.DISCONNECTED;
    }
}
