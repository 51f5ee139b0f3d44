package com.sessionhub.api.protocol.outbound;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.sessionhub.types.enums.OutboundActionEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * 二维码过期，等待下一代。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
@JsonTypeName(OutboundActionEnum.QR_EXPIRED_NAME)
public class QrExpiredMessage extends ObserverOutboundMessage {

    private String sessionId;

    private String message;

    @Override
    public OutboundActionEnum getAction() {
        return OutboundActionEnum.QR_EXPIRED;
    }
}
