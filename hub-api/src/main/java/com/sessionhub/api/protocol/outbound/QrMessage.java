package com.sessionhub.api.protocol.outbound;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.sessionhub.types.enums.OutboundActionEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * 新一代二维码。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
@JsonTypeName(OutboundActionEnum.QR_NAME)
public class QrMessage extends ObserverOutboundMessage {

    private String sessionId;

    private String qrCode;

    @Override
    public OutboundActionEnum getAction() {
        return OutboundActionEnum.QR;
    }
}
