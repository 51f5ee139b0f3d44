package com.sessionhub.api.protocol.outbound;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.sessionhub.types.enums.OutboundActionEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * 扫码认证通过。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
@JsonTypeName(OutboundActionEnum.AUTHENTICATED_NAME)
public class AuthenticatedMessage extends ObserverOutboundMessage {

    private String sessionId;

    private String phoneNumber;

    private String serializedId;

    @Override
    public OutboundActionEnum getAction() {
        return OutboundActionEnum.AUTHENTICATED;
    }
}
