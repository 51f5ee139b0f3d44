package com.sessionhub.api.protocol.outbound;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.sessionhub.types.enums.OutboundActionEnum;
import com.sessionhub.types.enums.SessionStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * 会话已创建，等待二维码。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
@JsonTypeName(OutboundActionEnum.SESSION_CREATED_NAME)
public class SessionCreatedMessage extends ObserverOutboundMessage {

    private String sessionId;

    private SessionStatusEnum status;

    @Override
    public OutboundActionEnum getAction() {
        return OutboundActionEnum.SESSION_CREATED;
    }
}
