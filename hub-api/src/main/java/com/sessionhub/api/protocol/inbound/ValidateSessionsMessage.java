package com.sessionhub.api.protocol.inbound;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.sessionhub.api.dto.SessionRefDTO;
import com.sessionhub.types.enums.InboundActionEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 校验观察端本地缓存的会话是否仍然有效。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
@JsonTypeName(InboundActionEnum.VALIDATE_SESSIONS_NAME)
public class ValidateSessionsMessage extends ObserverInboundMessage {

    private List<SessionRefDTO> sessions;

    @Override
    public InboundActionEnum getAction() {
        return InboundActionEnum.VALIDATE_SESSIONS;
    }
}
