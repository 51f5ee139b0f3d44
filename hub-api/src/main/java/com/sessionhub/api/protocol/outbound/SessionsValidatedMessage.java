package com.sessionhub.api.protocol.outbound;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.sessionhub.api.dto.ValidatedSessionDTO;
import com.sessionhub.types.enums.OutboundActionEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 会话校验结果，仅包含仍有效的会话。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
@JsonTypeName(OutboundActionEnum.SESSIONS_VALIDATED_NAME)
public class SessionsValidatedMessage extends ObserverOutboundMessage {

    private List<ValidatedSessionDTO> sessions;

    @Override
    public OutboundActionEnum getAction() {
        return OutboundActionEnum.SESSIONS_VALIDATED;
    }
}
