package com.sessionhub.api.protocol.outbound;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.sessionhub.api.dto.SessionSummaryDTO;
import com.sessionhub.types.enums.OutboundActionEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 全量快照，观察端以此为准重置本地状态。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
@JsonTypeName(OutboundActionEnum.SESSIONS_UPDATE_NAME)
public class SessionsUpdateMessage extends ObserverOutboundMessage {

    private List<SessionSummaryDTO> sessions;

    @Override
    public OutboundActionEnum getAction() {
        return OutboundActionEnum.SESSIONS_UPDATE;
    }
}
