package com.sessionhub.api.protocol.outbound;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.sessionhub.api.dto.AuthorizedUserDTO;
import com.sessionhub.types.enums.OutboundActionEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 已就绪账号列表。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
@JsonTypeName(OutboundActionEnum.AUTHORIZED_USERS_NAME)
public class AuthorizedUsersMessage extends ObserverOutboundMessage {

    private List<AuthorizedUserDTO> users;

    @Override
    public OutboundActionEnum getAction() {
        return OutboundActionEnum.AUTHORIZED_USERS;
    }
}
