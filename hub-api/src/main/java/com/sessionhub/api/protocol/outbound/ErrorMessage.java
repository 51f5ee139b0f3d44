package com.sessionhub.api.protocol.outbound;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.sessionhub.types.enums.OutboundActionEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * 协议或处理错误，只发给出错的观察端。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
@JsonTypeName(OutboundActionEnum.ERROR_NAME)
public class ErrorMessage extends ObserverOutboundMessage {

    private String message;

    @Override
    public OutboundActionEnum getAction() {
        return OutboundActionEnum.ERROR;
    }
}
