package com.sessionhub.api.protocol.inbound;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.sessionhub.types.enums.InboundActionEnum;

/**
 * 观察端发往服务端的消息（封闭层级，按 action 字段区分）。
 * <p>
 * 新增动作必须同时扩展 {@link InboundActionEnum} 与此处的子类型注册，
 * 服务端对 {@link #getAction()} 做穷尽 switch，遗漏分支无法编译通过。
 * </p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "action")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CreateSessionMessage.class, name = InboundActionEnum.CREATE_SESSION_NAME),
        @JsonSubTypes.Type(value = GetInitialDataMessage.class, name = InboundActionEnum.GET_INITIAL_DATA_NAME),
        @JsonSubTypes.Type(value = DeleteSessionMessage.class, name = InboundActionEnum.DELETE_SESSION_NAME),
        @JsonSubTypes.Type(value = ValidateSessionsMessage.class, name = InboundActionEnum.VALIDATE_SESSIONS_NAME)
})
public abstract class ObserverInboundMessage {

    @JsonIgnore
    public abstract InboundActionEnum getAction();
}
