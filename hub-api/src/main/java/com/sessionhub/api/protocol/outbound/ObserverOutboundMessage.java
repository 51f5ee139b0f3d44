package com.sessionhub.api.protocol.outbound;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.sessionhub.types.enums.OutboundActionEnum;

/**
 * 服务端推送给观察端的消息（封闭层级，按 action 字段区分）。
 * <p>
 * 两类语义：
 * <ul>
 *   <li>快照：{@link SessionsUpdateMessage}，观察端视为权威重置</li>
 *   <li>增量：其余按 sessionId 键控的单会话事件</li>
 * </ul>
 * </p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "action")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SessionCreatedMessage.class, name = OutboundActionEnum.SESSION_CREATED_NAME),
        @JsonSubTypes.Type(value = QrMessage.class, name = OutboundActionEnum.QR_NAME),
        @JsonSubTypes.Type(value = QrExpiredMessage.class, name = OutboundActionEnum.QR_EXPIRED_NAME),
        @JsonSubTypes.Type(value = AuthenticatedMessage.class, name = OutboundActionEnum.AUTHENTICATED_NAME),
        @JsonSubTypes.Type(value = ReadyMessage.class, name = OutboundActionEnum.READY_NAME),
        @JsonSubTypes.Type(value = SessionsUpdateMessage.class, name = OutboundActionEnum.SESSIONS_UPDATE_NAME),
        @JsonSubTypes.Type(value = AuthorizedUsersMessage.class, name = OutboundActionEnum.AUTHORIZED_USERS_NAME),
        @JsonSubTypes.Type(value = SessionsValidatedMessage.class, name = OutboundActionEnum.SESSIONS_VALIDATED_NAME),
        @JsonSubTypes.Type(value = DisconnectedMessage.class, name = OutboundActionEnum.DISCONNECTED_NAME),
        @JsonSubTypes.Type(value = AuthFailureMessage.class, name = OutboundActionEnum.AUTH_FAILURE_NAME),
        @JsonSubTypes.Type(value = StateChangeMessage.class, name = OutboundActionEnum.STATE_CHANGE_NAME),
        @JsonSubTypes.Type(value = IncomingChatMessage.class, name = OutboundActionEnum.MESSAGE_NAME),
        @JsonSubTypes.Type(value = ErrorMessage.class, name = OutboundActionEnum.ERROR_NAME)
})
public abstract class ObserverOutboundMessage {

    @JsonIgnore
    public abstract OutboundActionEnum getAction();
}
