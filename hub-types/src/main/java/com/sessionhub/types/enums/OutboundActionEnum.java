package com.sessionhub.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 服务端 → 观察端 的消息动作。
 * <p>
 * SESSION_CREATED 之后的增量事件以及 SESSIONS_UPDATE 快照共同构成观察端的状态来源。
 * </p>
 */
public enum OutboundActionEnum {

    SESSION_CREATED("session_created"),
    QR("qr"),
    QR_EXPIRED("qr_expired"),
    AUTHENTICATED("authenticated"),
    READY("ready"),
    SESSIONS_UPDATE("sessions_update"),
    AUTHORIZED_USERS("authorized_users"),
    SESSIONS_VALIDATED("sessions_validated"),
    DISCONNECTED("disconnected"),
    AUTH_FAILURE("auth_failure"),
    STATE_CHANGE("state_change"),
    MESSAGE("message"),
    ERROR("error");

    public static final String SESSION_CREATED_NAME = "session_created";
    public static final String QR_NAME = "qr";
    public static final String QR_EXPIRED_NAME = "qr_expired";
    public static final String AUTHENTICATED_NAME = "authenticated";
    public static final String READY_NAME = "ready";
    public static final String SESSIONS_UPDATE_NAME = "sessions_update";
    public static final String AUTHORIZED_USERS_NAME = "authorized_users";
    public static final String SESSIONS_VALIDATED_NAME = "sessions_validated";
    public static final String DISCONNECTED_NAME = "disconnected";
    public static final String AUTH_FAILURE_NAME = "auth_failure";
    public static final String STATE_CHANGE_NAME = "state_change";
    public static final String MESSAGE_NAME = "message";
    public static final String ERROR_NAME = "error";

    private final String action;

    OutboundActionEnum(String action) {
        this.action = action;
    }

    @JsonValue
    public String getAction() {
        return action;
    }
}
