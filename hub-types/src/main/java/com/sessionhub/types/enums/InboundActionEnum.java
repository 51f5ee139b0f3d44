package com.sessionhub.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 观察端 → 服务端 的消息动作。
 */
public enum InboundActionEnum {

    CREATE_SESSION("create_session"),
    GET_INITIAL_DATA("get_initial_data"),
    DELETE_SESSION("delete_session"),
    VALIDATE_SESSIONS("validate_sessions");

    public static final String CREATE_SESSION_NAME = "create_session";
    public static final String GET_INITIAL_DATA_NAME = "get_initial_data";
    public static final String DELETE_SESSION_NAME = "delete_session";
    public static final String VALIDATE_SESSIONS_NAME = "validate_sessions";

    private final String action;

    InboundActionEnum(String action) {
        this.action = action;
    }

    @JsonValue
    public String getAction() {
        return action;
    }
}
