package com.sessionhub.types.enums;

/**
 * 自动化客户端生命周期事件类型。
 */
public enum AutomationEventTypeEnum {

    QR("qr"),
    AUTHENTICATED("authenticated"),
    READY("ready"),
    MESSAGE("message"),
    STATE_CHANGE("change_state"),
    AUTH_FAILURE("auth_failure"),
    DISCONNECTED("disconnected");

    private final String eventName;

    AutomationEventTypeEnum(String eventName) {
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }

    public static AutomationEventTypeEnum fromEventName(String eventName) {
        if (eventName == null) {
            return null;
        }
        for (AutomationEventTypeEnum type : AutomationEventTypeEnum.values()) {
            if (type.eventName.equals(eventName)) {
                return type;
            }
        }
        return null;
    }
}
