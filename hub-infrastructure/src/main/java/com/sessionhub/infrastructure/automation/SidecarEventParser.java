package com.sessionhub.infrastructure.automation;

import com.sessionhub.domain.session.model.valobj.AutomationEvent;
import com.sessionhub.infrastructure.util.JsonCodec;
import com.sessionhub.types.enums.AutomationEventTypeEnum;
import com.sessionhub.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;

/**
 * 解析自动化子进程 stdout 上的 NDJSON 事件行。
 * <p>
 * 每行一个对象，{@code event} 字段为事件名，其余字段按事件类型选填：
 * <pre>
 * {"event":"initialized"}
 * {"event":"qr","qr":"..."}
 * {"event":"authenticated","phoneNumber":"8613800000000","serializedId":"8613800000000@c.us"}
 * {"event":"disconnected","reason":"LOGOUT"}
 * </pre>
 * </p>
 */
@Slf4j
public class SidecarEventParser {

    public static final String EVENT_FIELD = "event";
    public static final String INITIALIZED_EVENT = "initialized";

    private final JsonCodec jsonCodec;

    public SidecarEventParser(JsonCodec jsonCodec) {
        this.jsonCodec = jsonCodec;
    }

    /**
     * 非 JSON 行（子进程日志等）返回 null。
     */
    public Map<String, Object> readLine(String line) {
        String trimmed = StringUtils.trimToEmpty(line);
        if (!trimmed.startsWith("{")) {
            return null;
        }
        try {
            return jsonCodec.readMap(trimmed);
        } catch (AppException ex) {
            log.debug("Ignore malformed sidecar line: {}", StringUtils.abbreviate(trimmed, 200));
            return null;
        }
    }

    public boolean isInitialized(Map<String, Object> payload) {
        return payload != null && INITIALIZED_EVENT.equals(getString(payload, EVENT_FIELD));
    }

    /**
     * 未知事件名返回 null。
     */
    public AutomationEvent toEvent(Map<String, Object> payload) {
        if (payload == null) {
            return null;
        }
        AutomationEventTypeEnum type = AutomationEventTypeEnum.fromEventName(getString(payload, EVENT_FIELD));
        if (type == null) {
            return null;
        }
        return AutomationEvent.builder()
                .type(type)
                .qrCode(getString(payload, "qr"))
                .phoneNumber(getString(payload, "phoneNumber"))
                .serializedId(getString(payload, "serializedId"))
                .reason(getString(payload, "reason"))
                .message(getString(payload, "message"))
                .state(getString(payload, "state"))
                .from(getString(payload, "from"))
                .body(getString(payload, "body"))
                .fromMe(Boolean.TRUE.equals(payload.get("fromMe")))
                .timestamp(getLong(payload, "timestamp"))
                .build();
    }

    private String getString(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        return value == null ? null : String.valueOf(value);
    }

    private Long getLong(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text && StringUtils.isNumeric(text)) {
            return Long.parseLong(text);
        }
        return null;
    }
}
