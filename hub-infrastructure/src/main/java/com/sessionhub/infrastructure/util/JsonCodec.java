package com.sessionhub.infrastructure.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sessionhub.types.enums.ResponseCode;
import com.sessionhub.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

/**
 * 无模式 JSON 读取，供逐行协议（如自动化子进程事件）使用。
 *
 * @author sessionhub
 * @since 2026-10-19
 */
@Component
public class JsonCodec {

    private static final TypeReference<Map<String, Object>> OBJECT_REF = new TypeReference<Map<String, Object>>() {};

    private final ObjectMapper objectMapper;

    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 空白输入返回 null；顶层不是对象或语法错误时抛出 {@link AppException}。
     */
    public Map<String, Object> readMap(String json) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, OBJECT_REF);
        } catch (IOException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(),
                    "Malformed json object: " + StringUtils.abbreviate(json, 80), ex);
        }
    }
}
