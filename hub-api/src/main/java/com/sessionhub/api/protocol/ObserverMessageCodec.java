package com.sessionhub.api.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sessionhub.api.protocol.inbound.ObserverInboundMessage;
import com.sessionhub.api.protocol.outbound.ObserverOutboundMessage;
import com.sessionhub.types.enums.ResponseCode;
import com.sessionhub.types.exception.AppException;

/**
 * 观察端通道的 JSON 编解码。
 * <p>
 * 解码失败统一抛出 {@link AppException}（ILLEGAL_PARAMETER），
 * 信息区分「Unknown action」与「Invalid message format」，由调用方原样回给出错的观察端。
 * </p>
 */
public class ObserverMessageCodec {

    public static final String UNKNOWN_ACTION = "Unknown action";
    public static final String INVALID_MESSAGE_FORMAT = "Invalid message format";

    private final ObjectMapper objectMapper;

    public ObserverMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    /**
     * 独立于 Spring 的默认编解码（观察端客户端使用）。
     */
    public static ObserverMessageCodec withDefaults() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return new ObserverMessageCodec(mapper);
    }

    public ObserverInboundMessage decodeInbound(String payload) {
        return decode(payload, ObserverInboundMessage.class);
    }

    public ObserverOutboundMessage decodeOutbound(String payload) {
        return decode(payload, ObserverOutboundMessage.class);
    }

    public String encode(ObserverInboundMessage message) {
        return write(message);
    }

    public String encode(ObserverOutboundMessage message) {
        return write(message);
    }

    private <T> T decode(String payload, Class<T> type) {
        if (payload == null || payload.isBlank()) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), INVALID_MESSAGE_FORMAT);
        }
        try {
            return objectMapper.readValue(payload, type);
        } catch (InvalidTypeIdException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), UNKNOWN_ACTION, ex);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), INVALID_MESSAGE_FORMAT, ex);
        }
    }

    private String write(Object message) {
        if (message == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "Message is required");
        }
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to write observer message", ex);
        }
    }
}
