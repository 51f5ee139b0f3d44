package com.sessionhub.types.exception;

import lombok.Getter;

/**
 * 带响应码的业务异常。
 * <p>
 * REST 层由全局异常处理器转换为统一响应，WebSocket 层转换为 error 消息，
 * 领域与基础设施层只抛出、不吞掉。
 * </p>
 *
 * @author sessionhub
 * @since 2026-10-19
 */
@Getter
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 4820917364032187765L;

    /** 响应码，见 ResponseCode */
    private final String code;

    /** 面向调用方的描述 */
    private final String info;

    public AppException(String code, String info) {
        this(code, info, null);
    }

    public AppException(String code, String info, Throwable cause) {
        super(info, cause);
        this.code = code;
        this.info = info;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{code='" + code + "', info='" + info + "'}";
    }
}
