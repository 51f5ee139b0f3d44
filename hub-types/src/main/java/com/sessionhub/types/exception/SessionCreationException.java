package com.sessionhub.types.exception;

import com.sessionhub.types.enums.ResponseCode;

/**
 * 会话创建失败：自动化客户端无法完成初始化，半成品会话已被回收。
 */
public class SessionCreationException extends AppException {

    private static final long serialVersionUID = -2816407113578842091L;

    public SessionCreationException(String message, Throwable cause) {
        super(ResponseCode.SESSION_CREATE_FAILED.getCode(), message, cause);
    }
}
