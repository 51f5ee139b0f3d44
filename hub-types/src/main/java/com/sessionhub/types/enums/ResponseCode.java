package com.sessionhub.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 定义系统中所有API响应的响应码和对应描述信息。
 * </p>
 *
 * @author sessionhub
 * @since 2026-10-19
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 会话创建失败 */
    SESSION_CREATE_FAILED("0003", "会话创建失败"),

    /** 会话不存在 */
    SESSION_NOT_FOUND("0004", "会话不存在");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
