package com.sessionhub.types.common;

/**
 * 全局常量定义类。
 * <p>
 * 定义会话、外部客户端标识等跨模块共享的常量。
 * </p>
 *
 * @author sessionhub
 * @since 2026-10-19
 */
public class Constants {

    /** 逗号分隔符，用于字符串分割操作 */
    public final static String SPLIT = ",";

    /** 会话 ID 默认前缀 */
    public final static String SESSION_ID_PREFIX = "session_";

    /** 外部自动化客户端 ID 前缀 */
    public final static String CLIENT_ID_PREFIX = "client_";

    /** 无法识别外部客户端身份时的占位值 */
    public final static String UNKNOWN_CLIENT_ID = "unknown-client-id";

    /** 手机号未知时的展示值 */
    public final static String UNKNOWN_PHONE_NUMBER = "Unknown";

    /** 二维码默认有效期（秒） */
    public final static long DEFAULT_QR_TTL_SECONDS = 40L;

}
