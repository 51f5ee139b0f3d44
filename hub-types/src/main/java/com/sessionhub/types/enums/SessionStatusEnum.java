package com.sessionhub.types.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 消息平台会话状态枚举。
 * <p>
 * 状态只能沿 PENDING → AUTHENTICATED → READY 单调推进，
 * DISCONNECTED 可由任意状态到达且为终态。
 * </p>
 *
 * @author sessionhub
 * @since 2026-10-19
 */
public enum SessionStatusEnum {

    /**
     * 待扫码 - 已创建，等待二维码认证
     */
    PENDING("pending", 0),

    /**
     * 已认证 - 扫码通过，客户端尚未就绪
     */
    AUTHENTICATED("authenticated", 1),

    /**
     * 就绪 - 可收发消息
     */
    READY("ready", 2),

    /**
     * 已断开 - 终态，不可恢复
     */
    DISCONNECTED("disconnected", 3);

    private final String code;
    private final int rank;

    SessionStatusEnum(String code, int rank) {
        this.code = code;
        this.rank = rank;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == DISCONNECTED;
    }

    /**
     * 判断是否允许迁移到目标状态：终态不可离开，DISCONNECTED 总是可达，其余只能前进一步。
     */
    public boolean canTransitTo(SessionStatusEnum target) {
        if (target == null || isTerminal()) {
            return false;
        }
        if (target == DISCONNECTED) {
            return true;
        }
        return target.rank == this.rank + 1;
    }

    @JsonCreator
    public static SessionStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (SessionStatusEnum status : SessionStatusEnum.values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown session status code: " + code);
    }
}
