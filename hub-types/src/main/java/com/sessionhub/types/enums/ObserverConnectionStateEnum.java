package com.sessionhub.types.enums;

/**
 * 观察端长连接状态。
 * <p>
 * DISCONNECTED → CONNECTING → CONNECTED，任何关闭或错误回到 DISCONNECTED 并按退避策略重连；
 * 重试耗尽后停留在 DISCONNECTED 并发出一次放弃信号。
 * </p>
 */
public enum ObserverConnectionStateEnum {

    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
