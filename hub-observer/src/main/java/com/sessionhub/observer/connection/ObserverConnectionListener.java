package com.sessionhub.observer.connection;

import com.sessionhub.api.protocol.outbound.ObserverOutboundMessage;
import com.sessionhub.types.enums.ObserverConnectionStateEnum;

/**
 * 连接管理器回调，默认空实现。
 */
public interface ObserverConnectionListener {

    default void onStateChanged(ObserverConnectionStateEnum state) {
    }

    default void onMessage(ObserverOutboundMessage message) {
    }

    /**
     * 重试耗尽，每次 start 之后最多回调一次。
     */
    default void onGiveUp(int attempts) {
    }
}
