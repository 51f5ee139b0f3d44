package com.sessionhub.domain.session.adapter.gateway;

/**
 * 外部消息平台自动化客户端。一个实例只服务一个会话。
 */
public interface IAutomationClient {

    String getClientId();

    /**
     * 启动客户端并开始回调事件。
     *
     * @throws com.sessionhub.types.exception.AppException 启动失败
     */
    void initialize(IAutomationEventListener listener);

    /**
     * 释放客户端，重复调用无副作用。
     */
    void destroy();
}
