package com.sessionhub.domain.session.adapter.gateway;

public interface IAutomationClientFactory {

    /**
     * 按外部身份创建未启动的客户端。
     */
    IAutomationClient create(String sessionId, String clientId);
}
