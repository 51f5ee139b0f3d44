package com.sessionhub.domain.session.adapter.gateway;

import com.sessionhub.domain.session.model.valobj.AutomationEvent;

/**
 * 自动化客户端事件回调。同一客户端的事件按发生顺序串行回调。
 */
@FunctionalInterface
public interface IAutomationEventListener {

    void onEvent(AutomationEvent event);
}
