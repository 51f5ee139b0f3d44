package com.sessionhub.observer.store;

import java.util.List;

/**
 * 本地最近一次会话列表缓存，服务端不可达时用于展示。
 */
public interface ObserverSessionCache {

    List<ObservedSession> load();

    void save(List<ObservedSession> sessions);
}
