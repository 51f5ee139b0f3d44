package com.sessionhub.domain.session.service;

import com.sessionhub.domain.session.model.valobj.SessionChange;

/**
 * 注册表变更钩子。在写线程上同步调用，实现方只允许入队，不得阻塞或回写注册表。
 */
@FunctionalInterface
public interface ISessionChangeListener {

    void onSessionChanged(SessionChange change);
}
