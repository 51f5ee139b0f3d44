package com.sessionhub.test.support;

import com.sessionhub.domain.session.adapter.gateway.IAutomationClient;
import com.sessionhub.domain.session.adapter.gateway.IAutomationClientFactory;
import com.sessionhub.domain.session.model.valobj.AutomationEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 记录每个会话创建出的客户端。
 */
public class FakeAutomationClientFactory implements IAutomationClientFactory {

    private final Map<String, FakeAutomationClient> clients = new ConcurrentHashMap<>();
    private final List<FakeAutomationClient> created = new ArrayList<>();
    private volatile boolean failNextInitialize;
    private volatile AutomationEvent nextInitializeEvent;

    @Override
    public synchronized IAutomationClient create(String sessionId, String clientId) {
        FakeAutomationClient client = new FakeAutomationClient(sessionId, clientId);
        if (failNextInitialize) {
            client.setFailOnInitialize(true);
            failNextInitialize = false;
        }
        if (nextInitializeEvent != null) {
            client.emitDuringInitialize(nextInitializeEvent);
            nextInitializeEvent = null;
        }
        clients.put(sessionId, client);
        created.add(client);
        return client;
    }

    public FakeAutomationClient clientOf(String sessionId) {
        return clients.get(sessionId);
    }

    public synchronized List<FakeAutomationClient> created() {
        return new ArrayList<>(created);
    }

    public void failNextInitialize() {
        this.failNextInitialize = true;
    }

    public void emitOnNextInitialize(AutomationEvent event) {
        this.nextInitializeEvent = event;
    }
}
