package com.sessionhub.trigger.job;

import com.sessionhub.trigger.application.command.SessionLifecycleCoordinator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * 启动时恢复上次停机前处于 READY 的会话。
 */
@Slf4j
@Component
public class SessionRestoreRunner implements ApplicationRunner {

    private final SessionLifecycleCoordinator lifecycleCoordinator;
    private final boolean enabled;

    public SessionRestoreRunner(SessionLifecycleCoordinator lifecycleCoordinator,
                                @Value("${session-hub.restore.enabled:true}") boolean enabled) {
        this.lifecycleCoordinator = lifecycleCoordinator;
        this.enabled = enabled;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!enabled) {
            log.info("Session restore disabled.");
            return;
        }
        try {
            lifecycleCoordinator.restorePersistedSessions();
        } catch (Exception ex) {
            log.warn("Session restore aborted. error={}", ex.getMessage(), ex);
        }
    }
}
