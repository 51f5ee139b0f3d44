package com.sessionhub.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * 定时器配置：二维码过期计时器使用独立调度器，取消后立即从队列移除。
 */
@Slf4j
@Configuration
public class SchedulingConfig {

    @Bean(name = "qrExpiryScheduler")
    public ThreadPoolTaskScheduler qrExpiryScheduler(
            @Value("${scheduling.daemon.pool-size:2}") int poolSize,
            @Value("${scheduling.daemon.thread-name-prefix:qr-expiry-}") String threadNamePrefix,
            @Value("${scheduling.daemon.await-termination-seconds:5}") int awaitTerminationSeconds) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(poolSize, 1));
        scheduler.setThreadNamePrefix(threadNamePrefix);
        // 关闭时丢弃未到期的过期任务，会话本身已在 shutdown 中销毁
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setAwaitTerminationSeconds(Math.max(awaitTerminationSeconds, 0));
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setErrorHandler(throwable ->
                log.error("Scheduled task execution failed. scheduler={}, error={}",
                        threadNamePrefix, throwable.getMessage(), throwable));
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
