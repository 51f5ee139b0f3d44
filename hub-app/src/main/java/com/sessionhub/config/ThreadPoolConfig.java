package com.sessionhub.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 线程池配置。
 * <ul>
 *   <li>sessionSideEffectExecutor：会话记录持久化等副作用</li>
 *   <li>fanoutExecutor：观察端推送，每个通道的发送队列在其上串行排空</li>
 * </ul>
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ThreadPoolConfigProperties.class)
public class ThreadPoolConfig {

    @Bean(name = "sessionSideEffectExecutor", destroyMethod = "shutdown")
    public ThreadPoolExecutor sessionSideEffectExecutor(ThreadPoolConfigProperties properties) {
        int coreSize = Math.max(properties.getCorePoolSize(), 1);
        return new ThreadPoolExecutor(
                coreSize,
                Math.max(properties.getMaxPoolSize(), coreSize),
                Math.max(properties.getKeepAliveTime(), 0L),
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(properties.getBlockQueueSize(), 1)),
                new ThreadFactoryBuilder().setNameFormat("session-side-effect-%d").build(),
                buildRejectedExecutionHandler(properties.getPolicy()));
    }

    /**
     * 推送线程池。队列无界，背压由每个通道自己的有界发送队列承担。
     */
    @Bean(name = "fanoutExecutor", destroyMethod = "shutdown")
    public ThreadPoolExecutor fanoutExecutor(
            @Value("${session-hub.fanout.pool-size:4}") int poolSize) {
        int normalized = Math.max(poolSize, 1);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                normalized,
                normalized,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new ThreadFactoryBuilder().setNameFormat("observer-fanout-%d").setDaemon(true).build());
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    private RejectedExecutionHandler buildRejectedExecutionHandler(String policy) {
        if ("DiscardPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardPolicy();
        }
        if ("DiscardOldestPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardOldestPolicy();
        }
        if ("AbortPolicy".equals(policy)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        if ("CallerRunsPolicy".equals(policy)) {
            return new ThreadPoolExecutor.CallerRunsPolicy();
        }
        log.warn("Unknown rejection policy '{}', fallback to CallerRunsPolicy", policy);
        return new ThreadPoolExecutor.CallerRunsPolicy();
    }

}
