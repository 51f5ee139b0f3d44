package com.sessionhub.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 副作用线程池配置属性，前缀 thread.pool.executor.config。
 * <p>
 * 该线程池承载会话记录的异步持久化（按会话 id 分片串行）。
 * </p>
 */
@Data
@ConfigurationProperties(prefix = "thread.pool.executor.config", ignoreInvalidFields = true)
public class ThreadPoolConfigProperties {

    /** 核心线程数 */
    private Integer corePoolSize = 4;

    /** 最大线程数 */
    private Integer maxPoolSize = 16;

    /** 空闲线程存活时间（秒） */
    private Long keepAliveTime = 30L;

    /** 阻塞队列容量 */
    private Integer blockQueueSize = 2000;

    /**
     * 拒绝策略：AbortPolicy / DiscardPolicy / DiscardOldestPolicy / CallerRunsPolicy。
     * 默认 CallerRunsPolicy，持久化任务不丢弃。
     */
    private String policy = "CallerRunsPolicy";

}
