package com.promptroute.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 线程池配置属性类，配置前缀为 thread.pool.executor.config。
 * <p>
 * 该线程池承载路由请求中的持久化读取（权重、账本），
 * 调用方以超时等待，队列不宜过长。
 * </p>
 *
 * @author promptroute
 * @since 2026-10-01
 */
@Data
@ConfigurationProperties(prefix = "thread.pool.executor.config", ignoreInvalidFields = true)
public class ThreadPoolConfigProperties {

    /** 核心线程数，默认16 */
    private Integer corePoolSize = 16;

    /** 最大线程数，默认64 */
    private Integer maxPoolSize = 64;

    /** 空闲线程最大存活时间（秒），默认10L */
    private Long keepAliveTime = 10L;

    /** 阻塞队列最大容量，默认1000 */
    private Integer blockQueueSize = 1000;

    /**
     * 拒绝策略，默认AbortPolicy。
     * <ul>
     *   <li>AbortPolicy：丢弃任务并抛出RejectedExecutionException异常</li>
     *   <li>DiscardPolicy：直接丢弃任务，不抛出异常</li>
     *   <li>DiscardOldestPolicy：将最早进入队列的任务删除，之后再尝试加入队列</li>
     *   <li>CallerRunsPolicy：如果任务添加线程池失败，主线程自己执行该任务</li>
     * </ul>
     */
    private String policy = "AbortPolicy";

    /** 线程名前缀 */
    private String threadNamePrefix = "route-persist-";

}
