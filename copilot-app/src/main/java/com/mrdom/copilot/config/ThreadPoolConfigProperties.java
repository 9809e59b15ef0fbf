package com.mrdom.copilot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 连接器查询线程池配置属性类。
 * <p>
 * 配置前缀为 thread.pool.connector，支持核心线程数、最大线程数、存活时间、队列大小和拒绝策略。
 * </p>
 *
 * @author mrdom
 * @since 2026-10-15
 */
@Data
@ConfigurationProperties(prefix = "thread.pool.connector", ignoreInvalidFields = true)
public class ThreadPoolConfigProperties {

    /** 核心线程数，默认8 */
    private Integer corePoolSize = 8;

    /** 最大线程数，默认32 */
    private Integer maxPoolSize = 32;

    /** 空闲线程最大存活时间（秒），默认60L */
    private Long keepAliveTime = 60L;

    /** 阻塞队列最大容量，默认200 */
    private Integer blockQueueSize = 200;

    /** 线程名前缀 */
    private String threadNamePrefix = "connector-lookup-";

    /**
     * 拒绝策略，默认AbortPolicy。
     * <ul>
     *   <li>AbortPolicy：丢弃任务并抛出RejectedExecutionException异常，查询记为失败事实</li>
     *   <li>CallerRunsPolicy：由提交任务的线程自己执行，此时单次调用超时不生效</li>
     * </ul>
     */
    private String policy = "AbortPolicy";

}
