package com.lvfield.equiptrack.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 里程碑计算与缓存的配置
 *
 * <pre>
 * equiptrack:
 *   milestone:
 *     cache-freshness-window: 5m
 *     executor-core-size: 8
 *     executor-max-size: 16
 *     executor-queue-capacity: 500
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "equiptrack.milestone")
public class MilestoneProperties {

    /**
     * 缓存新鲜期，超过后读取仍先返回旧值，同时后台重算
     */
    private Duration cacheFreshnessWindow = Duration.ofMinutes(5);

    private int executorCoreSize = 8;

    private int executorMaxSize = 16;

    private int executorQueueCapacity = 500;
}
