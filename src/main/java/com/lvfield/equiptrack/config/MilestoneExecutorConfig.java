package com.lvfield.equiptrack.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 里程碑并行计算用的线程池 + 系统时钟
 */
@Configuration
public class MilestoneExecutorConfig {

    /**
     * 8 个分项 + 2 个汇总并行计算，读库也在这里并发发出
     * 有界队列，满了由调用线程自己执行，不丢任务
     */
    @Bean(name = "milestoneExecutor")
    public ThreadPoolTaskExecutor milestoneExecutor(MilestoneProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getExecutorCoreSize());
        executor.setMaxPoolSize(properties.getExecutorMaxSize());
        executor.setQueueCapacity(properties.getExecutorQueueCapacity());
        executor.setThreadNamePrefix("milestone-");
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
