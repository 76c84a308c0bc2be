package com.vibecoding.k8scapacity.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 네임스페이스 병렬 수집용 워커 풀 (parallelism > 1 일 때만 사용)
 */
@Configuration
@RequiredArgsConstructor
public class ReportExecutorConfig {

    private final CapacityReportProperties properties;

    @Bean
    public ThreadPoolTaskExecutor reportExecutor() {
        int workers = properties.getReport().getParallelism();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setThreadNamePrefix("capacity-report-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
