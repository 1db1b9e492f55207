package com.goormthonuniv.factcheck.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class AsyncConfig {

    public static final String SOURCE_ANALYSIS_EXECUTOR = "sourceAnalysisExecutor";
    public static final String SOURCE_TIMEOUT_SCHEDULER = "sourceTimeoutScheduler";

    /**
     * 소스별 fetch/추출/비교 작업용 executor
     */
    @Bean(name = SOURCE_ANALYSIS_EXECUTOR)
    public ThreadPoolTaskExecutor sourceAnalysisExecutor(FactCheckProperties props) {
        int workers = Math.max(1, props.getWorkerThreads());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(Math.max(50, props.getMaxSources() * 4));
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("SourceAnalysis-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * 소스별 마감 감시용. 작업이 워커에서 시작될 때 마감을 예약한다.
     */
    @Bean(name = SOURCE_TIMEOUT_SCHEDULER)
    public ThreadPoolTaskScheduler sourceTimeoutScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("SourceTimeout-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}
