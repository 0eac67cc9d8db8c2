package com.nowa.archive.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ExecutorConfig {

    /**
     * hash reconcile 與 manifest 共用的固定寬度 pool。
     * ✅ core == max：整個檔案清單都進 queue，寬度不會長大
     */
    @Bean("hashWorkerExecutor")
    public ThreadPoolTaskExecutor hashWorkerExecutor(ArchiveProperties props) {
        int workers = Math.max(1, props.getReconcile().getWorkers());

        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(workers);
        ex.setMaxPoolSize(workers);
        ex.setQueueCapacity(Integer.MAX_VALUE);
        ex.setThreadNamePrefix("hash-worker-");
        ex.setWaitForTasksToCompleteOnShutdown(false);
        ex.initialize();
        return ex;
    }
}
