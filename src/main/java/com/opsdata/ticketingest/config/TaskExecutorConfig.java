package com.opsdata.ticketingest.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class TaskExecutorConfig {

    @Bean("ticketUploadExecutor")
    public TaskExecutor ticketUploadExecutor(@Value("${app.upload.executor.core-pool-size:2}") int corePoolSize,
                                             @Value("${app.upload.executor.max-pool-size:4}") int maxPoolSize,
                                             @Value("${app.upload.executor.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity); // uploads past this run on the request thread
        executor.setRejectedExecutionHandler(new java.util.concurrent.ThreadPoolExecutor.CallerRunsPolicy());
        executor.setThreadNamePrefix("TicketUpload-");
        executor.initialize();
        return executor;
    }
}
