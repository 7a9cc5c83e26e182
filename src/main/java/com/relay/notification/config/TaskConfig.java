package com.relay.notification.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class TaskConfig {

    /**
     * Bounded pool for the pipeline's per-notification relevance predictions.
     * Spring shuts it down with the context.
     */
    @Bean
    @Qualifier("prediction")
    public AsyncTaskExecutor predictionExecutor(FilterPipelineProperties properties) {
        properties.validate();
        return predictionExecutor(properties.getPredictorParallelism());
    }

    public static ThreadPoolTaskExecutor predictionExecutor(int parallelism) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setDaemon(true);
        executor.setThreadNamePrefix("relevance-prediction-");
        executor.initialize();
        return executor;
    }
}
