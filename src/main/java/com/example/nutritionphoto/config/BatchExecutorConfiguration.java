package com.example.nutritionphoto.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor used to evaluate many products concurrently. Each product is evaluated by a single
 * task; nothing is shared between tasks.
 */
@Configuration
public class BatchExecutorConfiguration {

    private static final Logger log = LoggerFactory.getLogger(BatchExecutorConfiguration.class);

    @Bean("nutritionPhotoExecutor")
    public ThreadPoolTaskExecutor nutritionPhotoExecutor(NutritionPhotoProperties properties) {
        NutritionPhotoProperties.Batch batch = properties.batch();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(batch.corePoolSize());
        executor.setMaxPoolSize(Math.max(batch.corePoolSize(), batch.maxPoolSize()));
        executor.setQueueCapacity(batch.queueCapacity());
        executor.setThreadNamePrefix(batch.threadNamePrefix());
        // a saturated pool makes the submitting thread evaluate the product itself
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        log.info("Configured product evaluation executor (core: {}, max: {}, queue: {})",
                executor.getCorePoolSize(), executor.getMaxPoolSize(), batch.queueCapacity());
        return executor;
    }
}
