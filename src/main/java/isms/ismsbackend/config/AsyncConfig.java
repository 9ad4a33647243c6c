package isms.ismsbackend.config;

import isms.ismsbackend.service.cache.CacheInvalidationRejectedHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    public static final String CACHE_INVALIDATION_EXECUTOR = "cacheInvalidationExecutor";

    /**
     * 캐시 무효화 전용 스레드 풀
     */
    @Bean(name = CACHE_INVALIDATION_EXECUTOR)
    public ThreadPoolTaskExecutor cacheInvalidationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("cache-invalidate-");
        // 큐가 가득 차면 documentId를 남기고 버린다
        executor.setRejectedExecutionHandler(new CacheInvalidationRejectedHandler());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
