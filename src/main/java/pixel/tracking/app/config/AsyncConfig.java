package pixel.tracking.app.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Configuration for async handling of open events.
 * Engagement notifications run on a dedicated pool, off the pixel request threads.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    @Bean(name = "trackingEventExecutor")
    public Executor trackingEventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(1000); // Bursts of opens queue up instead of spawning threads
        executor.setThreadNamePrefix("tracking-event-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
