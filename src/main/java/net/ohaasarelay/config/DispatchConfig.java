package net.ohaasarelay.config;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the process clock and the bounded worker pool that runs guild dispatches.
 */
@Configuration
public class DispatchConfig {

    private static final Logger log = LoggerFactory.getLogger(DispatchConfig.class);
    private static final String DISPATCH_THREAD_PREFIX = "HoroscopeDispatch-";
    private static final int DISPATCH_SHUTDOWN_TIMEOUT_SECONDS = 30;

    /**
     * Single clock for both the day key and the post-time comparison.
     */
    @Bean
    public Clock horoscopeClock(OhaasaProperties properties) {
        Clock clock = Clock.system(properties.resolveZone());
        log.info("Daily horoscope clock uses zone {}", clock.getZone());
        return clock;
    }

    /**
     * Bounded executor for fire-and-forget dispatches; a full queue rejects new submissions.
     */
    @Bean(name = "dispatchExecutor")
    public ThreadPoolTaskExecutor dispatchExecutor(OhaasaProperties properties) {
        OhaasaProperties.Dispatch dispatch = properties.getDispatch();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(DISPATCH_THREAD_PREFIX);
        executor.setCorePoolSize(dispatch.getMaxParallel());
        executor.setMaxPoolSize(dispatch.getMaxParallel());
        executor.setQueueCapacity(dispatch.getQueueCapacity());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(DISPATCH_SHUTDOWN_TIMEOUT_SECONDS);
        return executor;
    }
}
