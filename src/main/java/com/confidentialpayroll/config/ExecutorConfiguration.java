package com.confidentialpayroll.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Thread and time configuration.
 *
 * The oracle round trip is the only asynchronous boundary of the protocol. Callbacks are
 * delivered on a dedicated scheduler so they never run on a request thread, and re-enter
 * the protocol through the same state guard as every other call.
 */
@Configuration
@EnableScheduling
@Slf4j
public class ExecutorConfiguration {

    /**
     * Scheduler delivering decryption oracle callbacks.
     */
    @Bean(name = "oracleTaskScheduler")
    public ThreadPoolTaskScheduler oracleTaskScheduler(ProtocolProperties properties) {
        int poolSize = Math.max(1, properties.getOracle().getSchedulerPoolSize());
        log.info("Configuring oracle callback scheduler with {} threads", poolSize);

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("oracle-callback-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);

        return scheduler;
    }

    /**
     * Time source for cooldowns and protocol timestamps.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
