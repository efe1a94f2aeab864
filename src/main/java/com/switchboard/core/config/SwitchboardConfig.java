package com.switchboard.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class SwitchboardConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs generative classifier calls so callers can bound them with a timeout
     * and cancel them.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService generativeExecutor(SwitchboardProperties properties) {
        return Executors.newFixedThreadPool(properties.getResolver().getGenerativeThreads(),
                namedDaemonThreads("generative"));
    }

    /** Backs asynchronous resolution requests. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService resolveExecutor() {
        return Executors.newCachedThreadPool(namedDaemonThreads("resolve"));
    }

    static ThreadFactory namedDaemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
