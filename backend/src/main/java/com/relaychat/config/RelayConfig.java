package com.relaychat.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class RelayConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs primary store calls so callers can give up after a timeout. The queue
     * is bounded; a full queue fails the call instead of piling up work behind a
     * stalled database.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService primaryStoreExecutor(
            @Value("${relay.primary.pool-size:4}") int poolSize,
            @Value("${relay.primary.queue-capacity:1000}") int queueCapacity) {
        return boundedPool("primary-store-", poolSize, queueCapacity);
    }

    /**
     * Sends broadcast frames to recipients in parallel. A full queue fails the
     * send, which evicts that recipient.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService fanOutExecutor(
            @Value("${relay.broadcast.pool-size:16}") int poolSize,
            @Value("${relay.broadcast.queue-capacity:10000}") int queueCapacity) {
        return boundedPool("fan-out-", poolSize, queueCapacity);
    }

    private static ExecutorService boundedPool(String namePrefix, int poolSize, int queueCapacity) {
        AtomicInteger threads = new AtomicInteger();
        return new ThreadPoolExecutor(poolSize, poolSize, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                task -> {
                    Thread thread = new Thread(task, namePrefix + threads.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }
}
