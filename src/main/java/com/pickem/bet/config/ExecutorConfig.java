package com.pickem.bet.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class ExecutorConfig {

    /**
     * Workers settling the wagers of one event in parallel. Each wager runs in its own transaction.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService settlementExecutor(BettingConfig bettingConfig) {
        int threads = Math.max(1, bettingConfig.getSettlementParallelism());
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "settlement-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        log.info("🧵 Settlement pool created | Threads: {}", threads);
        return Executors.newFixedThreadPool(threads, factory);
    }
}
