package com.jay.dcfengine.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Worker pool shared by the scenario runner and the sensitivity analyzer.
 * Tasks only read immutable inputs and write their own result, so no locking is involved.
 */
@Slf4j
@Configuration
public class ExecutorConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService valuationExecutor(EngineConfig config) {
        int threads = Math.max(1, config.execution().getParallelism());
        log.info("Valuation worker pool started with {} threads", threads);
        return Executors.newFixedThreadPool(threads);
    }
}
