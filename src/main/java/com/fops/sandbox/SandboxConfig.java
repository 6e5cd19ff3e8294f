package com.fops.sandbox;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class SandboxConfig {

    /**
     * Bounded pool that sandbox validations and async proposals run on, so
     * subprocess waits stay off the caller's thread.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService validationExecutor(SandboxProperties properties) {
        int threads = Math.max(1, properties.getMaxParallel());
        var counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "fops-validate-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(threads, factory);
    }
}
