package com.aigreentick.services.dealership.config;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.aigreentick.services.dealership.queue.enums.JobType;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Configuration
@EnableScheduling
@RequiredArgsConstructor
@Slf4j
public class ExecutorConfig {

    private final Environment environment;

    private Map<JobType, WorkerPool> pools;

    /**
     * One fixed pool per job type. Pool size and permit count both equal the
     * configured concurrency ({@code queue.concurrency.<job_code>}), so a type never
     * runs more jobs at once than its limit. Campaign orchestration types default to 1,
     * which keeps a single batch of a campaign in flight at a time.
     */
    @Bean(name = "queueWorkerPools")
    public Map<JobType, WorkerPool> queueWorkerPools() {
        Map<JobType, WorkerPool> created = new EnumMap<>(JobType.class);

        for (JobType type : JobType.values()) {
            int concurrency = environment.getProperty(
                    "queue.concurrency." + type.getCode(), Integer.class, type.getDefaultConcurrency());
            if (concurrency < 1) {
                throw new IllegalStateException("Concurrency for " + type.getCode() + " must be at least 1");
            }

            AtomicInteger threadCounter = new AtomicInteger(0);
            ExecutorService executor = Executors.newFixedThreadPool(
                    concurrency,
                    r -> {
                        Thread t = new Thread(r);
                        t.setName("queue-" + type.getCode() + "-" + threadCounter.incrementAndGet());
                        t.setDaemon(false);
                        return t;
                    });

            created.put(type, new WorkerPool(type, concurrency, executor, new Semaphore(concurrency)));
            log.info("Initialized worker pool. type={} concurrency={}", type.getCode(), concurrency);
        }

        pools = Collections.unmodifiableMap(created);
        return pools;
    }

    @PreDestroy
    public void shutdownPools() {
        if (pools == null) {
            return;
        }
        pools.values().forEach(pool -> pool.executor().shutdown());
        for (WorkerPool pool : pools.values()) {
            try {
                if (!pool.executor().awaitTermination(30, TimeUnit.SECONDS)) {
                    log.warn("Worker pool did not drain in time. type={}", pool.type().getCode());
                    pool.executor().shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pool.executor().shutdownNow();
            }
        }
        log.info("Worker pools shut down");
    }

    public record WorkerPool(
            JobType type,
            int concurrency,
            ExecutorService executor,
            Semaphore permits
    ) {
        public int inFlight() {
            return concurrency - permits.availablePermits();
        }
    }
}
