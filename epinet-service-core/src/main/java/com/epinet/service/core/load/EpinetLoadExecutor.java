package com.epinet.service.core.load;

import com.epinet.service.core.config.EpinetProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Bounded worker pool running aggregation runs off the request threads. */
@Component
@Slf4j
@RequiredArgsConstructor
public class EpinetLoadExecutor implements Executor {

    private final EpinetProperties properties;

    private ExecutorService executor;

    @PostConstruct
    void start() {
        init(properties.getLoad().getWorkers());
    }

    void init(int workers) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "epinet-load-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        executor = Executors.newFixedThreadPool(workers, factory);
        log.info("Epinet load executor started workers={}", workers);
    }

    @PreDestroy
    void stop() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Override
    public void execute(Runnable command) {
        if (executor == null) {
            throw new IllegalStateException("Epinet load executor is not started");
        }
        executor.execute(command);
    }
}
