package com.libragraph.salvage.core.analysis;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@ApplicationScoped
public class AnalysisExecutorProducer {

    private ExecutorService executor;

    @Produces
    @ApplicationScoped
    @Named("analysisExecutor")
    public ExecutorService analysisExecutor(AnalysisSettings settings) {
        executor = Executors.newFixedThreadPool(settings.workerCount(), threadFactory());
        return executor;
    }

    static ThreadFactory threadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "salvage-analysis-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) executor.shutdown();
    }
}
