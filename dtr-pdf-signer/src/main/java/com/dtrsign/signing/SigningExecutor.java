package com.dtrsign.signing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs signing requests off the caller's thread on a fixed worker pool.
 */
public final class SigningExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SigningExecutor.class);

    private final SigningOrchestrator orchestrator;
    private final ExecutorService pool;

    public SigningExecutor(SigningOrchestrator orchestrator, int workers) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1, got " + workers);
        }
        this.pool = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
    }

    public CompletableFuture<SigningResult> submit(SigningRequest request) {
        Objects.requireNonNull(request, "request");
        return CompletableFuture.supplyAsync(() -> orchestrator.sign(request), pool);
    }

    /**
     * Stops accepting work and interrupts running requests after {@code graceMillis}; interrupted requests
     * abort between stages.
     */
    public void shutdown(long graceMillis) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(graceMillis, TimeUnit.MILLISECONDS)) {
                log.warn("[executor] workers still busy after {} ms, interrupting", graceMillis);
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        shutdown(TimeUnit.SECONDS.toMillis(30));
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "dtr-signer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
