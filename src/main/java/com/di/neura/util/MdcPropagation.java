package com.di.neura.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Carries the submitting thread's MDC ({@code discoveryRunId}, {@code requestId})
 * onto fingerprinting workers.
 */
public final class MdcPropagation {

    private MdcPropagation() {
    }

    /** Snapshot of the caller's MDC, installed around {@code task} on whichever thread runs it. */
    public static Runnable wrapRunnable(Runnable task) {
        Map<String, String> snapshot = copyMdc();
        return () -> {
            snapshot.forEach(MDC::put);
            try {
                task.run();
            } finally {
                snapshot.keySet().forEach(MDC::remove);
            }
        };
    }

    /** Every task submitted through the returned executor runs under its submitter's MDC. */
    public static ExecutorService wrapExecutor(ExecutorService workers) {
        return new RunScopedExecutor(workers);
    }

    /** Never null. */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    // Lifecycle calls go straight to the worker pool; only task submission is wrapped.
    private static final class RunScopedExecutor extends AbstractExecutorService {
        private final ExecutorService workers;

        RunScopedExecutor(ExecutorService workers) {
            this.workers = workers;
        }

        @Override
        public void execute(Runnable command) {
            workers.execute(wrapRunnable(command));
        }

        @Override
        public void shutdown() {
            workers.shutdown();
        }

        @Override
        public List<Runnable> shutdownNow() {
            return workers.shutdownNow();
        }

        @Override
        public boolean isShutdown() {
            return workers.isShutdown();
        }

        @Override
        public boolean isTerminated() {
            return workers.isTerminated();
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
            return workers.awaitTermination(timeout, unit);
        }
    }
}
