package com.platform.onboarding.handler;

import com.platform.onboarding.device.DeviceClient;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs apply steps either one after another or as a bounded fan-out.
 * 
 * Sequential runs stop at the first failure. Parallel runs let every
 * started step finish, then rethrow the failure of the earliest step in
 * list order.
 */
@Slf4j
public class StepRunner implements AutoCloseable {
    
    private final ExecutorService pool;
    
    public StepRunner(int maxParallel) {
        AtomicInteger counter = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(Math.max(1, maxParallel), runnable -> {
            Thread thread = new Thread(runnable, "apply-step-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
    
    public void runSequential(List<ApplyStep> steps, DeviceClient client) {
        for (ApplyStep step : steps) {
            checkInterrupted(step);
            step.run(client);
        }
    }
    
    public void runParallel(List<ApplyStep> steps, DeviceClient client) {
        if (steps.size() <= 1) {
            runSequential(steps, client);
            return;
        }
        List<Future<?>> futures = new ArrayList<>();
        for (ApplyStep step : steps) {
            futures.add(pool.submit(() -> step.run(client)));
        }
        
        RuntimeException failure = null;
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while waiting for parallel steps");
            } catch (ExecutionException e) {
                if (failure == null) {
                    failure = e.getCause() instanceof RuntimeException re
                        ? re
                        : new IllegalStateException(e.getCause());
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
    
    private static void checkInterrupted(ApplyStep step) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Interrupted before " + step.configClass().getDeclaredName()
                + (step.name() != null ? " " + step.name() : ""));
        }
    }
    
    @Override
    public void close() {
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Apply step pool did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
