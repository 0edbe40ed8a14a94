package com.catdb.util;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs work on a background thread and waits for it no longer than a deadline.
 *
 * <p>On timeout the worker is interrupted, but a blocking driver call may keep running until it
 * returns on its own. The caller gets its {@link DeadlineOutcome} either way.
 */
@Slf4j
public class DeadlineRunner implements AutoCloseable {

    private final ExecutorService executor;

    /**
     * Create a runner with daemon worker threads.
     *
     * @param threadPrefix worker thread name prefix
     */
    public DeadlineRunner(String threadPrefix) {
        this.executor = Executors.newCachedThreadPool(daemonThreads(threadPrefix));
    }

    /**
     * Run work with a deadline.
     *
     * @param work unit of work
     * @param deadline maximum wait
     * @param <T> result type
     * @return outcome
     */
    public <T> DeadlineOutcome<T> run(Callable<T> work, Duration deadline) {
        Future<T> future = executor.submit(work);
        try {
            return DeadlineOutcome.completed(future.get(deadline.toMillis(), TimeUnit.MILLISECONDS), deadline);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.debug("Bounded call timed out (deadline_ms={})", deadline.toMillis());
            return DeadlineOutcome.timedOut(deadline);
        } catch (ExecutionException e) {
            return DeadlineOutcome.failed(e.getCause() != null ? e.getCause() : e, deadline);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return DeadlineOutcome.failed(e, deadline);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    /**
     * Thread factory producing named daemon threads.
     *
     * @param prefix name prefix
     * @return factory
     */
    public static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
