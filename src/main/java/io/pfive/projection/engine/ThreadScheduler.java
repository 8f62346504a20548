// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.engine;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.pfive.projection.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.google.common.base.Preconditions.checkArgument;

/// Runs the tasks of one projection call with at most maxConcurrency of them executing at once.
///
/// The engine is often called from inside an outer parallel loop (one call per snapshot), so each
/// call states its own budget and gets its own short-lived pool rather than sharing a process-wide
/// one. With a budget of one, or a single task, everything runs sequentially on the calling thread.
/// Otherwise a fixed pool of min(maxConcurrency, tasks) threads drains a bounded queue holding the
/// remaining tasks, and each finished task frees its thread for the next one. The call returns only
/// after every task has finished. There is no cancellation or timeout.
///
/// Active and peak concurrency are tracked across all calls on one instance, so tests can check
/// that the budget is respected.
public class ThreadScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger peak = new AtomicInteger();

    public void runAll (List<? extends Runnable> tasks, int maxConcurrency) {
        checkArgument(maxConcurrency >= 1, "Concurrency budget must be at least one.");
        if (tasks.isEmpty()) return;
        int nWorkers = Math.min(maxConcurrency, tasks.size());
        if (nWorkers == 1) {
            LOG.debug("Running {} tasks sequentially on the calling thread.", tasks.size());
            for (Runnable task : tasks) tracked(task).run();
            return;
        }
        LOG.debug("Running {} tasks on {} worker threads.", tasks.size(), nWorkers);
        ThreadFactory threadFactory = new ThreadFactoryBuilder()
              .setNameFormat(Configuration.WORKER_THREAD_PREFIX + "%d")
              .setDaemon(true)
              .build();
        ThreadPoolExecutor executor = new ThreadPoolExecutor(nWorkers, nWorkers, 0L, TimeUnit.MILLISECONDS,
              new ArrayBlockingQueue<>(tasks.size()), threadFactory);
        try {
            for (Runnable task : tasks) executor.execute(tracked(task));
        } finally {
            executor.shutdown();
        }
        try {
            while (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                LOG.debug("Still waiting for {} active projection workers.", executor.getActiveCount());
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for projection workers.", e);
        }
    }

    /// Wrap the task to maintain the concurrency counters. Tasks are expected to handle their own
    /// errors, anything escaping is only logged so the pooled thread survives.
    private Runnable tracked (Runnable task) {
        return () -> {
            int now = active.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                task.run();
            } catch (Throwable t) {
                LOG.error("Uncaught error in projection worker.", t);
            } finally {
                active.decrementAndGet();
            }
        };
    }

    /// Highest number of tasks observed running at the same time.
    public int peakConcurrency () {
        return peak.get();
    }

    public int activeCount () {
        return active.get();
    }

}
