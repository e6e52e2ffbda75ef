package com.tazifor.bidengine.service;

import com.tazifor.bidengine.config.BidEngineProperties.OverflowPolicy;
import com.tazifor.bidengine.exception.OverloadedException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * AuctionWorkerPool - fixed workers over a bounded queue, one task per ad opportunity
 *
 * <pre>
 *   submit ──▶ [ queue (capacity) ] ──▶ worker 1..N
 *                    │ full
 *                    ├─ REJECT_NEW : new task fails with OverloadedException
 *                    └─ DROP_OLDEST: head of the queue fails with OverloadedException,
 *                                    new task is queued
 * </pre>
 *
 * A task whose future was already completed by the caller (for instance by a response timeout)
 * is skipped when a worker reaches it.
 */
@Slf4j
public class AuctionWorkerPool {

    private final ThreadPoolExecutor executor;
    private final OverflowPolicy overflowPolicy;
    private final AtomicLong overloaded = new AtomicLong();

    public AuctionWorkerPool(int workerThreads, int queueCapacity, OverflowPolicy overflowPolicy) {
        this.overflowPolicy = overflowPolicy;
        this.executor = new ThreadPoolExecutor(
            workerThreads, workerThreads,
            0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(queueCapacity),
            new NamedThreadFactory("auction-worker-"),
            overflowHandler(overflowPolicy));

        log.info("Auction worker pool: {} threads, queue capacity {}, overflow policy {}",
            workerThreads, queueCapacity, overflowPolicy);
    }

    public <T> CompletableFuture<T> submit(Supplier<T> work) {
        AuctionTask<T> task = new AuctionTask<>(work);
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            overloaded.incrementAndGet();
            task.future.completeExceptionally(new OverloadedException("Auction queue full, request rejected"));
        }
        return task.future;
    }

    public int queuedTasks() {
        return executor.getQueue().size();
    }

    public long overloadedTasks() {
        return overloaded.get();
    }

    public OverflowPolicy overflowPolicy() {
        return overflowPolicy;
    }

    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private RejectedExecutionHandler overflowHandler(OverflowPolicy policy) {
        if (policy == OverflowPolicy.REJECT_NEW) {
            return new ThreadPoolExecutor.AbortPolicy();
        }

        return (task, pool) -> {
            if (pool.isShutdown()) {
                throw new RejectedExecutionException("Auction worker pool is shut down");
            }
            Runnable oldest = pool.getQueue().poll();
            if (oldest instanceof AuctionTask<?> dropped) {
                overloaded.incrementAndGet();
                dropped.future.completeExceptionally(
                    new OverloadedException("Auction queue full, oldest request dropped"));
            }
            pool.execute(task);
        };
    }

    private static final class AuctionTask<T> implements Runnable {
        private final Supplier<T> work;
        private final CompletableFuture<T> future = new CompletableFuture<>();

        AuctionTask(Supplier<T> work) {
            this.work = work;
        }

        @Override
        public void run() {
            if (future.isDone()) {
                return;
            }
            try {
                future.complete(work.get());
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            }
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
