package me.kestrel.agent.domain.loop;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.kestrel.agent.infrastructure.config.BotProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs detached background jobs (memory consolidation) on a small bounded
 * pool and keeps a handle for every job that has not finished yet.
 *
 * <p>
 * A job's failure is logged once and never reaches the submitter. Shutdown
 * drains the in-flight set before stopping the pool, so work accepted before
 * teardown gets a chance to complete.
 */
@Component
@Slf4j
public class BackgroundTaskSupervisor {

    private static final long TERMINATION_WAIT_MS = 1000;

    private final ThreadPoolExecutor executor;
    private final Set<CompletableFuture<Void>> inFlight = ConcurrentHashMap.newKeySet();
    private final int maxInFlight;
    private final Duration drainTimeout;

    private volatile boolean accepting = true;

    public BackgroundTaskSupervisor(BotProperties properties) {
        BotProperties.BackgroundProperties config = properties.getBackground();
        int threads = Math.max(1, config.getThreads());
        this.maxInFlight = Math.max(1, config.getMaxInFlight());
        this.drainTimeout = config.getDrainTimeout();

        AtomicInteger counter = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), r -> {
                    Thread t = new Thread(r, "background-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
    }

    /**
     * Schedules a job.
     *
     * @return false if the supervisor is shutting down or already has
     *         {@code maxInFlight} unfinished jobs
     */
    public boolean submit(String name, Runnable job) {
        if (!accepting) {
            log.warn("[Supervisor] Rejected '{}': shutting down", name);
            return false;
        }

        CompletableFuture<Void> handle = new CompletableFuture<>();
        synchronized (inFlight) {
            if (inFlight.size() >= maxInFlight) {
                log.warn("[Supervisor] Rejected '{}': {} jobs already in flight", name, inFlight.size());
                return false;
            }
            inFlight.add(handle);
        }

        try {
            executor.execute(() -> runObserved(name, job, handle));
        } catch (RejectedExecutionException e) {
            inFlight.remove(handle);
            log.warn("[Supervisor] Rejected '{}': {}", name, e.getMessage());
            return false;
        }
        log.debug("[Supervisor] Submitted '{}' ({} in flight)", name, inFlight.size());
        return true;
    }

    private void runObserved(String name, Runnable job, CompletableFuture<Void> handle) {
        long start = System.nanoTime();
        try {
            job.run();
            log.debug("[Supervisor] '{}' finished in {}ms", name, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        } catch (RuntimeException e) {
            log.error("[Supervisor] '{}' failed", name, e);
        } finally {
            inFlight.remove(handle);
            handle.complete(null);
        }
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Waits for every job in flight, including jobs submitted while waiting,
     * without cancelling anything.
     *
     * @return true if the supervisor became idle within the timeout
     */
    public boolean awaitAll(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            List<CompletableFuture<Void>> pending = List.copyOf(inFlight);
            if (pending.isEmpty()) {
                return true;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            try {
                CompletableFuture.allOf(pending.toArray(CompletableFuture[]::new))
                        .get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                return false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            } catch (ExecutionException e) {
                // handles only complete normally; keep draining
                log.debug("[Supervisor] Unexpected handle failure: {}", e.getMessage());
            }
        }
    }

    /**
     * Stops accepting work, drains in-flight jobs for up to {@code timeout},
     * then stops the pool. Safe to call more than once.
     */
    public void shutdown(Duration timeout) {
        accepting = false;
        if (!awaitAll(timeout)) {
            log.warn("[Supervisor] {} job(s) still running after {}s drain", inFlight.size(), timeout.toSeconds());
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(TERMINATION_WAIT_MS, TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Supervisor] Shut down");
    }

    public void shutdown() {
        shutdown(drainTimeout);
    }
}
