package in.sitewatch.application.alerting;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns every piece of timed work in the alerting engine: the repeating evaluation
 * and escalation passes, and one-shot notification retries.
 *
 * Retries are indexed by {@link RetryKey} so they can be inspected and cancelled;
 * {@link #shutdown()} cancels all of them along with the repeating tasks.
 */
public final class AlertTaskScheduler {
    private static final Logger log = LoggerFactory.getLogger(AlertTaskScheduler.class);

    private final ScheduledExecutorService scheduler;
    private final List<ScheduledFuture<?>> periodicTasks = new ArrayList<>();
    private final Map<RetryKey, PendingRetry> pendingRetries = new ConcurrentHashMap<>();
    private volatile boolean shutdown = false;

    public AlertTaskScheduler() {
        this(2);
    }

    public AlertTaskScheduler(int threads) {
        AtomicInteger counter = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(threads, r -> {
            Thread t = new Thread(r, "alerting-scheduler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Run a task repeatedly. Exceptions are logged and never cancel the schedule.
     */
    public synchronized void scheduleAtFixedRate(String name, Runnable task, Duration interval) {
        requireRunning();
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(() -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("[SCHEDULER] Task '{}' failed: {}", name, e.getMessage(), e);
            }
        }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        periodicTasks.add(future);
        log.info("[SCHEDULER] Scheduled '{}' every {}s", name, interval.toSeconds());
    }

    /**
     * Schedule a one-shot retry. A retry already pending under the same key is cancelled
     * and replaced.
     *
     * @return false if the scheduler has been shut down
     */
    public boolean scheduleRetry(RetryKey key, Runnable task, Duration delay) {
        if (shutdown) {
            log.debug("[SCHEDULER] Ignoring retry for {} after shutdown", key);
            return false;
        }

        PendingRetry pending = new PendingRetry();
        PendingRetry previous = pendingRetries.put(key, pending);
        if (previous != null) {
            previous.cancel();
        }

        try {
            pending.future = scheduler.schedule(() -> {
                if (pending.cancelled || !pendingRetries.remove(key, pending)) {
                    return;
                }
                try {
                    task.run();
                } catch (Exception e) {
                    log.error("[SCHEDULER] Retry {} failed: {}", key, e.getMessage(), e);
                }
            }, Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            pendingRetries.remove(key, pending);
            log.debug("[SCHEDULER] Retry {} rejected, scheduler stopped", key);
            return false;
        }
        return true;
    }

    /**
     * Cancel all pending retries for an alert.
     *
     * @return number of retries cancelled
     */
    public int cancelRetries(String alertId) {
        int cancelled = 0;
        for (Map.Entry<RetryKey, PendingRetry> entry : pendingRetries.entrySet()) {
            if (entry.getKey().alertId().equals(alertId)
                && pendingRetries.remove(entry.getKey(), entry.getValue())) {
                entry.getValue().cancel();
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.debug("[SCHEDULER] Cancelled {} pending retries for {}", cancelled, alertId);
        }
        return cancelled;
    }

    public int pendingRetryCount() {
        return pendingRetries.size();
    }

    public boolean hasPendingRetry(RetryKey key) {
        return pendingRetries.containsKey(key);
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * Cancel repeating tasks and every pending retry, then stop the executor.
     */
    public synchronized void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;

        for (ScheduledFuture<?> task : periodicTasks) {
            task.cancel(false);
        }
        periodicTasks.clear();

        int cancelled = 0;
        for (PendingRetry retry : pendingRetries.values()) {
            retry.cancel();
            cancelled++;
        }
        pendingRetries.clear();

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }

        log.info("[SCHEDULER] Stopped ({} pending retries cancelled)", cancelled);
    }

    private void requireRunning() {
        if (shutdown) {
            throw new IllegalStateException("Alert task scheduler has been shut down");
        }
    }

    private static final class PendingRetry {
        private volatile ScheduledFuture<?> future;
        private volatile boolean cancelled;

        void cancel() {
            cancelled = true;
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }
    }
}
