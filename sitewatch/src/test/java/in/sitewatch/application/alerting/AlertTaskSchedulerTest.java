package in.sitewatch.application.alerting;

import in.sitewatch.domain.rule.ChannelType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AlertTaskSchedulerTest {

    private AlertTaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new AlertTaskScheduler();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    private static RetryKey key(String alertId, ChannelType channel) {
        return new RetryKey(alertId, "rule-1", 0, 0, channel);
    }

    @Test
    void retryRunsAndLeavesIndex() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);

        assertTrue(scheduler.scheduleRetry(key("a1", ChannelType.WEBHOOK), ran::countDown, Duration.ofMillis(20)));

        assertTrue(ran.await(2, TimeUnit.SECONDS));
        Thread.sleep(50);
        assertEquals(0, scheduler.pendingRetryCount());
    }

    @Test
    void sameKeyReplacesPendingRetry() throws Exception {
        AtomicInteger first = new AtomicInteger();
        CountDownLatch second = new CountDownLatch(1);
        RetryKey key = key("a1", ChannelType.WEBHOOK);

        scheduler.scheduleRetry(key, first::incrementAndGet, Duration.ofMillis(100));
        scheduler.scheduleRetry(key, second::countDown, Duration.ofMillis(100));

        assertEquals(1, scheduler.pendingRetryCount());
        assertTrue(second.await(2, TimeUnit.SECONDS));
        Thread.sleep(150);
        assertEquals(0, first.get(), "Replaced retry must not run");
    }

    @Test
    void cancelRetriesForOneAlert() {
        scheduler.scheduleRetry(key("a1", ChannelType.WEBHOOK), () -> {}, Duration.ofMinutes(5));
        scheduler.scheduleRetry(key("a1", ChannelType.CHAT), () -> {}, Duration.ofMinutes(5));
        scheduler.scheduleRetry(key("a2", ChannelType.WEBHOOK), () -> {}, Duration.ofMinutes(5));

        assertEquals(2, scheduler.cancelRetries("a1"));
        assertEquals(1, scheduler.pendingRetryCount());
        assertFalse(scheduler.hasPendingRetry(key("a1", ChannelType.CHAT)));
        assertTrue(scheduler.hasPendingRetry(key("a2", ChannelType.WEBHOOK)));
    }

    @Test
    void shutdownCancelsEverything() {
        scheduler.scheduleAtFixedRate("noop", () -> {}, Duration.ofMinutes(1));
        scheduler.scheduleRetry(key("a1", ChannelType.WEBHOOK), () -> {}, Duration.ofMinutes(5));

        scheduler.shutdown();

        assertTrue(scheduler.isShutdown());
        assertEquals(0, scheduler.pendingRetryCount());
        assertFalse(scheduler.scheduleRetry(key("a2", ChannelType.WEBHOOK), () -> {}, Duration.ZERO));
        assertThrows(IllegalStateException.class,
            () -> scheduler.scheduleAtFixedRate("late", () -> {}, Duration.ofMinutes(1)));
    }

    @Test
    void failingPeriodicTaskKeepsRunning() throws Exception {
        CountDownLatch runs = new CountDownLatch(3);

        scheduler.scheduleAtFixedRate("flaky", () -> {
            runs.countDown();
            throw new IllegalStateException("boom");
        }, Duration.ofMillis(20));

        assertTrue(runs.await(2, TimeUnit.SECONDS), "Exceptions must not cancel the schedule");
    }
}
