package com.questrail.rendezvous.internal.time;

import com.questrail.rendezvous.time.ManualMonotonicClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduledExecutorSchedulerTest
 * -----------------------------------------------------------------------------
 * Tests for the production deadline scheduler.
 *
 * Note: These tests use real time. Tolerances are generous.
 */
class ScheduledExecutorSchedulerTest {

    private ScheduledExecutorService executor;
    private ScheduledExecutorScheduler scheduler;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadScheduledExecutor();
        scheduler = new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void scheduleAfterRunsOnceDelayElapsed() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        long before = System.nanoTime();

        scheduler.scheduleAfter(Duration.ofMillis(30), SystemMonotonicClock.INSTANCE, latch::countDown);

        assertTrue(latch.await(1, TimeUnit.SECONDS), "Deadline task should run");
        assertTrue(System.nanoTime() - before >= TimeUnit.MILLISECONDS.toNanos(30));
    }

    @Test
    void pastDeadlineRunsImmediately() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        scheduler.scheduleAtNanos(SystemMonotonicClock.INSTANCE.nowNanos() - TimeUnit.SECONDS.toNanos(1),
            latch::countDown);

        assertTrue(latch.await(200, TimeUnit.MILLISECONDS));
    }

    @Test
    void cancelledDeadlineNeverFires() throws InterruptedException {
        AtomicBoolean fired = new AtomicBoolean(false);

        Cancellable handle = scheduler.scheduleAfter(Duration.ofMillis(50), SystemMonotonicClock.INSTANCE,
            () -> fired.set(true));

        assertTrue(handle.cancel());
        Thread.sleep(120);
        assertFalse(fired.get());
        assertFalse(handle.cancel(), "Second cancel has nothing to withdraw");
    }

    @Test
    void deadlineIsMeasuredOnSchedulerClock() throws InterruptedException {
        // A deadline already reached on the scheduler's own clock fires at once,
        // however far the system clock is from it.
        ManualMonotonicClock manual = new ManualMonotonicClock();
        manual.advanceMillis(10_000);
        ScheduledExecutorScheduler onManual = new ScheduledExecutorScheduler(executor, manual);
        CountDownLatch latch = new CountDownLatch(1);

        onManual.scheduleAtNanos(manual.nowNanos(), latch::countDown);

        assertTrue(latch.await(200, TimeUnit.MILLISECONDS));
    }

    @Test
    void negativeDelayIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> scheduler.scheduleAfter(Duration.ofMillis(-1), SystemMonotonicClock.INSTANCE, () -> { }));
    }

    @Test
    void shutDownExecutorRejects() {
        executor.shutdown();

        assertThrows(RejectedExecutionException.class,
            () -> scheduler.scheduleAtNanos(SystemMonotonicClock.INSTANCE.nowNanos(), () -> { }));
    }

    @Test
    void overlongDelaySaturatesInsteadOfOverflowing() throws InterruptedException {
        AtomicBoolean fired = new AtomicBoolean(false);

        Cancellable handle = scheduler.scheduleAfter(Duration.ofMillis(Long.MAX_VALUE), SystemMonotonicClock.INSTANCE,
            () -> fired.set(true));

        Thread.sleep(50);
        assertFalse(fired.get());
        assertTrue(handle.cancel());
    }

    @Test
    void delayUntilClampsToNonNegativeRange() {
        assertEquals(0, ScheduledExecutorScheduler.delayUntil(5, 10));
        assertEquals(0, ScheduledExecutorScheduler.delayUntil(Long.MIN_VALUE, 10));
        assertEquals(25, ScheduledExecutorScheduler.delayUntil(35, 10));
        assertEquals(Long.MAX_VALUE, ScheduledExecutorScheduler.delayUntil(Long.MAX_VALUE, -10));
    }
}
