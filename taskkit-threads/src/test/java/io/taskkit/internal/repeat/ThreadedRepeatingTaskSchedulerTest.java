package io.taskkit.internal.repeat;

import io.taskkit.concurrent.LockMisusePolicy;
import io.taskkit.core.CancelResult;
import io.taskkit.core.DelayUnit;
import io.taskkit.core.TaskHandles;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ThreadedRepeatingTaskSchedulerTest {

    private final ThreadedRepeatingTaskScheduler scheduler = new ThreadedRepeatingTaskScheduler(LockMisusePolicy.RAISE);

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void fixedDelayShouldRunImmediatelyThenRepeat() throws Exception {
        AtomicInteger runs = new AtomicInteger();

        long handle = scheduler.createFixedDelay(20, DelayUnit.MILLIS, (Object ignored) -> runs.incrementAndGet(), null);

        assertTrue(TaskHandles.isValid(handle));
        assertTrue(scheduler.isActive(handle));
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> runs.get() >= 3));

        CancelResult result = scheduler.cancel(handle);
        assertTrue(result.canceled());
        assertFalse(scheduler.isActive(handle));

        int afterCancel = runs.get();
        Thread.sleep(100);
        assertEquals(afterCancel, runs.get());
    }

    @Test
    void fixedRateShouldKeepCadenceFromFirstRun() throws Exception {
        List<Long> starts = new CopyOnWriteArrayList<>();

        long handle = scheduler.createFixedRate(100, DelayUnit.MILLIS, (Object ignored) -> {
            starts.add(System.nanoTime());
            sleepQuietly(40);
        }, null);

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> starts.size() >= 4));
        scheduler.cancel(handle);

        // fixed delay would put about 140ms between starts; fixed rate stays near 100ms on average
        long span = starts.get(3) - starts.get(0);
        assertTrue(TimeUnit.NANOSECONDS.toMillis(span) < 3 * 140, "span was " + TimeUnit.NANOSECONDS.toMillis(span) + "ms");
    }

    @Test
    void cancelShouldHandBackArgument() {
        long handle = scheduler.createFixedDelay(1, DelayUnit.HOURS, (String s) -> { }, "device-7");

        CancelResult result = scheduler.cancel(handle);

        assertTrue(result.canceled());
        assertEquals("device-7", result.argument());
        assertFalse(scheduler.cancel(handle).canceled());
        assertEquals(0, scheduler.activeCount());
    }

    @Test
    void cancelFromOwnCallbackShouldNotDeadlock() throws Exception {
        AtomicLong handle = new AtomicLong();
        AtomicReference<CancelResult> fromCallback = new AtomicReference<>();
        AtomicInteger runs = new AtomicInteger();
        CountDownLatch ready = new CountDownLatch(1);

        handle.set(scheduler.createFixedDelay(10, DelayUnit.MILLIS, (String s) -> {
            try {
                ready.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            runs.incrementAndGet();
            fromCallback.compareAndSet(null, scheduler.cancel(handle.get()));
        }, "self"));
        ready.countDown();

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> fromCallback.get() != null));
        assertTrue(fromCallback.get().canceled());
        assertEquals("self", fromCallback.get().argument());
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> scheduler.activeCount() == 0));
        assertEquals(1, runs.get());
    }

    @Test
    void backOffShouldGrowPauseUntilSuccess() throws Exception {
        List<Long> attempts = new CopyOnWriteArrayList<>();
        AtomicReference<String> succeededWith = new AtomicReference<>();

        long handle = scheduler.createBackOff(20, 200, 40, DelayUnit.MILLIS,
                (String s) -> {
                    attempts.add(System.nanoTime());
                    return attempts.size() == 4;
                },
                succeededWith::set,
                "session");

        assertTrue(TaskHandles.isValid(handle));
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> succeededWith.get() != null));
        assertEquals("session", succeededWith.get());
        assertEquals(4, attempts.size());
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> !scheduler.isActive(handle)));

        // pauses after failures: 60ms, 100ms, 140ms
        long lastGap = TimeUnit.NANOSECONDS.toMillis(attempts.get(3) - attempts.get(2));
        assertTrue(lastGap >= 130, "last gap was " + lastGap + "ms");
        assertFalse(scheduler.cancel(handle).canceled());
    }

    @Test
    void backOffPauseShouldStopGrowingAtMaxDelay() throws Exception {
        List<Long> attempts = new CopyOnWriteArrayList<>();
        CountDownLatch succeeded = new CountDownLatch(1);

        scheduler.createBackOff(10, 60, 60, DelayUnit.MILLIS,
                (Object ignored) -> {
                    attempts.add(System.nanoTime());
                    return attempts.size() == 5;
                },
                (Object ignored) -> succeeded.countDown(),
                null);

        assertTrue(succeeded.await(5, TimeUnit.SECONDS));

        // unclamped pauses would be 70, 130, 190 and 250ms
        for (int i = 1; i < attempts.size(); i++) {
            long gap = TimeUnit.NANOSECONDS.toMillis(attempts.get(i) - attempts.get(i - 1));
            assertTrue(gap >= 60, "gap " + i + " was " + gap + "ms");
        }
        long lastGap = TimeUnit.NANOSECONDS.toMillis(attempts.get(4) - attempts.get(3));
        assertTrue(lastGap < 200, "last gap was " + lastGap + "ms");
    }

    @Test
    void canceledBackOffShouldNotCallSuccess() {
        AtomicInteger successCalls = new AtomicInteger();

        long handle = scheduler.createBackOff(1, 10, 1, DelayUnit.HOURS,
                (Object ignored) -> true,
                (Object ignored) -> successCalls.incrementAndGet(),
                null);

        assertTrue(scheduler.cancel(handle).canceled());
        assertEquals(0, successCalls.get());
    }

    @Test
    void shortCircuitShouldRunWithoutWaiting() throws Exception {
        AtomicInteger runs = new AtomicInteger();

        long handle = scheduler.createFixedDelay(1, DelayUnit.HOURS, (Object ignored) -> runs.incrementAndGet(), null);
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> runs.get() == 1));

        assertTrue(scheduler.shortCircuit(handle));

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> runs.get() == 2));
        assertFalse(scheduler.shortCircuit(TaskHandles.INVALID));
    }

    @Test
    void changeIntervalNowShouldRestartCurrentPause() throws Exception {
        AtomicInteger runs = new AtomicInteger();

        long handle = scheduler.createFixedDelay(1, DelayUnit.HOURS, (Object ignored) -> runs.incrementAndGet(), null);
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> runs.get() == 1));

        assertTrue(scheduler.changeInterval(handle, 20, DelayUnit.MILLIS, true));

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> runs.get() >= 3));
        assertFalse(scheduler.changeInterval(handle, 0, DelayUnit.MILLIS, true));
    }

    @Test
    void zeroIntervalShouldReturnInvalidHandle() {
        assertEquals(TaskHandles.INVALID, scheduler.createFixedDelay(0, DelayUnit.SECONDS, (Object ignored) -> { }, null));
        assertEquals(TaskHandles.INVALID, scheduler.createFixedRate(0, DelayUnit.SECONDS, (Object ignored) -> { }, null));
        assertEquals(TaskHandles.INVALID, scheduler.createBackOff(1, 0, 1, DelayUnit.SECONDS,
                (Object ignored) -> true, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.createFixedDelay(-1, DelayUnit.SECONDS, (Object ignored) -> { }, null));
    }

    @Test
    void shutdownShouldCancelAllAndRejectNewTasks() {
        scheduler.createFixedDelay(1, DelayUnit.HOURS, (String s) -> { }, "x");
        scheduler.createFixedRate(1, DelayUnit.HOURS, (String s) -> { }, "y");

        List<Object> arguments = scheduler.shutdown();

        assertEquals(2, arguments.size());
        assertTrue(arguments.containsAll(List.of("x", "y")));
        assertEquals(0, scheduler.activeCount());
        assertEquals(TaskHandles.INVALID, scheduler.createFixedDelay(1, DelayUnit.SECONDS, (Object ignored) -> { }, null));
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(10);
        }
        return false;
    }
}
