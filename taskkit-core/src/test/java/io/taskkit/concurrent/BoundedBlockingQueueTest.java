package io.taskkit.concurrent;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BoundedBlockingQueueTest {

    @Test
    void zeroCapacityShouldMeanMaximum() {
        assertEquals(BoundedBlockingQueue.MAX_CAPACITY, new BoundedBlockingQueue<String>(0).capacity());
        assertThrows(IllegalArgumentException.class, () -> new BoundedBlockingQueue<String>(-1));
        assertThrows(IllegalArgumentException.class, () -> new BoundedBlockingQueue<String>(BoundedBlockingQueue.MAX_CAPACITY + 1));
    }

    @Test
    void pushAndPopShouldBeFifo() throws Exception {
        BoundedBlockingQueue<String> queue = new BoundedBlockingQueue<>(4);
        assertEquals(0, queue.count());
        assertTrue(queue.push("a"));
        assertTrue(queue.push("b"));
        assertEquals(2, queue.count());

        assertEquals("a", queue.pop());
        assertEquals("b", queue.pop(Duration.ZERO));
        assertEquals(0, queue.count());
    }

    @Test
    void nullItemsShouldBeRejected() {
        BoundedBlockingQueue<String> queue = new BoundedBlockingQueue<>(1);
        assertThrows(NullPointerException.class, () -> queue.push(null));
        assertThrows(NullPointerException.class, () -> queue.push(null, Duration.ofMillis(10)));
    }

    @Test
    void zeroTimeoutShouldFailImmediatelyWhenFull() throws Exception {
        BoundedBlockingQueue<String> queue = new BoundedBlockingQueue<>(1);
        assertTrue(queue.push("1"));
        assertFalse(queue.push("2", Duration.ZERO));
        assertEquals(1, queue.count());
    }

    @Test
    void popShouldTimeOutOnEmptyQueue() throws Exception {
        BoundedBlockingQueue<String> queue = new BoundedBlockingQueue<>(1);
        long start = System.nanoTime();
        assertNull(queue.pop(Duration.ofMillis(100)));
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(90));
    }

    @Test
    void popShouldWaitForPush() throws Exception {
        BoundedBlockingQueue<String> queue = new BoundedBlockingQueue<>(2);
        AtomicReference<String> popped = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        Thread consumer = new Thread(() -> {
            try {
                popped.set(queue.pop(Duration.ofSeconds(5)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                done.countDown();
            }
        });
        consumer.start();

        Thread.sleep(50);
        assertTrue(queue.push("late"));
        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals("late", popped.get());
    }

    @Test
    void pushShouldWaitForPop() throws Exception {
        BoundedBlockingQueue<Integer> queue = new BoundedBlockingQueue<>(1);
        assertTrue(queue.push(1));

        CountDownLatch pushed = new CountDownLatch(1);
        Thread producer = new Thread(() -> {
            try {
                if (queue.push(2, Duration.ofSeconds(5))) {
                    pushed.countDown();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        producer.start();

        assertFalse(pushed.await(100, TimeUnit.MILLISECONDS));
        assertEquals(1, queue.pop());
        assertTrue(pushed.await(5, TimeUnit.SECONDS));
        assertEquals(2, queue.pop());
    }

    @Test
    void disableShouldReleaseBlockedConsumersAndFailFast() throws Exception {
        BoundedBlockingQueue<String> queue = new BoundedBlockingQueue<>(2);
        CountDownLatch released = new CountDownLatch(1);
        AtomicReference<String> popped = new AtomicReference<>("unset");

        Thread consumer = new Thread(() -> {
            try {
                popped.set(queue.pop());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                released.countDown();
            }
        });
        consumer.start();
        Thread.sleep(50);

        queue.disable();
        assertTrue(released.await(5, TimeUnit.SECONDS));
        assertNull(popped.get());
        assertTrue(queue.isDisabled());
        assertFalse(queue.push("x"));
        assertFalse(queue.push("x", Duration.ofSeconds(1)));
        assertNull(queue.pop(Duration.ofSeconds(1)));
    }

    @Test
    void clearShouldReleaseEveryItemInOrder() throws Exception {
        BoundedBlockingQueue<String> queue = new BoundedBlockingQueue<>(5);
        queue.push("a");
        queue.push("b");
        queue.push("c");

        List<String> released = new ArrayList<>();
        assertEquals(3, queue.clear(released::add));
        assertEquals(List.of("a", "b", "c"), released);
        assertEquals(0, queue.count());
    }

    @Test
    void deleteShouldRemoveOnlyFirstMatch() throws Exception {
        BoundedBlockingQueue<String> queue = new BoundedBlockingQueue<>(5);
        queue.push("keep");
        queue.push("drop");
        queue.push("drop");

        List<String> released = new ArrayList<>();
        assertTrue(queue.delete("drop"::equals, released::add));
        assertEquals(List.of("drop"), released);
        assertEquals(2, queue.count());
        assertFalse(queue.delete("missing"::equals, released::add));
    }

    @Test
    void iterateShouldStopWhenVisitorReturnsFalse() throws Exception {
        BoundedBlockingQueue<String> queue = new BoundedBlockingQueue<>(5);
        queue.push("a");
        queue.push("b");
        queue.push("c");

        List<String> visited = new ArrayList<>();
        queue.iterate(item -> {
            visited.add(item);
            return !"b".equals(item);
        });

        assertEquals(List.of("a", "b"), visited);
        assertEquals(3, queue.count());
    }

    @Test
    void destroyShouldDisableAndRelease() throws Exception {
        BoundedBlockingQueue<String> queue = new BoundedBlockingQueue<>(5);
        queue.push("a");

        List<String> released = new ArrayList<>();
        queue.destroy(released::add);

        assertTrue(queue.isDisabled());
        assertEquals(List.of("a"), released);
        assertEquals(0, queue.count());
    }
}
