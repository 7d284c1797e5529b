package io.suite4j.internal;

import io.suite4j.core.WorkItemSpec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class DelayedQueueTest {

    private ScheduledExecutorService loop;
    private DelayedQueue queue;

    @BeforeEach
    void setUp() throws Exception {
        loop = Executors.newSingleThreadScheduledExecutor();
        queue = onLoop(() -> new DelayedQueue(loop));
    }

    @AfterEach
    void tearDown() {
        loop.shutdownNow();
    }

    @Test
    void immediateItemsComeOutInInsertionOrder() throws Exception {
        WorkItem a = item("a");
        WorkItem b = item("b");
        WorkItem c = item("c");
        onLoop(() -> {
            queue.put(Duration.ZERO, a);
            queue.put(Duration.ZERO, b);
            queue.put(Duration.ZERO, c);
            return null;
        });

        assertThat(take("r1")).containsSame(a);
        assertThat(take("r1")).containsSame(b);
        assertThat(take("r1")).containsSame(c);
    }

    @Test
    void prefersItemNotLastHeldByRequester() throws Exception {
        WorkItem mine = itemHeldBy("mine", "r1");
        WorkItem other = item("other");
        onLoop(() -> {
            queue.put(Duration.ZERO, mine);
            queue.put(Duration.ZERO, other);
            return null;
        });

        assertThat(take("r1")).containsSame(other);
        assertThat(take("r2")).containsSame(mine);
    }

    @Test
    void takesOwnItemWhenEveryEligibleItemWasLastHeldByRequester() throws Exception {
        WorkItem one = itemHeldBy("1", "foo");
        WorkItem two = itemHeldBy("2", "foo");
        WorkItem three = itemHeldBy("3", "foo");
        onLoop(() -> {
            queue.put(Duration.ZERO, one);
            queue.put(Duration.ZERO, two);
            queue.put(Duration.ZERO, three);
            return null;
        });

        assertThat(take("bar")).containsSame(one);

        CompletableFuture<Optional<WorkItem>> forFoo = onLoop(() -> queue.takeNext("foo"));
        assertThat(forFoo.get(500, TimeUnit.MILLISECONDS)).containsSame(two);
        assertThat(onLoop(queue::size)).isEqualTo(1);
    }

    @Test
    void parkedRequestIsServedByLaterPut() throws Exception {
        CompletableFuture<Optional<WorkItem>> parked = onLoop(() -> queue.takeNext("r1"));
        assertThat(parked).isNotDone();
        assertThat(onLoop(queue::pendingRequests)).isEqualTo(1);

        WorkItem a = item("a");
        onLoop(() -> {
            queue.put(Duration.ZERO, a);
            return null;
        });

        assertThat(parked.get(1, TimeUnit.SECONDS)).containsSame(a);
        assertThat(onLoop(queue::pendingRequests)).isZero();
    }

    @Test
    void delayedItemIsHeldBackUntilItsDelayPasses() throws Exception {
        WorkItem late = item("late");
        long startNanos = System.nanoTime();
        onLoop(() -> {
            queue.put(Duration.ofMillis(300), late);
            return null;
        });

        CompletableFuture<Optional<WorkItem>> request = onLoop(() -> queue.takeNext("r1"));
        assertThat(request).isNotDone();

        assertThat(request.get(2, TimeUnit.SECONDS)).containsSame(late);
        assertThat(System.nanoTime() - startNanos).isGreaterThanOrEqualTo(TimeUnit.MILLISECONDS.toNanos(250));
    }

    @Test
    void immediateItemOvertakesEarlierDelayedItem() throws Exception {
        WorkItem late = item("late");
        WorkItem now = item("now");
        onLoop(() -> {
            queue.put(Duration.ofSeconds(30), late);
            queue.put(Duration.ZERO, now);
            return null;
        });

        assertThat(take("r1")).containsSame(now);
        assertThat(onLoop(queue::size)).isEqualTo(1);
    }

    @Test
    void closeResolvesParkedAndLaterRequestsEmpty() throws Exception {
        CompletableFuture<Optional<WorkItem>> parked = onLoop(() -> queue.takeNext("r1"));
        onLoop(() -> {
            queue.close();
            return null;
        });

        assertThat(parked.get(1, TimeUnit.SECONDS)).isEmpty();
        assertThat(take("r2")).isEmpty();
        assertThat(onLoop(queue::isClosed)).isTrue();
    }

    @Test
    void cancelledRequestDoesNotConsumeItem() throws Exception {
        CompletableFuture<Optional<WorkItem>> first = onLoop(() -> queue.takeNext("r1"));
        CompletableFuture<Optional<WorkItem>> second = onLoop(() -> queue.takeNext("r2"));
        first.cancel(false);

        WorkItem a = item("a");
        onLoop(() -> {
            queue.put(Duration.ZERO, a);
            return null;
        });

        assertThat(second.get(1, TimeUnit.SECONDS)).containsSame(a);
        assertThat(onLoop(queue::isEmpty)).isTrue();
    }

    @Test
    void drainReturnsEverythingLeftAfterClose() throws Exception {
        onLoop(() -> {
            queue.put(Duration.ZERO, item("a"));
            queue.put(Duration.ofMinutes(5), item("b"));
            queue.close();
            return null;
        });

        assertThat(onLoop(queue::drain))
                .extracting(WorkItem::classPath)
                .containsExactly("a", "b");
        assertThat(onLoop(queue::isEmpty)).isTrue();
    }

    private Optional<WorkItem> take(String requesterId) throws Exception {
        return onLoop(() -> queue.takeNext(requesterId)).get(1, TimeUnit.SECONDS);
    }

    private <T> T onLoop(Callable<T> action) throws Exception {
        return loop.submit(action).get(1, TimeUnit.SECONDS);
    }

    private static WorkItem item(String classPath) {
        return new WorkItem(WorkItemSpec.of(classPath, "test"));
    }

    private static WorkItem itemHeldBy(String classPath, String runnerId) {
        WorkItem item = item(classPath);
        item.checkOut(runnerId);
        item.requeued();
        return item;
    }
}
