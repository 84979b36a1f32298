package ou.capstone.fakelocation.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EventChannelTest {

    private ExecutorService scope;
    private EventChannel<String> channel;

    @BeforeEach
    void setUp() {
        scope = Executors.newSingleThreadExecutor();
        channel = new EventChannel<>("test", scope);
    }

    @AfterEach
    void tearDown() {
        scope.shutdownNow();
    }

    @Test
    void deliversToEverySubscriber() throws Exception {
        List<String> first = new CopyOnWriteArrayList<>();
        List<String> second = new CopyOnWriteArrayList<>();
        channel.subscribe(first::add);
        channel.subscribe(second::add);

        channel.publish("a").get(1, TimeUnit.SECONDS);
        channel.publish("b").get(1, TimeUnit.SECONDS);

        assertEquals(List.of("a", "b"), first);
        assertEquals(List.of("a", "b"), second);
    }

    @Test
    void eventWithoutSubscribersIsLost() throws Exception {
        channel.publish("nobody listening").get(1, TimeUnit.SECONDS);

        List<String> late = new CopyOnWriteArrayList<>();
        channel.subscribe(late::add);
        channel.publish("after").get(1, TimeUnit.SECONDS);

        assertEquals(List.of("after"), late, "Late subscriber must not see earlier events");
    }

    @Test
    void listenerAttachedBeforeDeliveryMissesEarlierPublish() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        scope.submit(() -> {
            started.countDown();
            release.await();
            return null;
        });
        assertTrue(started.await(1, TimeUnit.SECONDS));

        CompletableFuture<Void> dropped = channel.publish("published with no listeners");
        List<String> late = new CopyOnWriteArrayList<>();
        channel.subscribe(late::add);
        release.countDown();

        assertTrue(dropped.isDone(), "Publish without listeners must not be queued");
        channel.publish("after").get(1, TimeUnit.SECONDS);
        assertEquals(List.of("after"), late);
    }

    @Test
    void nameIsKept() {
        assertEquals("test", channel.getName());
    }

    @Test
    void unsubscribedListenerReceivesNothing() throws Exception {
        List<String> received = new CopyOnWriteArrayList<>();
        Subscription subscription = channel.subscribe(received::add);
        assertEquals(1, channel.getSubscriberCount());

        subscription.close();
        channel.publish("x").get(1, TimeUnit.SECONDS);

        assertTrue(received.isEmpty());
        assertEquals(0, channel.getSubscriberCount());
    }

    @Test
    void sameListenerIsAttachedOnce() throws Exception {
        List<String> received = new CopyOnWriteArrayList<>();
        EventListener<String> listener = received::add;
        channel.subscribe(listener);
        channel.subscribe(listener);

        channel.publish("once").get(1, TimeUnit.SECONDS);

        assertEquals(List.of("once"), received);
    }

    @Test
    void failingListenerDoesNotStopDelivery() throws Exception {
        List<String> received = new CopyOnWriteArrayList<>();
        channel.subscribe(event -> {
            throw new IllegalStateException("boom");
        });
        channel.subscribe(received::add);

        channel.publish("still delivered").get(1, TimeUnit.SECONDS);

        assertEquals(List.of("still delivered"), received);
    }

    @Test
    void publishAfterShutdownIsDropped() throws Exception {
        List<String> received = new CopyOnWriteArrayList<>();
        channel.subscribe(received::add);
        scope.shutdownNow();

        assertTrue(channel.publish("too late").isDone());
        assertTrue(scope.awaitTermination(1, TimeUnit.SECONDS));
        assertTrue(received.isEmpty());
    }

    @Test
    void shutdownCancelsPendingDelivery() throws Exception {
        List<String> received = new CopyOnWriteArrayList<>();
        channel.subscribe(received::add);

        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch never = new CountDownLatch(1);
        scope.submit(() -> {
            started.countDown();
            never.await();
            return null;
        });
        assertTrue(started.await(1, TimeUnit.SECONDS));

        channel.publish("pending");
        List<Runnable> cancelled = scope.shutdownNow();

        assertEquals(1, cancelled.size());
        assertTrue(scope.awaitTermination(1, TimeUnit.SECONDS));
        assertTrue(received.isEmpty());
    }
}
