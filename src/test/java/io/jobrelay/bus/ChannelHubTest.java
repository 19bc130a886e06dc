package io.jobrelay.bus;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jobrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

final class ChannelHubTest {

    @Test
    void lateSubscribersMissEarlierMessages() throws Exception {
        ChannelHub hub = new ChannelHub();
        Assertions.assertEquals(0, hub.publish("c", "before"));
        try (Subscription sub = hub.subscribe("c", 8)) {
            Assertions.assertEquals(1, hub.publish("c", "after"));
            Assertions.assertEquals("after", sub.poll(1, TimeUnit.SECONDS));
            Assertions.assertNull(sub.poll(10, TimeUnit.MILLISECONDS));
        }
        Assertions.assertEquals(0, hub.subscriberCount("c"));
    }

    @Test
    void fullBufferDropsForThatListenerOnly() throws Exception {
        ChannelHub hub = new ChannelHub();
        try (Subscription slow = hub.subscribe("c", 2); Subscription fast = hub.subscribe("c", 16)) {
            for (int i = 0; i < 5; i++) {
                hub.publish("c", "m" + i);
            }
            Assertions.assertEquals(3L, slow.droppedCount());
            Assertions.assertEquals(0L, fast.droppedCount());
            Assertions.assertEquals("m0", slow.poll(1, TimeUnit.SECONDS));
            Assertions.assertEquals("m1", slow.poll(1, TimeUnit.SECONDS));
            Assertions.assertNull(slow.poll(10, TimeUnit.MILLISECONDS));
        }
    }

    @Test
    void subscribeRacingLastCloseStillReceives() throws Exception {
        ChannelHub hub = new ChannelHub();
        for (int i = 0; i < 2_000; i++) {
            Subscription leaving = hub.subscribe("c", 4);
            CountDownLatch go = new CountDownLatch(1);
            Thread closer = new Thread(() -> {
                awaitQuietly(go);
                leaving.close();
            });
            closer.start();
            go.countDown();
            try (Subscription joining = hub.subscribe("c", 4)) {
                closer.join();
                Assertions.assertEquals(1, hub.publish("c", "m" + i));
                Assertions.assertEquals("m" + i, joining.poll(1, TimeUnit.SECONDS));
            }
        }
        Assertions.assertEquals(0, hub.subscriberCount("c"));
    }

    @Test
    void notificationBusPublishesCompletionEvents() throws Exception {
        ChannelHub hub = new ChannelHub();
        NotificationBus bus = new NotificationBus(hub, 4);
        Assertions.assertEquals(0, bus.publishCompletion("job_x", true, "missed"));
        try (Subscription sub = bus.subscribe()) {
            Assertions.assertEquals(NotificationBus.CHANNEL, sub.channel());
            Assertions.assertEquals(1, bus.publishCompletion("job_y", false, "Job job_y failed"));
            ObjectNode event = Jsons.readObject(sub.poll(1, TimeUnit.SECONDS));
            Assertions.assertEquals("job_completion", event.path("type").asText());
            Assertions.assertEquals("job_y", event.path("job_id").asText());
            Assertions.assertEquals("failed", event.path("status").asText());
            Assertions.assertFalse(event.path("succeeded").asBoolean(true));
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
