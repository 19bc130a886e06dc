package io.jobrelay.bus;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Named publish/subscribe channels with no retained history: a message reaches only the
 * listeners attached at publish time. Publishing never blocks on a listener.
 */
public final class ChannelHub {
    private static final Logger LOG = LogManager.getLogger(ChannelHub.class);

    private final ConcurrentMap<String, List<Subscription>> channels = new ConcurrentHashMap<>();

    public Subscription subscribe(String channel, int capacity) {
        Subscription sub = new Subscription(this, channel, capacity);
        channels.compute(channel, (k, subs) -> {
            List<Subscription> target = subs == null ? new CopyOnWriteArrayList<>() : subs;
            target.add(sub);
            return target;
        });
        return sub;
    }

    /**
     * @return number of listeners that accepted the message
     */
    public int publish(String channel, String message) {
        List<Subscription> subs = channels.get(channel);
        if (subs == null || subs.isEmpty()) {
            return 0;
        }
        int delivered = 0;
        for (Subscription sub : subs) {
            if (sub.offer(message)) {
                delivered++;
            } else if (!sub.isClosed()) {
                LOG.debug("Listener buffer full on channel {}, message dropped for that listener", channel);
            }
        }
        return delivered;
    }

    public int subscriberCount(String channel) {
        List<Subscription> subs = channels.get(channel);
        return subs == null ? 0 : subs.size();
    }

    void unsubscribe(Subscription sub) {
        channels.computeIfPresent(sub.channel(), (k, subs) -> {
            subs.remove(sub);
            return subs.isEmpty() ? null : subs;
        });
    }
}
