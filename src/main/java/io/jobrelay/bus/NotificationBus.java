package io.jobrelay.bus;

import io.jobrelay.util.Jsons;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Coarse job-completion alerts on a single channel. Late listeners miss earlier events.
 */
public final class NotificationBus {
    public static final String CHANNEL = "app_notifications";
    private static final Logger LOG = LogManager.getLogger(NotificationBus.class);

    private final ChannelHub hub;
    private final int bufferSize;

    public NotificationBus(ChannelHub hub, int bufferSize) {
        this.hub = hub;
        this.bufferSize = bufferSize;
    }

    public int publishCompletion(String jobId, boolean succeeded, String summary) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("type", "job_completion");
        event.put("job_id", jobId);
        event.put("status", succeeded ? "finished" : "failed");
        event.put("succeeded", succeeded);
        event.put("summary", summary == null ? "" : summary);
        event.put("timestamp", Instant.now().toString());
        int receivers = hub.publish(CHANNEL, Jsons.toCompactJson(event));
        LOG.info("Completion notice for job {} ({}) sent to {} listener(s)", jobId, succeeded ? "finished" : "failed", receivers);
        return receivers;
    }

    public Subscription subscribe() {
        return hub.subscribe(CHANNEL, bufferSize);
    }
}
