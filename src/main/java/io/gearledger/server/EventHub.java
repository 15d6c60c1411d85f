package io.gearledger.server;

import io.gearledger.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fan-out of sync events to the open event streams. Delivery is best effort:
 * there is no history, and a subscriber whose queue is full is evicted rather
 * than waited on.
 */
final class EventHub {
    private static final Logger log = LoggerFactory.getLogger(EventHub.class);

    private final int queueCapacity;
    private final List<EventSubscriber> subscribers = new ArrayList<>();

    EventHub(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    EventSubscriber subscribe() {
        EventSubscriber subscriber = new EventSubscriber(queueCapacity);
        synchronized (subscribers) {
            subscribers.add(subscriber);
        }
        return subscriber;
    }

    void unsubscribe(EventSubscriber subscriber) {
        synchronized (subscribers) {
            subscribers.remove(subscriber);
        }
        subscriber.close();
    }

    int subscriberCount() {
        synchronized (subscribers) {
            return subscribers.size();
        }
    }

    /** Returns the number of subscribers the event was queued for. */
    int publish(Map<String, Object> event) {
        String data = Jsons.toJson(event);
        List<EventSubscriber> snapshot;
        synchronized (subscribers) {
            snapshot = new ArrayList<>(subscribers);
        }
        int delivered = 0;
        for (EventSubscriber subscriber : snapshot) {
            if (subscriber.offer(data)) {
                delivered++;
            } else {
                log.warn("Evicting event subscriber with a full or closed queue");
                unsubscribe(subscriber);
            }
        }
        return delivered;
    }

    void closeAll() {
        List<EventSubscriber> snapshot;
        synchronized (subscribers) {
            snapshot = new ArrayList<>(subscribers);
            subscribers.clear();
        }
        for (EventSubscriber subscriber : snapshot) {
            subscriber.close();
        }
    }
}
