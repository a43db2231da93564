package com.gastronomico.directory.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fan-out of change events to every connected subscriber.
 *
 * Delivery is fire-and-forget: at most once per subscriber, no buffering,
 * no replay. A subscriber whose transport fails is dropped; the failure
 * never reaches the publisher or the other subscribers.
 *
 * The subscription set is copy-on-write, so {@link #publish} iterates the
 * set as it was when the broadcast started.
 */
@Component
@Slf4j
public class ChangeNotifier {

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Set<Subscription> subscriptions = new CopyOnWriteArraySet<>();
    private final AtomicLong nextId = new AtomicLong();

    @Autowired
    public ChangeNotifier(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemUTC());
    }

    public ChangeNotifier(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Subscription subscribe(EventSink sink) {
        Subscription subscription = new Subscription(nextId.incrementAndGet(), sink);
        subscriptions.add(subscription);
        log.info("Client {} connected. Active clients: {}", subscription.id(), subscriptions.size());
        return subscription;
    }

    /** Idempotent; transport callbacks may report the same disconnect twice. */
    public void unsubscribe(Subscription subscription) {
        if (subscriptions.remove(subscription)) {
            log.info("Client {} disconnected. Active clients: {}", subscription.id(), subscriptions.size());
        }
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    public void publish(String eventType, Object payload) {
        String message;
        try {
            message = objectMapper.writeValueAsString(
                    new ChangeEvent(eventType, payload, Instant.now(clock).toString()));
        } catch (JsonProcessingException e) {
            log.error("Could not serialize '{}' event, not sent", eventType, e);
            return;
        }

        int delivered = 0;
        for (Subscription subscription : subscriptions) {
            try {
                subscription.sink().send(message);
                delivered++;
            } catch (Exception e) {
                log.debug("Dropping client {}: {}", subscription.id(), e.getMessage());
                unsubscribe(subscription);
            }
        }
        log.debug("Update '{}' sent to {} clients", eventType, delivered);
    }

    @PreDestroy
    public void shutdown() {
        for (Subscription subscription : subscriptions) {
            subscription.sink().close();
        }
        subscriptions.clear();
        log.info("Change notifier stopped");
    }
}
