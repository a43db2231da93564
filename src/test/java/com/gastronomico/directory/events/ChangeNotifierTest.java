package com.gastronomico.directory.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ChangeNotifierTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2025-03-04T05:06:07Z"), ZoneOffset.UTC);

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private ChangeNotifier notifier;

    @BeforeEach
    void setUp() {
        notifier = new ChangeNotifier(mapper, FIXED);
    }

    @Test
    void publishSendsTypeDataAndTimestampToEverySubscriber() throws Exception {
        RecordingSink first = new RecordingSink();
        RecordingSink second = new RecordingSink();
        notifier.subscribe(first);
        notifier.subscribe(second);

        notifier.publish("ciudad_agregada", Map.of("id", 1, "name", "Lima"));

        assertEquals(1, first.messages.size());
        assertEquals(first.messages, second.messages);

        JsonNode frame = mapper.readTree(first.messages.get(0));
        assertEquals("ciudad_agregada", frame.get("type").asText());
        assertEquals("Lima", frame.get("data").get("name").asText());
        assertEquals(1, frame.get("data").get("id").asInt());
        assertEquals("2025-03-04T05:06:07Z", frame.get("timestamp").asText());
    }

    @Test
    void failingSubscriberIsDroppedAndOthersStillReceive() {
        FailingSink broken = new FailingSink();
        RecordingSink healthy = new RecordingSink();
        notifier.subscribe(broken);
        notifier.subscribe(healthy);

        assertDoesNotThrow(() -> notifier.publish("restaurante_agregado", Map.of("id", 3)));
        notifier.publish("restaurante_actualizado", Map.of("id", 3));

        assertEquals(1, broken.attempts);
        assertEquals(2, healthy.messages.size());
        assertEquals(1, notifier.subscriberCount());
    }

    @Test
    void unsubscribedSinkReceivesNothing() {
        RecordingSink sink = new RecordingSink();
        Subscription subscription = notifier.subscribe(sink);

        notifier.unsubscribe(subscription);
        notifier.unsubscribe(subscription);
        notifier.publish("ciudad_eliminada", Map.of("id", 1, "message", "City deleted"));

        assertTrue(sink.messages.isEmpty());
        assertEquals(0, notifier.subscriberCount());
    }

    @Test
    void subscriberAddedDuringBroadcastMissesThatEvent() {
        RecordingSink late = new RecordingSink();
        notifier.subscribe(new EventSink() {
            private boolean subscribed;

            @Override
            public void send(String message) {
                if (!subscribed) {
                    subscribed = true;
                    notifier.subscribe(late);
                }
            }

            @Override
            public void close() {
            }
        });

        notifier.publish("patrocinador_agregado", Map.of("id", 1));
        assertTrue(late.messages.isEmpty());

        notifier.publish("patrocinador_actualizado", Map.of("id", 1));
        assertEquals(1, late.messages.size());
    }

    @Test
    void unserializablePayloadIsSkippedQuietly() {
        RecordingSink sink = new RecordingSink();
        notifier.subscribe(sink);

        assertDoesNotThrow(() -> notifier.publish("ciudad_agregada", new Object()));

        assertTrue(sink.messages.isEmpty());
        assertEquals(1, notifier.subscriberCount());
    }

    @Test
    void shutdownClosesEverySinkAndEmptiesRegistry() {
        RecordingSink first = new RecordingSink();
        RecordingSink second = new RecordingSink();
        notifier.subscribe(first);
        notifier.subscribe(second);

        notifier.shutdown();

        assertTrue(first.closed);
        assertTrue(second.closed);
        assertEquals(0, notifier.subscriberCount());
    }

    private static final class RecordingSink implements EventSink {
        private final List<String> messages = new ArrayList<>();
        private boolean closed;

        @Override
        public void send(String message) {
            messages.add(message);
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    private static final class FailingSink implements EventSink {
        private int attempts;

        @Override
        public void send(String message) throws IOException {
            attempts++;
            throw new IOException("Broken pipe");
        }

        @Override
        public void close() {
        }
    }
}
