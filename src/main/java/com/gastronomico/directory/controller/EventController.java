package com.gastronomico.directory.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gastronomico.directory.config.DirectoryProperties;
import com.gastronomico.directory.events.ChangeNotifier;
import com.gastronomico.directory.events.EventTypes;
import com.gastronomico.directory.events.SseEventSink;
import com.gastronomico.directory.events.Subscription;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Long-lived Server-Sent-Events stream. The first frame acknowledges the
 * connection; afterwards the client receives every change published while
 * it stays connected.
 */
@RestController
@Slf4j
public class EventController {

    private final ChangeNotifier notifier;
    private final ObjectMapper objectMapper;
    private final DirectoryProperties properties;

    public EventController(ChangeNotifier notifier, ObjectMapper objectMapper, DirectoryProperties properties) {
        this.notifier = notifier;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @GetMapping(path = "/api/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events() {
        SseEmitter emitter = new SseEmitter(properties.getEvents().getTimeout().toMillis());
        SseEventSink sink = new SseEventSink(emitter);

        try {
            sink.send(connectedMessage());
        } catch (IOException e) {
            log.warn("Could not greet SSE client: {}", e.getMessage());
            emitter.completeWithError(e);
            return emitter;
        }

        Subscription subscription = notifier.subscribe(sink);
        emitter.onCompletion(() -> notifier.unsubscribe(subscription));
        emitter.onTimeout(() -> notifier.unsubscribe(subscription));
        emitter.onError(e -> notifier.unsubscribe(subscription));
        return emitter;
    }

    private String connectedMessage() throws IOException {
        Map<String, String> frame = new LinkedHashMap<>();
        frame.put("type", EventTypes.CONNECTED);
        frame.put("message", "Connected to server");
        return objectMapper.writeValueAsString(frame);
    }
}
