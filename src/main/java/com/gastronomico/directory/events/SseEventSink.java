package com.gastronomico.directory.events;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/** Writes frames to a Spring MVC {@link SseEmitter} as {@code data:} lines. */
@Slf4j
public class SseEventSink implements EventSink {

    private final SseEmitter emitter;

    public SseEventSink(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void send(String message) throws IOException {
        try {
            emitter.send(SseEmitter.event().data(message));
        } catch (IllegalStateException e) {
            // emitter already completed by the container
            throw new IOException("SSE connection is closed", e);
        }
    }

    @Override
    public void close() {
        try {
            emitter.complete();
        } catch (IllegalStateException e) {
            log.debug("SSE emitter already completed");
        }
    }
}
