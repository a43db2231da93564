package com.gastronomico.directory.events;

import java.io.IOException;

/** Transport end of one subscriber; the SSE connection in production. */
public interface EventSink {

    /** Writes one already serialized JSON frame. */
    void send(String message) throws IOException;

    /** Ends the transport; must be safe to call more than once. */
    void close();
}
