package com.gastronomico.directory.events;

/** Handle returned by {@link ChangeNotifier#subscribe(EventSink)}. */
public record Subscription(long id, EventSink sink) {
}
