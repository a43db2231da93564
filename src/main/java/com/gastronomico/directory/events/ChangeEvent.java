package com.gastronomico.directory.events;

/**
 * Wire shape of one broadcast frame.
 *
 * @param type      event name, e.g. {@code restaurante_agregado}
 * @param data      the resource view, or {@code {id, message}} for deletions
 * @param timestamp ISO-8601 instant of the publish call
 */
public record ChangeEvent(String type, Object data, String timestamp) {
}
