package com.gastronomico.directory.events;

/**
 * Names of the broadcast events, {@code <resource>_<action>}. The Spanish
 * names are what the existing web and mobile clients listen for.
 */
public final class EventTypes {

    public static final String CONNECTED = "connected";

    public static final String CITY_CREATED = "ciudad_agregada";
    public static final String CITY_UPDATED = "ciudad_actualizada";
    public static final String CITY_DELETED = "ciudad_eliminada";

    public static final String SPONSOR_CREATED = "patrocinador_agregado";
    public static final String SPONSOR_UPDATED = "patrocinador_actualizado";
    public static final String SPONSOR_DELETED = "patrocinador_eliminado";

    public static final String RESTAURANT_CREATED = "restaurante_agregado";
    public static final String RESTAURANT_UPDATED = "restaurante_actualizado";
    public static final String RESTAURANT_DELETED = "restaurante_eliminado";

    private EventTypes() {
    }
}
