package com.p14n.eventbus.data;

/**
 * Interface for objects that can be identified and correlated in spans and
 * log output.
 *
 * <ul>
 * <li>{@code id}: Unique identifier of the occurrence</li>
 * <li>{@code eventName}: Dot-delimited classification of the occurrence</li>
 * <li>{@code key}: Storage key, unique and ordered by time</li>
 * </ul>
 */
public interface Traceable {

    /**
     * Returns the unique identifier of the traceable object.
     *
     * @return the unique identifier string
     */
    String id();

    /**
     * Returns the dot-delimited name used to classify and route the object.
     *
     * @return the event name
     */
    String eventName();

    /**
     * Returns the storage key of the object.
     *
     * @return the key string
     */
    String key();
}
