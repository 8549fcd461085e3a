package com.threatsentinel.core.broadcast;

import java.io.IOException;

/**
 * A connected recipient of broadcast messages, e.g. a live dashboard.
 */
public interface Observer {

    /**
     * @return identifier unique among registered observers
     */
    String id();

    /**
     * Deliver one serialized message.
     *
     * @param message JSON text
     * @throws IOException if the channel is broken; the hub then drops the
     *                     observer
     */
    void send(String message) throws IOException;
}
