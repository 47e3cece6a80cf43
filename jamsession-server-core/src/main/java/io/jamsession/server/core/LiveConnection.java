package io.jamsession.server.core;

import java.io.IOException;

/**
 * A push connection watching one jam, implemented by transport adapters.
 */
public interface LiveConnection {

    /** Stable id for logging and de-duplication. */
    String id();

    boolean isOpen();

    /**
     * Send one text frame. Called from the hub's dispatcher, never concurrently for the same jam.
     *
     * @throws IOException if the transport failed; the hub then drops the connection
     */
    void send(String frame) throws IOException;
}
