package com.relaychat.registry;

import java.io.IOException;

/**
 * A handle to one live duplex channel to a client.
 */
public interface ClientConnection {

    /**
     * Unique for the lifetime of the connection.
     */
    String id();

    /**
     * Sends one whole text frame. Implementations may be called from several
     * threads at once.
     *
     * @throws IOException if the transport is closed or the send fails or exceeds its limits
     */
    void send(String frame) throws IOException;

    /**
     * Closes the underlying transport. Never throws; closing an already closed
     * connection has no effect.
     */
    void close();
}
