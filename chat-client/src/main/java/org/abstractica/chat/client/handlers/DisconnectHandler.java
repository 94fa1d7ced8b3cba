package org.abstractica.chat.client.handlers;

import java.io.IOException;

/**
 * Notified once when an established connection ends.
 */
@FunctionalInterface
public interface DisconnectHandler
{
    /**
     * Handles the end of the connection.
     *
     * @param cause the transport or protocol failure, or null if the client was closed locally
     */
    void disconnected(IOException cause);
}
