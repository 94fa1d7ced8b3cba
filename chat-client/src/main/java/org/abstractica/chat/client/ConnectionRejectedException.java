package org.abstractica.chat.client;

import java.io.IOException;

/**
 * The server refused the connection, e.g. because the nickname is taken.
 */
public class ConnectionRejectedException extends IOException
{
    private final String reason;

    public ConnectionRejectedException(String reason)
    {
        super("Server refused connection: " + reason);
        this.reason = reason;
    }

    /**
     * Returns the reason sent by the server.
     *
     * @return the rejection reason
     */
    public String getReason()
    {
        return reason;
    }
}
