package org.abstractica.chat.server;

/**
 * Lifecycle of one client connection on the server.
 */
public enum ConnectionState
{
    /**
     * Accepted by the listener; nothing read yet.
     */
    CONNECTED,

    /**
     * Waiting for the nickname and running the admission check.
     */
    AUTHENTICATING,

    /**
     * Admitted; running the secure channel handshake.
     */
    ENCRYPTING,

    /**
     * Registered; relaying the user's messages.
     */
    ACTIVE,

    /**
     * Torn down, whether rejected, failed or disconnected.
     */
    CLOSED
}
