package org.abstractica.chat.client.handlers;

import org.abstractica.chat.protocol.Message;

/**
 * Handles messages relayed by the server.
 *
 * <p>Called from the client's reader thread, one message at a time and in
 * arrival order. A handler that throws is logged and the next message is
 * still delivered.</p>
 */
@FunctionalInterface
public interface MessageHandler
{
    /**
     * Handles an incoming message.
     *
     * @param message the message, usually one of the nicked variants
     */
    void handle(Message message);
}
