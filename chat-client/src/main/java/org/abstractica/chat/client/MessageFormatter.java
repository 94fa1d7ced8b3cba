package org.abstractica.chat.client;

import org.abstractica.chat.protocol.Message;

import java.util.Optional;

/**
 * Renders relayed messages as single lines of text.
 */
public final class MessageFormatter
{
    private MessageFormatter() {}

    /**
     * Formats a message received from the server.
     *
     * @param message the message
     * @return the line to show, or empty for messages a server never relays
     */
    public static Optional<String> format(Message message)
    {
        if (message instanceof Message.NickedUserMsg m)
        {
            return Optional.of(m.nick() + "> " + m.text());
        }
        if (message instanceof Message.NickedNickChange m)
        {
            return Optional.of("! " + m.nick() + " has changed their nickname to " + m.newNick());
        }
        if (message instanceof Message.NickedConnect m)
        {
            return Optional.of("! " + m.nick() + " has joined the chat.");
        }
        if (message instanceof Message.NickedDisconnect m)
        {
            return Optional.of("! " + m.nick() + " has left the chat.");
        }
        if (message instanceof Message.NickedCommand m)
        {
            return Optional.of("! " + m.nick() + " executed command: " + m.command());
        }
        return Optional.empty();
    }
}
