package org.abstractica.chat.server;

import org.abstractica.chat.protocol.Message;

import java.util.Objects;
import java.util.Optional;

/**
 * A message waiting in the router queue.
 *
 * @param message   the message to deliver
 * @param recipient the target nickname, or empty to broadcast to every user
 */
public record RoutedMessage(Message message, Optional<String> recipient)
{
    public RoutedMessage
    {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(recipient, "recipient");
    }

    public static RoutedMessage broadcast(Message message)
    {
        return new RoutedMessage(message, Optional.empty());
    }

    public boolean isBroadcast()
    {
        return recipient.isEmpty();
    }
}
