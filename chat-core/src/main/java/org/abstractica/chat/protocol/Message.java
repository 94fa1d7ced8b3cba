package org.abstractica.chat.protocol;

import java.util.Objects;
import java.util.Optional;

/**
 * A BCMP message.
 *
 * <p>Sealed interface enabling exhaustive handling of every variant. Each
 * variant maps to exactly one {@link MessageType} and back.</p>
 *
 * <p>Variants sent by clients ({@link UserMsg}, {@link NickChange},
 * {@link Command}) are rewrapped by the server into their nicked counterparts
 * via {@link #attributeTo(String)} before being relayed.</p>
 */
public sealed interface Message permits
        Message.UserMsg,
        Message.NickChange,
        Message.Command,
        Message.NickedConnect,
        Message.NickedDisconnect,
        Message.NickedUserMsg,
        Message.NickedNickChange,
        Message.NickedCommand,
        Message.ConnectionEncrypted,
        Message.ConnectionAccepted,
        Message.ConnectionRejected
{
    /**
     * Returns the type (and thereby the wire code) of this message.
     *
     * @return the message type
     */
    MessageType type();

    /**
     * Returns the canonical payload string written after the frame header.
     *
     * @return the payload, empty for variants without one
     */
    String payload();

    /**
     * Returns the wire code of this message.
     *
     * @return the code byte
     */
    default byte code()
    {
        return (byte) type().getCode();
    }

    /**
     * Returns the nicked variant the server relays for this message.
     *
     * @param nick the nickname of the connection the message arrived on
     * @return the relayed message, or empty if this variant is not relayed
     */
    default Optional<Message> attributeTo(String nick)
    {
        return Optional.empty();
    }

    /**
     * Constructs a message from its wire code and payload string.
     *
     * <p>Variants without a payload ignore the passed string.</p>
     *
     * @param code    the unsigned code byte
     * @param payload the decoded payload string
     * @return the message
     * @throws ProtocolException if the code is unknown or a nicked payload has no NUL
     */
    static Message decode(int code, String payload) throws ProtocolException
    {
        Objects.requireNonNull(payload, "payload");
        MessageType type = MessageType.fromCode(code);

        if (type.isNulJoined())
        {
            NickedPayload nicked = NickedPayload.parse(payload);
            return switch (type)
            {
                case NICKED_USER_MSG -> new NickedUserMsg(nicked.nick(), nicked.text());
                case NICKED_NICK_CHANGE -> new NickedNickChange(nicked.nick(), nicked.text());
                case NICKED_COMMAND -> new NickedCommand(nicked.nick(), nicked.text());
                default -> throw new IllegalStateException("Unhandled NUL-joined type: " + type);
            };
        }

        return switch (type)
        {
            case USER_MSG -> new UserMsg(payload);
            case NICK_CHANGE -> new NickChange(payload);
            case COMMAND -> new Command(payload);
            case NICKED_CONNECT -> new NickedConnect(payload);
            case NICKED_DISCONNECT -> new NickedDisconnect(payload);
            case CONNECTION_ENCRYPTED -> new ConnectionEncrypted();
            case CONNECTION_ACCEPTED -> new ConnectionAccepted();
            case CONNECTION_REJECTED -> new ConnectionRejected(payload);
            default -> throw new IllegalStateException("Unhandled message type: " + type);
        };
    }

    // ========== Client Messages ==========

    /**
     * A chat line typed by a user.
     *
     * @param text the message text
     */
    record UserMsg(String text) implements Message
    {
        public UserMsg
        {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public MessageType type()
        {
            return MessageType.USER_MSG;
        }

        @Override
        public String payload()
        {
            return text;
        }

        @Override
        public Optional<Message> attributeTo(String nick)
        {
            return Optional.of(new NickedUserMsg(nick, text));
        }
    }

    /**
     * A nickname request. The first frame of every connection must be one.
     *
     * @param nick the requested nickname
     */
    record NickChange(String nick) implements Message
    {
        public NickChange
        {
            Objects.requireNonNull(nick, "nick");
        }

        @Override
        public MessageType type()
        {
            return MessageType.NICK_CHANGE;
        }

        @Override
        public String payload()
        {
            return nick;
        }

        @Override
        public Optional<Message> attributeTo(String currentNick)
        {
            return Optional.of(new NickedNickChange(currentNick, nick));
        }
    }

    /**
     * A command line, relayed verbatim.
     *
     * @param command the command text
     */
    record Command(String command) implements Message
    {
        public Command
        {
            Objects.requireNonNull(command, "command");
        }

        @Override
        public MessageType type()
        {
            return MessageType.COMMAND;
        }

        @Override
        public String payload()
        {
            return command;
        }

        @Override
        public Optional<Message> attributeTo(String nick)
        {
            return Optional.of(new NickedCommand(nick, command));
        }
    }

    // ========== Relayed Messages ==========

    /**
     * A user joined the chat.
     *
     * @param nick the nickname that joined
     */
    record NickedConnect(String nick) implements Message
    {
        public NickedConnect
        {
            Objects.requireNonNull(nick, "nick");
        }

        @Override
        public MessageType type()
        {
            return MessageType.NICKED_CONNECT;
        }

        @Override
        public String payload()
        {
            return nick;
        }
    }

    /**
     * A user left the chat.
     *
     * @param nick the nickname that left
     */
    record NickedDisconnect(String nick) implements Message
    {
        public NickedDisconnect
        {
            Objects.requireNonNull(nick, "nick");
        }

        @Override
        public MessageType type()
        {
            return MessageType.NICKED_DISCONNECT;
        }

        @Override
        public String payload()
        {
            return nick;
        }
    }

    /**
     * A chat line together with its author.
     *
     * @param nick the author
     * @param text the message text
     */
    record NickedUserMsg(String nick, String text) implements Message
    {
        public NickedUserMsg
        {
            NickedPayload.requireValid(nick, text);
        }

        @Override
        public MessageType type()
        {
            return MessageType.NICKED_USER_MSG;
        }

        @Override
        public String payload()
        {
            return new NickedPayload(nick, text).encode();
        }
    }

    /**
     * A nickname request together with the nickname it was made under.
     *
     * @param nick    the nickname of the requesting connection
     * @param newNick the requested nickname
     */
    record NickedNickChange(String nick, String newNick) implements Message
    {
        public NickedNickChange
        {
            NickedPayload.requireValid(nick, newNick);
        }

        @Override
        public MessageType type()
        {
            return MessageType.NICKED_NICK_CHANGE;
        }

        @Override
        public String payload()
        {
            return new NickedPayload(nick, newNick).encode();
        }
    }

    /**
     * A command together with the user who issued it.
     *
     * @param nick    the issuer
     * @param command the command text
     */
    record NickedCommand(String nick, String command) implements Message
    {
        public NickedCommand
        {
            NickedPayload.requireValid(nick, command);
        }

        @Override
        public MessageType type()
        {
            return MessageType.NICKED_COMMAND;
        }

        @Override
        public String payload()
        {
            return new NickedPayload(nick, command).encode();
        }
    }

    // ========== Connection Negotiation ==========

    /**
     * Nickname accepted; both sides now run the secure channel handshake.
     */
    record ConnectionEncrypted() implements Message
    {
        @Override
        public MessageType type()
        {
            return MessageType.CONNECTION_ENCRYPTED;
        }

        @Override
        public String payload()
        {
            return "";
        }
    }

    /**
     * Nickname accepted; the session continues in plaintext.
     */
    record ConnectionAccepted() implements Message
    {
        @Override
        public MessageType type()
        {
            return MessageType.CONNECTION_ACCEPTED;
        }

        @Override
        public String payload()
        {
            return "";
        }
    }

    /**
     * Connection refused. The server closes the connection after sending this.
     *
     * @param reason human-readable reason, e.g. "nick taken"
     */
    record ConnectionRejected(String reason) implements Message
    {
        public ConnectionRejected
        {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public MessageType type()
        {
            return MessageType.CONNECTION_REJECTED;
        }

        @Override
        public String payload()
        {
            return reason;
        }
    }
}
