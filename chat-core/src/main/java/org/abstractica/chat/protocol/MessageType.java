package org.abstractica.chat.protocol;

/**
 * Message codes as defined in the wire protocol.
 *
 * <p>Codes are wire-stable and must never be reassigned.</p>
 */
public enum MessageType
{
    // Client originated (0 - 97)
    USER_MSG(0, false),
    NICK_CHANGE(1, false),
    COMMAND(3, false),

    // Relayed by the server, tagged with the author's nickname (98 - 199)
    NICKED_CONNECT(98, false),
    NICKED_DISCONNECT(99, false),
    NICKED_USER_MSG(100, true),
    NICKED_NICK_CHANGE(101, true),
    NICKED_COMMAND(103, true),

    // Connection negotiation (250 - 255)
    CONNECTION_ENCRYPTED(253, false),
    CONNECTION_ACCEPTED(254, false),
    CONNECTION_REJECTED(255, false);

    private final int code;
    private final boolean nulJoined;

    MessageType(int code, boolean nulJoined)
    {
        this.code = code;
        this.nulJoined = nulJoined;
    }

    /**
     * Returns the wire protocol code for this message type.
     *
     * @return the code (1 byte, unsigned)
     */
    public int getCode()
    {
        return code;
    }

    /**
     * Returns whether the payload is a nickname and a second string joined by NUL.
     *
     * @return true for the nicked variants carrying two strings
     */
    public boolean isNulJoined()
    {
        return nulJoined;
    }

    /**
     * Looks up a message type by its wire protocol code.
     *
     * @param code the unsigned code byte
     * @return the message type
     * @throws ProtocolException if no message type has this code
     */
    public static MessageType fromCode(int code) throws ProtocolException
    {
        for (MessageType type : values())
        {
            if (type.code == code)
            {
                return type;
            }
        }
        throw new ProtocolException(ProtocolException.Reason.INVALID_CODE, "Unknown message code: " + code);
    }
}
