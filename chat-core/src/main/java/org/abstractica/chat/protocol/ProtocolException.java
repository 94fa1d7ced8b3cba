package org.abstractica.chat.protocol;

import java.io.IOException;
import java.util.Objects;

/**
 * A frame or message that violates the BCMP wire format.
 *
 * <p>Protocol errors are fatal for the connection they occur on. They are
 * never retried.</p>
 */
public class ProtocolException extends IOException
{
    private final Reason reason;

    public ProtocolException(Reason reason, String message)
    {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    /**
     * Returns what was wrong with the frame.
     *
     * @return the violation
     */
    public Reason getReason()
    {
        return reason;
    }

    /**
     * Kinds of wire format violation.
     */
    public enum Reason
    {
        /**
         * The frame carries a message code that no variant maps to.
         */
        INVALID_CODE,

        /**
         * The payload does not have the shape the message code requires.
         */
        INVALID_PAYLOAD,

        /**
         * The frame (or its encrypted envelope) exceeds the maximum frame size.
         */
        OVERSIZED_MESSAGE,

        /**
         * The frame (or its encrypted envelope) is shorter than its fixed parts.
         */
        UNDERSIZED_MESSAGE
    }
}
