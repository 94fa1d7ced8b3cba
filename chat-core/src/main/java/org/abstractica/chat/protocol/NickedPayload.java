package org.abstractica.chat.protocol;

import java.util.Objects;

/**
 * Payload of a relayed message that carries its author's nickname next to the
 * original payload.
 *
 * <p>Wire form: {@code nick NUL text}. The nickname must not contain NUL; the
 * text may, since only the first NUL separates the two.</p>
 *
 * @param nick the author's nickname
 * @param text the original, nickname-free payload
 */
public record NickedPayload(String nick, String text)
{
    public static final char SEPARATOR = '\0';

    public NickedPayload
    {
        requireValid(nick, text);
    }

    /**
     * Checks that nickname and text can be joined and split back unchanged.
     *
     * @param nick the nickname, must not contain NUL
     * @param text the text
     */
    public static void requireValid(String nick, String text)
    {
        Objects.requireNonNull(nick, "nick");
        Objects.requireNonNull(text, "text");
        if (nick.indexOf(SEPARATOR) >= 0)
        {
            throw new IllegalArgumentException("Nickname must not contain NUL");
        }
    }

    /**
     * Joins nickname and text into their wire form.
     *
     * @return {@code nick + NUL + text}
     */
    public String encode()
    {
        return nick + SEPARATOR + text;
    }

    /**
     * Splits a wire payload at its first NUL.
     *
     * @param payload the payload of a nicked frame
     * @return the nickname and text
     * @throws ProtocolException if the payload has no NUL
     */
    public static NickedPayload parse(String payload) throws ProtocolException
    {
        int split = payload.indexOf(SEPARATOR);
        if (split < 0)
        {
            throw new ProtocolException(ProtocolException.Reason.INVALID_PAYLOAD,
                    "Nicked payload has no NUL separator");
        }
        return new NickedPayload(payload.substring(0, split), payload.substring(split + 1));
    }
}
