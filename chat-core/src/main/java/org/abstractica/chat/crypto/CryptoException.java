package org.abstractica.chat.crypto;

import java.io.IOException;

/**
 * Failure of the secure channel: a malformed peer key, a failed key agreement,
 * or a frame whose authentication tag does not verify.
 *
 * <p>Fatal for the connection. A failed authentication never yields any
 * decrypted bytes.</p>
 */
public class CryptoException extends IOException
{
    public CryptoException(String message)
    {
        super(message);
    }

    public CryptoException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
