package org.abstractica.chat.crypto;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.util.Objects;

/**
 * HKDF (HMAC-based Key Derivation Function) as defined in RFC 5869.
 *
 * <p>Uses HMAC-SHA256 as the underlying hash function.</p>
 */
public final class Hkdf
{
    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final int HASH_LENGTH = 32;
    private static final byte[] EMPTY = new byte[0];

    /**
     * Length of the symmetric session key, 256 bits.
     */
    public static final int SESSION_KEY_LENGTH = 32;

    private Hkdf() {}

    /**
     * Derives the session key from an ECDH shared secret, with empty salt and info.
     *
     * @param sharedSecret the shared secret from key agreement
     * @return a 32-byte key
     */
    public static byte[] deriveSessionKey(byte[] sharedSecret)
    {
        return derive(sharedSecret, EMPTY, EMPTY, SESSION_KEY_LENGTH);
    }

    /**
     * Derives a key using HKDF-SHA256.
     *
     * @param inputKeyMaterial the input key material (shared secret)
     * @param salt             optional salt, null or empty means a zero-filled block
     * @param info             context/application-specific info
     * @param outputLength     desired output length in bytes
     * @return derived key material
     */
    public static byte[] derive(byte[] inputKeyMaterial, byte[] salt, byte[] info, int outputLength)
    {
        Objects.requireNonNull(inputKeyMaterial, "inputKeyMaterial");
        Objects.requireNonNull(info, "info");
        if (outputLength <= 0 || outputLength > 255 * HASH_LENGTH)
        {
            throw new IllegalArgumentException("Output length must be 1-" + (255 * HASH_LENGTH) + ": " + outputLength);
        }

        try
        {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);

            // Extract
            byte[] extractKey = (salt == null || salt.length == 0) ? new byte[HASH_LENGTH] : salt;
            mac.init(new SecretKeySpec(extractKey, HMAC_ALGORITHM));
            byte[] prk = mac.doFinal(inputKeyMaterial);

            // Expand
            mac.init(new SecretKeySpec(prk, HMAC_ALGORITHM));
            byte[] output = new byte[outputLength];
            byte[] block = EMPTY;
            int offset = 0;
            for (int counter = 1; offset < outputLength; counter++)
            {
                mac.update(block);
                mac.update(info);
                mac.update((byte) counter);
                block = mac.doFinal();

                int toCopy = Math.min(block.length, outputLength - offset);
                System.arraycopy(block, 0, output, offset, toCopy);
                offset += toCopy;
            }
            return output;
        }
        catch (GeneralSecurityException e)
        {
            throw new IllegalStateException(HMAC_ALGORITHM + " unavailable", e);
        }
    }
}
