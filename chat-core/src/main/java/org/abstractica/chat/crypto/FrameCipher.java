package org.abstractica.chat.crypto;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Objects;

/**
 * AES-256-GCM authenticated encryption of whole frames.
 *
 * <p>Every sealed frame gets a fresh random 96-bit nonce, so a nonce is never
 * reused under the same key. Instances are immutable apart from the shared
 * {@link SecureRandom} and may be used from several threads at once, which is
 * what lets the read and write halves of a session share one cipher.</p>
 */
public final class FrameCipher
{
    private static final String ALGORITHM = "AES/GCM/NoPadding";

    public static final int NONCE_LENGTH = 12;
    public static final int TAG_LENGTH = 16;

    private static final SecureRandom RANDOM = new SecureRandom();

    private final SecretKeySpec key;

    /**
     * Creates a cipher for a derived session key.
     *
     * @param sessionKey the 32-byte key
     */
    public FrameCipher(byte[] sessionKey)
    {
        Objects.requireNonNull(sessionKey, "sessionKey");
        if (sessionKey.length != Hkdf.SESSION_KEY_LENGTH)
        {
            throw new IllegalArgumentException("Session key must be " + Hkdf.SESSION_KEY_LENGTH + " bytes");
        }
        this.key = new SecretKeySpec(sessionKey, "AES");
    }

    /**
     * Encrypts and authenticates a frame under a freshly generated nonce.
     *
     * @param plaintext the encoded frame
     * @return the nonce and the ciphertext (tag included)
     */
    public Sealed seal(byte[] plaintext)
    {
        byte[] nonce = new byte[NONCE_LENGTH];
        RANDOM.nextBytes(nonce);

        try
        {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, nonce));
            return new Sealed(nonce, cipher.doFinal(plaintext));
        }
        catch (GeneralSecurityException e)
        {
            throw new IllegalStateException("Encryption failed", e);
        }
    }

    /**
     * Verifies and decrypts a sealed frame.
     *
     * @param nonce      the 12-byte nonce sent with the frame
     * @param ciphertext the ciphertext with its trailing tag
     * @return the plaintext frame
     * @throws CryptoException if the tag does not verify; no plaintext is released
     */
    public byte[] open(byte[] nonce, byte[] ciphertext) throws CryptoException
    {
        if (nonce.length != NONCE_LENGTH)
        {
            throw new CryptoException("Nonce must be " + NONCE_LENGTH + " bytes: " + nonce.length);
        }
        if (ciphertext.length < TAG_LENGTH)
        {
            throw new CryptoException("Ciphertext shorter than its authentication tag");
        }

        try
        {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, nonce));
            return cipher.doFinal(ciphertext);
        }
        catch (AEADBadTagException e)
        {
            throw new CryptoException("Frame authentication failed", e);
        }
        catch (GeneralSecurityException e)
        {
            throw new CryptoException("Decryption failed", e);
        }
    }

    /**
     * A sealed frame as it goes into the envelope.
     *
     * @param nonce      the 12-byte nonce
     * @param ciphertext the ciphertext followed by the 16-byte tag
     */
    public record Sealed(byte[] nonce, byte[] ciphertext) {}
}
