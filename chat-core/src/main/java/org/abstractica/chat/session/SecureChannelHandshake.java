package org.abstractica.chat.session;

import org.abstractica.chat.crypto.EcdhKeyExchange;
import org.abstractica.chat.crypto.FrameCipher;
import org.abstractica.chat.protocol.FrameCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Upgrades a plaintext connection to authenticated encryption.
 *
 * <p>Symmetric on both ends: each side sends a fresh ephemeral compressed P-256
 * public key over the raw transport, reads the peer's key, runs ECDH and
 * derives the AES-256-GCM session key with HKDF-SHA256 (empty salt and info).
 * Either side may write first since the keys are exchanged concurrently.</p>
 */
final class SecureChannelHandshake
{
    private static final Logger LOG = LoggerFactory.getLogger(SecureChannelHandshake.class);

    private SecureChannelHandshake() {}

    /**
     * Runs the handshake.
     *
     * @return the cipher for all further frames
     * @throws IOException if the transport fails, the peer closes mid-handshake
     *                     or sends a malformed key ({@code CryptoException})
     */
    static FrameCipher perform(InputStream in, OutputStream out) throws IOException
    {
        EcdhKeyExchange keyExchange = new EcdhKeyExchange();

        out.write(keyExchange.getPublicKey());
        out.flush();

        byte[] peerPublicKey = new byte[EcdhKeyExchange.PUBLIC_KEY_LENGTH];
        FrameCodec.readFully(in, peerPublicKey, 0, peerPublicKey.length);

        FrameCipher cipher = new FrameCipher(keyExchange.deriveSessionKey(peerPublicKey));
        LOG.debug("Secure channel established");
        return cipher;
    }
}
