package org.abstractica.chat.session;

import org.abstractica.chat.crypto.FrameCipher;
import org.abstractica.chat.protocol.FrameCodec;
import org.abstractica.chat.protocol.Message;
import org.abstractica.chat.protocol.ProtocolException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Reads and writes messages, plaintext or inside the encrypted envelope.
 *
 * <p>Encrypted envelope wire format:</p>
 * <pre>
 * [ciphertextLength: 2 bytes, little-endian]
 * [nonce: 12 bytes]
 * [ciphertext: ciphertextLength bytes, AEAD-sealed frame with tag]
 * </pre>
 *
 * <p>A null cipher means the session has not been encrypted.</p>
 */
final class FrameIo
{
    private static final int LENGTH_FIELD = 2;

    private FrameIo() {}

    static void write(OutputStream out, FrameCipher cipher, Message message) throws IOException
    {
        byte[] frame = FrameCodec.encode(message);

        if (cipher == null)
        {
            out.write(frame);
            out.flush();
            return;
        }

        FrameCipher.Sealed sealed = cipher.seal(frame);
        int ciphertextLength = sealed.ciphertext().length;
        if (ciphertextLength > FrameCodec.MAX_FRAME_LENGTH)
        {
            throw new ProtocolException(ProtocolException.Reason.OVERSIZED_MESSAGE,
                    "Encrypted frame of " + ciphertextLength + " bytes exceeds maximum of " + FrameCodec.MAX_FRAME_LENGTH);
        }

        ByteBuffer envelope = ByteBuffer.allocate(LENGTH_FIELD + FrameCipher.NONCE_LENGTH + ciphertextLength)
                .order(ByteOrder.LITTLE_ENDIAN);
        envelope.putShort((short) ciphertextLength);
        envelope.put(sealed.nonce());
        envelope.put(sealed.ciphertext());
        out.write(envelope.array());
        out.flush();
    }

    static Message read(InputStream in, FrameCipher cipher, byte[] buffer) throws IOException
    {
        if (cipher == null)
        {
            return FrameCodec.read(in, buffer);
        }

        FrameCodec.readFully(in, buffer, 0, LENGTH_FIELD);
        int ciphertextLength = FrameCodec.readUnsignedShort(buffer, 0);
        if (ciphertextLength > FrameCodec.MAX_FRAME_LENGTH)
        {
            throw new ProtocolException(ProtocolException.Reason.OVERSIZED_MESSAGE,
                    "Declared ciphertext length " + ciphertextLength + " exceeds maximum of " + FrameCodec.MAX_FRAME_LENGTH);
        }
        if (ciphertextLength < FrameCodec.HEADER_LENGTH + FrameCipher.TAG_LENGTH)
        {
            throw new ProtocolException(ProtocolException.Reason.UNDERSIZED_MESSAGE,
                    "Declared ciphertext length " + ciphertextLength + " cannot hold a frame");
        }

        byte[] nonce = new byte[FrameCipher.NONCE_LENGTH];
        FrameCodec.readFully(in, nonce, 0, nonce.length);
        byte[] ciphertext = new byte[ciphertextLength];
        FrameCodec.readFully(in, ciphertext, 0, ciphertextLength);

        return FrameCodec.decode(cipher.open(nonce, ciphertext));
    }
}
