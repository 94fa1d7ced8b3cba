package org.abstractica.chat.session;

import org.abstractica.chat.crypto.CryptoException;
import org.abstractica.chat.crypto.FrameCipher;
import org.abstractica.chat.protocol.FrameCodec;
import org.abstractica.chat.protocol.Message;
import org.abstractica.chat.protocol.ProtocolException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.security.SecureRandom;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class FrameIoTest
{
    private static final SecureRandom RANDOM = new SecureRandom();

    private final byte[] scratch = new byte[FrameCodec.MAX_FRAME_LENGTH];

    @Test
    void plaintext_writesBareFrame() throws IOException
    {
        Message message = new Message.NickedUserMsg("bob", "hello");
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        FrameIo.write(out, null, message);

        assertArrayEquals(FrameCodec.encode(message), out.toByteArray());
        assertEquals(message, FrameIo.read(new ByteArrayInputStream(out.toByteArray()), null, scratch));
    }

    @Test
    void encrypted_envelopeLayout() throws IOException
    {
        FrameCipher cipher = new FrameCipher(randomKey());
        Message message = new Message.UserMsg("hi");
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        FrameIo.write(out, cipher, message);
        byte[] envelope = out.toByteArray();

        int frameLength = FrameCodec.encode(message).length;
        int ciphertextLength = frameLength + FrameCipher.TAG_LENGTH;
        assertEquals(2 + FrameCipher.NONCE_LENGTH + ciphertextLength, envelope.length);
        assertEquals(ciphertextLength, FrameCodec.readUnsignedShort(envelope, 0));
        assertEquals(message, FrameIo.read(new ByteArrayInputStream(envelope), cipher, scratch));
    }

    @Test
    void encrypted_anyFlippedBitFailsAuthentication() throws IOException
    {
        FrameCipher cipher = new FrameCipher(randomKey());
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        FrameIo.write(out, cipher, new Message.Command("roll"));
        byte[] envelope = out.toByteArray();

        // Skip the length field; a corrupted length is a framing error, not an authentication one
        for (int bit = 16; bit < envelope.length * 8; bit++)
        {
            byte[] tampered = envelope.clone();
            tampered[bit / 8] ^= (byte) (1 << (bit % 8));
            assertThrows(CryptoException.class,
                    () -> FrameIo.read(new ByteArrayInputStream(tampered), cipher, scratch),
                    "bit " + bit);
        }
    }

    @Test
    void encrypted_wrongKeyFails() throws IOException
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        FrameIo.write(out, new FrameCipher(randomKey()), new Message.UserMsg("hi"));

        FrameCipher other = new FrameCipher(randomKey());
        assertThrows(CryptoException.class,
                () -> FrameIo.read(new ByteArrayInputStream(out.toByteArray()), other, scratch));
    }

    @Test
    void encrypted_oversizedDeclaredLength_rejectedBeforeReadingBody()
    {
        FrameCipher cipher = new FrameCipher(randomKey());
        // 2049, little-endian, and nothing after it
        byte[] header = {0x01, 0x08};

        ProtocolException e = assertThrows(ProtocolException.class,
                () -> FrameIo.read(new ByteArrayInputStream(header), cipher, scratch));
        assertEquals(ProtocolException.Reason.OVERSIZED_MESSAGE, e.getReason());
    }

    @Test
    void encrypted_undersizedDeclaredLength_rejected()
    {
        FrameCipher cipher = new FrameCipher(randomKey());
        byte[] header = {(byte) (FrameCodec.HEADER_LENGTH + FrameCipher.TAG_LENGTH - 1), 0x00};

        ProtocolException e = assertThrows(ProtocolException.class,
                () -> FrameIo.read(new ByteArrayInputStream(header), cipher, scratch));
        assertEquals(ProtocolException.Reason.UNDERSIZED_MESSAGE, e.getReason());
    }

    @Test
    void encrypted_frameThatOnlyFitsInPlaintext_rejectedOnWrite()
    {
        FrameCipher cipher = new FrameCipher(randomKey());
        Message message = new Message.UserMsg("a".repeat(2037));
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        assertDoesNotThrow(() -> FrameIo.write(new ByteArrayOutputStream(), null, message));
        ProtocolException e = assertThrows(ProtocolException.class, () -> FrameIo.write(out, cipher, message));
        assertEquals(ProtocolException.Reason.OVERSIZED_MESSAGE, e.getReason());
        assertEquals(0, out.size());
    }

    @Test
    void encrypted_truncatedEnvelope_throwsEof() throws IOException
    {
        FrameCipher cipher = new FrameCipher(randomKey());
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        FrameIo.write(out, cipher, new Message.UserMsg("hello"));
        byte[] envelope = out.toByteArray();
        byte[] truncated = Arrays.copyOf(envelope, envelope.length - 1);

        assertThrows(EOFException.class,
                () -> FrameIo.read(new ByteArrayInputStream(truncated), cipher, scratch));
    }

    private static byte[] randomKey()
    {
        byte[] key = new byte[32];
        RANDOM.nextBytes(key);
        return key;
    }
}
