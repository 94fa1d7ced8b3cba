package org.abstractica.chat.protocol;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Encodes and decodes BCMP frames.
 *
 * <p>Wire format:</p>
 * <pre>
 * [code: 1 byte]
 * [length: 2 bytes, little-endian]
 * [payload: length bytes, UTF-8]
 * </pre>
 *
 * <p>The same layout is used whether the frame travels in plaintext or inside
 * an encrypted envelope.</p>
 */
public final class FrameCodec
{
    /**
     * Maximum size of a frame, header included.
     */
    public static final int MAX_FRAME_LENGTH = 2048;

    public static final int HEADER_LENGTH = 3;

    private FrameCodec() {}

    // ========== Encoding ==========

    /**
     * Encodes a message into a frame.
     *
     * @param message the message to encode
     * @return the frame bytes
     * @throws ProtocolException if the frame would exceed {@link #MAX_FRAME_LENGTH}
     */
    public static byte[] encode(Message message) throws ProtocolException
    {
        byte[] payload = message.payload().getBytes(StandardCharsets.UTF_8);
        int frameLength = HEADER_LENGTH + payload.length;
        if (frameLength > MAX_FRAME_LENGTH)
        {
            throw new ProtocolException(ProtocolException.Reason.OVERSIZED_MESSAGE,
                    "Frame of " + frameLength + " bytes exceeds maximum of " + MAX_FRAME_LENGTH);
        }

        ByteBuffer buffer = ByteBuffer.allocate(frameLength).order(ByteOrder.LITTLE_ENDIAN);
        buffer.put(message.code());
        buffer.putShort((short) payload.length);
        buffer.put(payload);
        return buffer.array();
    }

    // ========== Decoding ==========

    /**
     * Reads exactly one frame from a stream.
     *
     * <p>The header is read and validated before any payload byte is consumed,
     * so an oversized declared length is rejected without reading the payload.</p>
     *
     * @param in     the stream to read from
     * @param buffer scratch space of at least {@link #MAX_FRAME_LENGTH} bytes
     * @return the decoded message
     * @throws EOFException      if the stream ends before the frame is complete
     * @throws ProtocolException if the frame is malformed
     * @throws IOException       if reading fails
     */
    public static Message read(InputStream in, byte[] buffer) throws IOException
    {
        requireScratch(buffer);

        readFully(in, buffer, 0, HEADER_LENGTH);
        int code = buffer[0] & 0xFF;
        int length = payloadLength(buffer, 0);
        if (HEADER_LENGTH + length > MAX_FRAME_LENGTH)
        {
            throw new ProtocolException(ProtocolException.Reason.OVERSIZED_MESSAGE,
                    "Declared frame length " + (HEADER_LENGTH + length) + " exceeds maximum of " + MAX_FRAME_LENGTH);
        }

        readFully(in, buffer, HEADER_LENGTH, length);
        String payload = new String(buffer, HEADER_LENGTH, length, StandardCharsets.UTF_8);
        return Message.decode(code, payload);
    }

    /**
     * Decodes a complete frame held in memory, e.g. a decrypted envelope.
     *
     * @param frame the frame bytes
     * @return the decoded message
     * @throws ProtocolException if the frame is malformed or its length does not match the header
     */
    public static Message decode(byte[] frame) throws ProtocolException
    {
        if (frame.length < HEADER_LENGTH)
        {
            throw new ProtocolException(ProtocolException.Reason.UNDERSIZED_MESSAGE,
                    "Frame of " + frame.length + " bytes is shorter than its header");
        }
        if (frame.length > MAX_FRAME_LENGTH)
        {
            throw new ProtocolException(ProtocolException.Reason.OVERSIZED_MESSAGE,
                    "Frame of " + frame.length + " bytes exceeds maximum of " + MAX_FRAME_LENGTH);
        }

        int code = frame[0] & 0xFF;
        int length = payloadLength(frame, 0);
        if (HEADER_LENGTH + length != frame.length)
        {
            throw new ProtocolException(ProtocolException.Reason.INVALID_PAYLOAD,
                    "Frame header declares " + length + " payload bytes, frame carries " + (frame.length - HEADER_LENGTH));
        }

        String payload = new String(frame, HEADER_LENGTH, length, StandardCharsets.UTF_8);
        return Message.decode(code, payload);
    }

    // ========== Helpers ==========

    /**
     * Reads an unsigned little-endian 16-bit value.
     *
     * @param bytes  the source
     * @param offset position of the low byte
     * @return the value, 0-65535
     */
    public static int readUnsignedShort(byte[] bytes, int offset)
    {
        return (bytes[offset] & 0xFF) | ((bytes[offset + 1] & 0xFF) << 8);
    }

    /**
     * Reads exactly {@code length} bytes or fails.
     *
     * @throws EOFException if the stream ends first
     */
    public static void readFully(InputStream in, byte[] buffer, int offset, int length) throws IOException
    {
        int read = in.readNBytes(buffer, offset, length);
        if (read < length)
        {
            throw new EOFException("Stream closed after " + read + " of " + length + " bytes");
        }
    }

    private static int payloadLength(byte[] header, int offset)
    {
        return readUnsignedShort(header, offset + 1);
    }

    private static void requireScratch(byte[] buffer)
    {
        if (buffer.length < MAX_FRAME_LENGTH)
        {
            throw new IllegalArgumentException(
                    "Scratch buffer must hold " + MAX_FRAME_LENGTH + " bytes: " + buffer.length);
        }
    }
}
