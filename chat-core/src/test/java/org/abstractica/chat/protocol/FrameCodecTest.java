package org.abstractica.chat.protocol;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FrameCodec} framing and its length bounds.
 */
class FrameCodecTest
{
    private final byte[] buffer = new byte[FrameCodec.MAX_FRAME_LENGTH];

    // ========== Encoding ==========

    @Test
    void userMsg_wireFormat() throws ProtocolException
    {
        byte[] encoded = FrameCodec.encode(new Message.UserMsg("hi"));

        assertArrayEquals(new byte[]{0, 2, 0, 'h', 'i'}, encoded);
    }

    @Test
    void lengthField_isLittleEndian() throws ProtocolException
    {
        byte[] encoded = FrameCodec.encode(new Message.UserMsg("a".repeat(300)));

        assertEquals(303, encoded.length);
        assertEquals(300 & 0xFF, encoded[1] & 0xFF);
        assertEquals(300 >> 8, encoded[2] & 0xFF);
    }

    @Test
    void lengthField_countsUtf8Bytes() throws ProtocolException
    {
        byte[] encoded = FrameCodec.encode(new Message.UserMsg("æøå"));

        assertEquals(6, encoded[1]);
    }

    @Test
    void encode_exactlyMaximum_succeeds() throws ProtocolException
    {
        byte[] encoded = FrameCodec.encode(new Message.UserMsg("a".repeat(FrameCodec.MAX_FRAME_LENGTH - 3)));

        assertEquals(FrameCodec.MAX_FRAME_LENGTH, encoded.length);
    }

    @Test
    void encode_oversized_throws()
    {
        Message tooBig = new Message.UserMsg("a".repeat(FrameCodec.MAX_FRAME_LENGTH - 2));

        ProtocolException e = assertThrows(ProtocolException.class, () -> FrameCodec.encode(tooBig));
        assertEquals(ProtocolException.Reason.OVERSIZED_MESSAGE, e.getReason());
    }

    // ========== Reading ==========

    @Test
    void read_consecutiveFrames() throws IOException
    {
        ByteArrayOutputStream wire = new ByteArrayOutputStream();
        wire.write(FrameCodec.encode(new Message.NickChange("alice")));
        wire.write(FrameCodec.encode(new Message.NickedUserMsg("alice", "hello")));
        InputStream in = new ByteArrayInputStream(wire.toByteArray());

        assertEquals(new Message.NickChange("alice"), FrameCodec.read(in, buffer));
        assertEquals(new Message.NickedUserMsg("alice", "hello"), FrameCodec.read(in, buffer));
    }

    @Test
    void read_declaredLengthTooLarge_failsWithoutReadingPayload()
    {
        // 0x07FE = 2046 payload bytes + 3 header bytes = 2049
        InputStream in = new HeaderOnlyStream(new byte[]{0, (byte) 0xFE, 0x07});

        ProtocolException e = assertThrows(ProtocolException.class, () -> FrameCodec.read(in, buffer));
        assertEquals(ProtocolException.Reason.OVERSIZED_MESSAGE, e.getReason());
    }

    @Test
    void read_unknownCode_throws()
    {
        InputStream in = new ByteArrayInputStream(new byte[]{2, 1, 0, 'x'});

        ProtocolException e = assertThrows(ProtocolException.class, () -> FrameCodec.read(in, buffer));
        assertEquals(ProtocolException.Reason.INVALID_CODE, e.getReason());
    }

    @Test
    void read_nickedWithoutNul_throws()
    {
        InputStream in = new ByteArrayInputStream(new byte[]{100, 3, 0, 'b', 'o', 'b'});

        ProtocolException e = assertThrows(ProtocolException.class, () -> FrameCodec.read(in, buffer));
        assertEquals(ProtocolException.Reason.INVALID_PAYLOAD, e.getReason());
    }

    @Test
    void read_truncatedHeader_throwsEof()
    {
        InputStream in = new ByteArrayInputStream(new byte[]{0, 5});

        assertThrows(EOFException.class, () -> FrameCodec.read(in, buffer));
    }

    @Test
    void read_truncatedPayload_throwsEof()
    {
        InputStream in = new ByteArrayInputStream(new byte[]{0, 5, 0, 'a', 'b'});

        assertThrows(EOFException.class, () -> FrameCodec.read(in, buffer));
    }

    @Test
    void read_invalidUtf8_isDecodedLossily() throws IOException
    {
        InputStream in = new ByteArrayInputStream(new byte[]{0, 2, 0, 'a', (byte) 0xFF});

        assertEquals(new Message.UserMsg("a\uFFFD"), FrameCodec.read(in, buffer));
    }

    @Test
    void read_smallScratchBuffer_throws()
    {
        InputStream in = new ByteArrayInputStream(new byte[]{0, 0, 0});

        assertThrows(IllegalArgumentException.class, () -> FrameCodec.read(in, new byte[16]));
    }

    // ========== In-memory Decoding ==========

    @Test
    void decode_completeFrame() throws ProtocolException
    {
        byte[] frame = FrameCodec.encode(new Message.ConnectionRejected("too many users"));

        assertEquals(new Message.ConnectionRejected("too many users"), FrameCodec.decode(frame));
    }

    @Test
    void decode_shorterThanHeader_throws()
    {
        ProtocolException e = assertThrows(ProtocolException.class, () -> FrameCodec.decode(new byte[]{0, 0}));
        assertEquals(ProtocolException.Reason.UNDERSIZED_MESSAGE, e.getReason());
    }

    @Test
    void decode_lengthMismatch_throws()
    {
        ProtocolException e = assertThrows(ProtocolException.class,
                () -> FrameCodec.decode(new byte[]{0, 4, 0, 'a', 'b'}));
        assertEquals(ProtocolException.Reason.INVALID_PAYLOAD, e.getReason());
    }

    /**
     * Serves a header and fails the test if anything beyond it is read.
     */
    private static final class HeaderOnlyStream extends InputStream
    {
        private final byte[] header;
        private int position;

        HeaderOnlyStream(byte[] header)
        {
            this.header = header;
        }

        @Override
        public int read()
        {
            if (position >= header.length)
            {
                throw new AssertionError("Payload of an oversized frame must not be read");
            }
            return header[position++] & 0xFF;
        }

        @Override
        public int read(byte[] b, int off, int len)
        {
            if (len == 0)
            {
                return 0;
            }
            if (position >= header.length)
            {
                throw new AssertionError("Payload of an oversized frame must not be read");
            }
            int n = Math.min(len, header.length - position);
            System.arraycopy(header, position, b, off, n);
            position += n;
            return n;
        }
    }
}
