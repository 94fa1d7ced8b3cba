package org.abstractica.chat.session;

import org.abstractica.chat.crypto.FrameCipher;
import org.abstractica.chat.protocol.FrameCodec;
import org.abstractica.chat.protocol.Message;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.Socket;
import java.net.SocketAddress;

/**
 * Read half of a split {@link ChatStream}.
 *
 * <p>Meant to be driven by a single thread; frames arrive strictly in order.</p>
 */
public class ChatReader implements Closeable
{
    private final Socket socket;
    private final InputStream in;
    private final FrameCipher cipher;
    private final SocketAddress peerAddress;
    private final byte[] scratch = new byte[FrameCodec.MAX_FRAME_LENGTH];

    ChatReader(Socket socket, InputStream in, FrameCipher cipher, SocketAddress peerAddress)
    {
        this.socket = socket;
        this.in = in;
        this.cipher = cipher;
        this.peerAddress = peerAddress;
    }

    /**
     * Blocks until the next message arrives.
     *
     * @param buffer scratch space of at least {@link FrameCodec#MAX_FRAME_LENGTH} bytes
     * @return the received message
     * @throws IOException if the transport fails or closes, or the frame is malformed
     *                     or fails authentication
     */
    public Message receive(byte[] buffer) throws IOException
    {
        return FrameIo.read(in, cipher, buffer);
    }

    /**
     * Blocks until the next message arrives, using the reader's own scratch buffer.
     *
     * @return the received message
     * @throws IOException if the transport fails or closes, or the frame is malformed
     */
    public Message receive() throws IOException
    {
        return receive(scratch);
    }

    public boolean isEncrypted()
    {
        return cipher != null;
    }

    public SocketAddress getPeerAddress()
    {
        return peerAddress;
    }

    /**
     * Closes the whole connection, not just this half.
     */
    @Override
    public void close() throws IOException
    {
        socket.close();
    }
}
