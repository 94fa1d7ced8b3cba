package org.abstractica.chat.session;

import org.abstractica.chat.crypto.FrameCipher;
import org.abstractica.chat.protocol.Message;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketAddress;
import java.util.Objects;

/**
 * Write half of a split {@link ChatStream}.
 *
 * <p>Thread-safe: concurrent sends are serialized so frames never interleave.
 * {@link #close()} closes the underlying socket, which makes a reader blocked
 * on the same connection fail with an {@link IOException}.</p>
 */
public class ChatWriter implements Closeable
{
    private final Socket socket;
    private final OutputStream out;
    private final FrameCipher cipher;
    private final SocketAddress peerAddress;

    ChatWriter(Socket socket, OutputStream out, FrameCipher cipher, SocketAddress peerAddress)
    {
        this.socket = socket;
        this.out = out;
        this.cipher = cipher;
        this.peerAddress = peerAddress;
    }

    /**
     * Sends a message and flushes it.
     *
     * @param message the message to send
     * @throws IOException if the frame is too large or the write fails
     */
    public synchronized void send(Message message) throws IOException
    {
        Objects.requireNonNull(message, "message");
        FrameIo.write(out, cipher, message);
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
