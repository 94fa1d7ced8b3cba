package org.abstractica.chat.session;

import org.abstractica.chat.crypto.FrameCipher;
import org.abstractica.chat.protocol.FrameCodec;
import org.abstractica.chat.protocol.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.util.Objects;

/**
 * A BCMP session over one TCP connection.
 *
 * <p>Starts in plaintext. {@link #encrypt()} runs the secure channel handshake
 * and from then on every frame travels inside an AEAD envelope. Once the
 * negotiation is over the stream is {@link #split() split} into a reader and a
 * writer so that one thread can block on reads while others write.</p>
 *
 * <p>Not thread-safe; a single thread drives the stream until it is split.</p>
 */
public class ChatStream implements Closeable
{
    private static final Logger LOG = LoggerFactory.getLogger(ChatStream.class);

    /**
     * The well-known BCMP port.
     */
    public static final int DEFAULT_PORT = 7878;

    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private final SocketAddress peerAddress;
    private final byte[] scratch = new byte[FrameCodec.MAX_FRAME_LENGTH];

    private FrameCipher cipher;
    private boolean split;

    /**
     * Wraps a connected socket.
     *
     * @param socket the connected socket
     * @throws IOException if the socket's streams cannot be obtained
     */
    public ChatStream(Socket socket) throws IOException
    {
        this.socket = Objects.requireNonNull(socket, "socket");
        this.in = new BufferedInputStream(socket.getInputStream(), FrameCodec.MAX_FRAME_LENGTH);
        this.out = new BufferedOutputStream(socket.getOutputStream(), FrameCodec.MAX_FRAME_LENGTH);
        this.peerAddress = socket.getRemoteSocketAddress();
    }

    /**
     * Opens a connection to a server.
     *
     * @param host the server host
     * @param port the server port
     * @return a plaintext stream
     * @throws IOException if the connection fails
     */
    public static ChatStream connect(String host, int port) throws IOException
    {
        Socket socket = new Socket();
        try
        {
            socket.connect(new InetSocketAddress(host, port));
            socket.setTcpNoDelay(true);
            return new ChatStream(socket);
        }
        catch (IOException e)
        {
            socket.close();
            throw e;
        }
    }

    /**
     * Sends a message and flushes it.
     *
     * @param message the message to send
     * @throws org.abstractica.chat.protocol.ProtocolException if the frame is too large
     * @throws IOException                                     if the write fails
     */
    public void send(Message message) throws IOException
    {
        Objects.requireNonNull(message, "message");
        requireUnsplit();
        FrameIo.write(out, cipher, message);
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
        requireUnsplit();
        return FrameIo.read(in, cipher, buffer);
    }

    /**
     * Blocks until the next message arrives, using the stream's own scratch buffer.
     *
     * @return the received message
     * @throws IOException if the transport fails or closes, or the frame is malformed
     */
    public Message receive() throws IOException
    {
        return receive(scratch);
    }

    /**
     * Runs the secure channel handshake with the peer.
     *
     * <p>Does nothing if the stream is already encrypted; there is no re-keying.</p>
     *
     * @throws IOException if the exchange fails; the stream must then be closed
     */
    public void encrypt() throws IOException
    {
        requireUnsplit();
        if (cipher != null)
        {
            return;
        }
        cipher = SecureChannelHandshake.perform(in, out);
        LOG.debug("Encrypted stream with {}", peerAddress);
    }

    /**
     * Returns whether frames are sent inside the encrypted envelope.
     *
     * @return true after a successful {@link #encrypt()}
     */
    public boolean isEncrypted()
    {
        return cipher != null;
    }

    /**
     * Splits the stream into independent halves sharing the current cipher.
     *
     * <p>Complete the handshake first: a half never picks up encryption
     * installed later. This stream must not be used afterwards.</p>
     *
     * @return the reader and writer
     */
    public Split split()
    {
        requireUnsplit();
        split = true;
        return new Split(
                new ChatReader(socket, in, cipher, peerAddress),
                new ChatWriter(socket, out, cipher, peerAddress)
        );
    }

    /**
     * Returns the address of the remote end.
     *
     * @return peer address
     */
    public SocketAddress getPeerAddress()
    {
        return peerAddress;
    }

    @Override
    public void close() throws IOException
    {
        socket.close();
    }

    private void requireUnsplit()
    {
        if (split)
        {
            throw new IllegalStateException("Stream has been split");
        }
    }

    /**
     * The two halves of a split stream.
     *
     * @param reader the read half
     * @param writer the write half
     */
    public record Split(ChatReader reader, ChatWriter writer) {}
}
