package org.abstractica.chat.client;

import org.abstractica.chat.client.handlers.DisconnectHandler;
import org.abstractica.chat.client.handlers.MessageHandler;
import org.abstractica.chat.protocol.FrameCodec;
import org.abstractica.chat.protocol.Message;
import org.abstractica.chat.protocol.ProtocolException;
import org.abstractica.chat.session.ChatReader;
import org.abstractica.chat.session.ChatStream;
import org.abstractica.chat.session.ChatWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.Objects;

/**
 * Client side of a chat connection.
 *
 * <p>{@link #connect()} sends the nickname, waits for the server's verdict and
 * runs the secure channel handshake if the server asks for it. Afterwards a
 * reader thread hands every relayed message to the {@link MessageHandler}
 * while the calling threads send.</p>
 */
public class ChatClient implements Closeable
{
    private static final Logger LOG = LoggerFactory.getLogger(ChatClient.class);
    private static final long READER_JOIN_TIMEOUT_MS = 2000;

    private final String host;
    private final int port;
    private final String nickname;
    private final MessageHandler messageHandler;
    private final DisconnectHandler disconnectHandler;

    private volatile ChatWriter writer;
    private volatile boolean encrypted;
    private volatile boolean closing;
    private Thread readerThread;

    private ChatClient(Builder builder)
    {
        this.host = builder.host;
        this.port = builder.port;
        this.nickname = builder.nickname;
        this.messageHandler = builder.messageHandler;
        this.disconnectHandler = builder.disconnectHandler;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Connects and negotiates the nickname.
     *
     * @throws ConnectionRejectedException if the server refuses the nickname
     * @throws IOException                 if the connection or handshake fails
     */
    public synchronized void connect() throws IOException
    {
        if (writer != null || closing)
        {
            throw new IllegalStateException("Client already connected");
        }

        LOG.info("Connecting to {}:{} as {}", host, port, nickname);
        ChatStream stream = ChatStream.connect(host, port);
        ChatStream.Split halves;
        try
        {
            negotiate(stream);
            halves = stream.split();
        }
        catch (IOException | RuntimeException e)
        {
            stream.close();
            throw e;
        }

        writer = halves.writer();
        encrypted = halves.writer().isEncrypted();
        readerThread = new Thread(() -> readLoop(halves.reader()), "chat-client-reader");
        readerThread.setDaemon(true);
        readerThread.start();
        LOG.info("Connected to {}:{}{}", host, port, encrypted ? ", encrypted" : "");
    }

    private void negotiate(ChatStream stream) throws IOException
    {
        stream.send(new Message.NickChange(nickname));
        Message reply = stream.receive();
        if (reply instanceof Message.ConnectionRejected rejected)
        {
            throw new ConnectionRejectedException(rejected.reason());
        }
        switch (reply.type())
        {
            case CONNECTION_ACCEPTED -> LOG.debug("Server accepted a plaintext session");
            case CONNECTION_ENCRYPTED ->
            {
                LOG.debug("Server requires encryption");
                stream.encrypt();
            }
            default -> throw new ProtocolException(ProtocolException.Reason.INVALID_CODE,
                    "Expected a connection verdict, got " + reply.type());
        }
    }

    // ========== Sending ==========

    /**
     * Sends a chat line.
     *
     * @param text the message text
     * @throws IOException if the message is too large or the connection fails
     */
    public void sendMessage(String text) throws IOException
    {
        send(new Message.UserMsg(text));
    }

    /**
     * Sends a command for the other users to see.
     *
     * @param command the command text, without its leading slash
     * @throws IOException if the message is too large or the connection fails
     */
    public void sendCommand(String command) throws IOException
    {
        send(new Message.Command(command));
    }

    /**
     * Announces a new nickname. The server relays it but keeps the nickname
     * the connection was admitted with.
     *
     * @param newNick the new nickname
     * @throws IOException if the connection fails
     */
    public void changeNick(String newNick) throws IOException
    {
        send(new Message.NickChange(newNick));
    }

    private void send(Message message) throws IOException
    {
        ChatWriter current = writer;
        if (current == null)
        {
            throw new IllegalStateException("Client not connected");
        }
        current.send(message);
    }

    // ========== State ==========

    public String getNickname()
    {
        return nickname;
    }

    public boolean isConnected()
    {
        return writer != null && !closing;
    }

    public boolean isEncrypted()
    {
        return encrypted;
    }

    /**
     * Closes the connection. The disconnect handler is called with a null cause.
     */
    @Override
    public void close()
    {
        Thread reader;
        synchronized (this)
        {
            if (closing)
            {
                return;
            }
            closing = true;
            reader = readerThread;
        }

        ChatWriter current = writer;
        if (current != null)
        {
            try
            {
                current.close();
            }
            catch (IOException e)
            {
                LOG.debug("Error closing connection: {}", e.getMessage());
            }
        }

        if (reader != null && reader != Thread.currentThread())
        {
            try
            {
                reader.join(READER_JOIN_TIMEOUT_MS);
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
            }
        }
    }

    // ========== Reader ==========

    private void readLoop(ChatReader reader)
    {
        byte[] buffer = new byte[FrameCodec.MAX_FRAME_LENGTH];
        IOException cause;
        while (true)
        {
            Message message;
            try
            {
                message = reader.receive(buffer);
            }
            catch (IOException e)
            {
                cause = e;
                break;
            }

            try
            {
                messageHandler.handle(message);
            }
            catch (RuntimeException e)
            {
                LOG.error("Message handler failed on {}", message.type(), e);
            }
        }

        try
        {
            reader.close();
        }
        catch (IOException e)
        {
            LOG.debug("Error closing reader: {}", e.getMessage());
        }

        IOException reported = closing ? null : cause;
        if (reported != null)
        {
            LOG.info("Disconnected from {}:{}: {}", host, port, reported.getMessage());
        }
        closing = true;
        try
        {
            disconnectHandler.disconnected(reported);
        }
        catch (RuntimeException e)
        {
            LOG.error("Disconnect handler failed", e);
        }
    }

    public static class Builder
    {
        private String host = "localhost";
        private int port = ChatStream.DEFAULT_PORT;
        private String nickname;
        private MessageHandler messageHandler = message -> {};
        private DisconnectHandler disconnectHandler = cause -> {};

        private Builder() {}

        public Builder host(String host)
        {
            this.host = Objects.requireNonNull(host, "host");
            return this;
        }

        public Builder port(int port)
        {
            if (port <= 0 || port > 65535)
            {
                throw new IllegalArgumentException("Port must be 1-65535: " + port);
            }
            this.port = port;
            return this;
        }

        public Builder nickname(String nickname)
        {
            this.nickname = Objects.requireNonNull(nickname, "nickname");
            return this;
        }

        public Builder onMessage(MessageHandler handler)
        {
            this.messageHandler = Objects.requireNonNull(handler, "handler");
            return this;
        }

        public Builder onDisconnect(DisconnectHandler handler)
        {
            this.disconnectHandler = Objects.requireNonNull(handler, "handler");
            return this;
        }

        /**
         * Builds an unconnected client.
         *
         * @return the client
         * @throws IllegalStateException if no nickname was set
         */
        public ChatClient build()
        {
            if (nickname == null)
            {
                throw new IllegalStateException("nickname is required");
            }
            return new ChatClient(this);
        }
    }
}
