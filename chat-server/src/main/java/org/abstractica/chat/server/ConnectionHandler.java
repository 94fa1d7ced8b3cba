package org.abstractica.chat.server;

import org.abstractica.chat.protocol.FrameCodec;
import org.abstractica.chat.protocol.Message;
import org.abstractica.chat.protocol.MessageType;
import org.abstractica.chat.protocol.NickedPayload;
import org.abstractica.chat.session.ChatReader;
import org.abstractica.chat.session.ChatStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.Socket;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Drives one client connection from accept to teardown.
 *
 * <p>The first frame must be a {@code NickChange}. The nickname is admitted
 * against the registry, the client is told whether to encrypt, and once the
 * session is split the write half is registered behind an {@link Outbox} and
 * the read half is relayed into the router until the transport fails.</p>
 */
class ConnectionHandler implements Runnable
{
    private static final Logger LOG = LoggerFactory.getLogger(ConnectionHandler.class);

    static final String INVALID_NICK = "invalid nick";

    private final Socket socket;
    private final SocketAddress peerAddress;
    private final UserRegistry registry;
    private final MessageRouter router;
    private final Executor executor;
    private final boolean encryptionRequired;
    private final int outboxCapacity;
    private final byte[] buffer = new byte[FrameCodec.MAX_FRAME_LENGTH];

    private volatile ConnectionState state = ConnectionState.CONNECTED;

    ConnectionHandler(Socket socket, UserRegistry registry, MessageRouter router, Executor executor,
                      ServerConfig config)
    {
        this.socket = Objects.requireNonNull(socket, "socket");
        this.peerAddress = socket.getRemoteSocketAddress();
        this.registry = Objects.requireNonNull(registry, "registry");
        this.router = Objects.requireNonNull(router, "router");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.encryptionRequired = config.encryptionRequired();
        this.outboxCapacity = config.outboxCapacity();
    }

    @Override
    public void run()
    {
        LOG.debug("Incoming connection from {}", peerAddress);
        try (ChatStream stream = new ChatStream(socket))
        {
            serve(stream);
        }
        catch (IOException e)
        {
            LOG.warn("Connection from {} failed in state {}: {}", peerAddress, state, e.getMessage());
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            LOG.debug("Connection from {} interrupted", peerAddress);
        }
        finally
        {
            state = ConnectionState.CLOSED;
        }
    }

    /**
     * Closes the transport, ending the connection whatever its state.
     */
    void abort()
    {
        try
        {
            socket.close();
        }
        catch (IOException e)
        {
            LOG.debug("Error closing {}: {}", peerAddress, e.getMessage());
        }
    }

    ConnectionState getState()
    {
        return state;
    }

    // ========== Lifecycle ==========

    private void serve(ChatStream stream) throws IOException, InterruptedException
    {
        state = ConnectionState.AUTHENTICATING;
        String nick = readNick(stream);
        if (nick == null || !admit(stream, nick))
        {
            return;
        }

        ChatStream.Split halves;
        Outbox outbox;
        try
        {
            halves = negotiate(stream);
            outbox = new Outbox(nick, halves.writer(), outboxCapacity);
            outbox.start(executor);
        }
        catch (IOException | RuntimeException e)
        {
            registry.release(nick);
            throw e;
        }
        if (!registry.register(nick, outbox))
        {
            LOG.info("Dropped {} [{}] during shutdown", peerAddress, nick);
            outbox.close();
            return;
        }

        state = ConnectionState.ACTIVE;
        LOG.info("Connection successful from {}, nick {}", peerAddress, nick);
        try
        {
            try
            {
                router.broadcast(new Message.NickedConnect(nick));
                relay(halves.reader(), nick);
            }
            finally
            {
                outbox.close();
                state = ConnectionState.CLOSED;
            }
            // Queued while the nickname is still held, so a later join under it follows
            router.broadcast(new Message.NickedDisconnect(nick));
        }
        finally
        {
            registry.remove(nick);
        }
    }

    private String readNick(ChatStream stream) throws IOException
    {
        Message first = stream.receive(buffer);
        if (!(first instanceof Message.NickChange nickChange))
        {
            LOG.warn("{} aborted on nick: expected {}, got {}", peerAddress, MessageType.NICK_CHANGE, first.type());
            return null;
        }

        String nick = nickChange.nick();
        if (nick.indexOf(NickedPayload.SEPARATOR) >= 0)
        {
            reject(stream, INVALID_NICK);
            return null;
        }
        return nick;
    }

    private boolean admit(ChatStream stream, String nick)
    {
        UserRegistry.Admission admission = registry.tryReserve(nick);
        if (admission == UserRegistry.Admission.ACCEPTED)
        {
            return true;
        }
        if (admission.getReason() != null)
        {
            reject(stream, admission.getReason());
        }
        else
        {
            LOG.info("Dropped {} during shutdown", peerAddress);
        }
        return false;
    }

    private void reject(ChatStream stream, String reason)
    {
        try
        {
            stream.send(new Message.ConnectionRejected(reason));
        }
        catch (IOException e)
        {
            LOG.debug("Could not send rejection to {}: {}", peerAddress, e.getMessage());
        }
        LOG.info("Rejected {}, {}", peerAddress, reason);
    }

    /**
     * Accepts the client, encrypts if required and splits the session.
     */
    private ChatStream.Split negotiate(ChatStream stream) throws IOException
    {
        if (encryptionRequired)
        {
            stream.send(new Message.ConnectionEncrypted());
            state = ConnectionState.ENCRYPTING;
            stream.encrypt();
            LOG.debug("Encrypted stream from {}", peerAddress);
        }
        else
        {
            stream.send(new Message.ConnectionAccepted());
        }
        return stream.split();
    }

    private void relay(ChatReader reader, String nick) throws InterruptedException
    {
        while (true)
        {
            Message message;
            try
            {
                message = reader.receive(buffer);
            }
            catch (IOException e)
            {
                LOG.info("{} [{}] disconnected", peerAddress, nick);
                LOG.debug("Associated error: {}", e.toString());
                return;
            }

            Optional<Message> relayed = message.attributeTo(nick);
            if (relayed.isPresent())
            {
                LOG.trace("Msg({}) [{}]: {}", message.code(), nick, message.payload());
                router.broadcast(relayed.get());
            }
            else
            {
                LOG.debug("Ignoring {} from {}", message.type(), nick);
            }
        }
    }
}
