package org.abstractica.chat.server;

import org.abstractica.chat.session.ChatStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable server settings.
 *
 * @param bindAddress         address to listen on
 * @param port                TCP port, 0 for an ephemeral port
 * @param maxUsers            maximum number of connected users, reservations included
 * @param encryptionRequired  whether every session runs the secure channel handshake
 * @param routerQueueCapacity number of relayed messages buffered before senders block
 * @param outboxCapacity      number of messages pending for one user before it is disconnected
 */
public record ServerConfig(
        InetAddress bindAddress,
        int port,
        int maxUsers,
        boolean encryptionRequired,
        int routerQueueCapacity,
        int outboxCapacity
)
{
    private static final Logger LOG = LoggerFactory.getLogger(ServerConfig.class);

    public static final int DEFAULT_MAX_USERS = 50;
    public static final int DEFAULT_ROUTER_QUEUE_CAPACITY = 32;
    public static final int DEFAULT_OUTBOX_CAPACITY = 256;

    /**
     * Presence of this variable, whatever its value, allows plaintext sessions.
     */
    public static final String ENV_UNENCRYPTED = "CHAT_UNENCRYPTED";
    public static final String ENV_MAX_USERS = "CHAT_MAX_USERS";
    public static final String ENV_PORT = "CHAT_PORT";

    public ServerConfig
    {
        Objects.requireNonNull(bindAddress, "bindAddress");
        if (port < 0 || port > 65535)
        {
            throw new IllegalArgumentException("Port must be 0-65535: " + port);
        }
        if (maxUsers <= 0)
        {
            throw new IllegalArgumentException("maxUsers must be positive: " + maxUsers);
        }
        if (routerQueueCapacity <= 0)
        {
            throw new IllegalArgumentException("routerQueueCapacity must be positive: " + routerQueueCapacity);
        }
        if (outboxCapacity <= 0)
        {
            throw new IllegalArgumentException("outboxCapacity must be positive: " + outboxCapacity);
        }
    }

    /**
     * Returns the socket address to bind.
     *
     * @return bind address and port
     */
    public InetSocketAddress socketAddress()
    {
        return new InetSocketAddress(bindAddress, port);
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Reads the configuration of the server entry point.
     *
     * <p>The first argument is the bind address; without it the server listens on
     * all interfaces.</p>
     *
     * @param env  environment variables
     * @param args command line arguments
     * @return the configuration
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range
     */
    public static ServerConfig fromEnvironment(Map<String, String> env, String[] args)
    {
        Objects.requireNonNull(env, "env");
        Objects.requireNonNull(args, "args");

        Builder builder = builder();
        if (args.length > 0)
        {
            builder.bindAddress(parseAddress(args[0]));
        }
        else
        {
            LOG.warn("Bind address missing, assuming 0.0.0.0");
        }

        builder.encryptionRequired(!env.containsKey(ENV_UNENCRYPTED));

        String maxUsers = env.get(ENV_MAX_USERS);
        if (maxUsers != null)
        {
            builder.maxUsers(parseInt(ENV_MAX_USERS, maxUsers));
        }
        String port = env.get(ENV_PORT);
        if (port != null)
        {
            builder.port(parseInt(ENV_PORT, port));
        }
        return builder.build();
    }

    private static InetAddress parseAddress(String address)
    {
        try
        {
            return InetAddress.getByName(address);
        }
        catch (UnknownHostException e)
        {
            throw new IllegalArgumentException("Invalid bind address: " + address, e);
        }
    }

    private static int parseInt(String name, String value)
    {
        try
        {
            return Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e)
        {
            throw new IllegalArgumentException(name + " is not a number: " + value, e);
        }
    }

    public static class Builder
    {
        private InetAddress bindAddress;
        private int port = ChatStream.DEFAULT_PORT;
        private int maxUsers = DEFAULT_MAX_USERS;
        private boolean encryptionRequired = true;
        private int routerQueueCapacity = DEFAULT_ROUTER_QUEUE_CAPACITY;
        private int outboxCapacity = DEFAULT_OUTBOX_CAPACITY;

        private Builder() {}

        public Builder bindAddress(InetAddress bindAddress)
        {
            this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
            return this;
        }

        public Builder port(int port)
        {
            this.port = port;
            return this;
        }

        public Builder maxUsers(int maxUsers)
        {
            this.maxUsers = maxUsers;
            return this;
        }

        public Builder encryptionRequired(boolean encryptionRequired)
        {
            this.encryptionRequired = encryptionRequired;
            return this;
        }

        public Builder routerQueueCapacity(int routerQueueCapacity)
        {
            this.routerQueueCapacity = routerQueueCapacity;
            return this;
        }

        public Builder outboxCapacity(int outboxCapacity)
        {
            this.outboxCapacity = outboxCapacity;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return the configuration
         * @throws IllegalArgumentException if a value is out of range
         */
        public ServerConfig build()
        {
            InetAddress address = bindAddress != null ? bindAddress : anyLocalAddress();
            return new ServerConfig(address, port, maxUsers, encryptionRequired, routerQueueCapacity,
                    outboxCapacity);
        }

        private static InetAddress anyLocalAddress()
        {
            return new InetSocketAddress(0).getAddress();
        }
    }
}
