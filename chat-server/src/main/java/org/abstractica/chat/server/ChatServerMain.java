package org.abstractica.chat.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Server entry point.
 *
 * <p>Usage: {@code ChatServerMain [bind-address]}. Environment:
 * {@code CHAT_UNENCRYPTED} allows plaintext sessions, {@code CHAT_MAX_USERS}
 * and {@code CHAT_PORT} override the defaults.</p>
 */
public class ChatServerMain
{
    private static final Logger LOG = LoggerFactory.getLogger(ChatServerMain.class);
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    public static void main(String[] args)
    {
        ShutdownCoordinator coordinator = new ShutdownCoordinator();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> onSignal(coordinator), "chat-shutdown-hook"));

        int status = run(System.getenv(), args, coordinator);
        if (status != EXIT_OK)
        {
            System.exit(status);
        }
    }

    /**
     * Runs the server until a shutdown is requested.
     *
     * @return the process exit status
     */
    static int run(Map<String, String> env, String[] args, ShutdownCoordinator coordinator)
    {
        ServerConfig config;
        try
        {
            config = ServerConfig.fromEnvironment(env, args);
        }
        catch (IllegalArgumentException e)
        {
            LOG.error("Invalid configuration: {}", e.getMessage());
            coordinator.shutdownComplete();
            return EXIT_FAILURE;
        }

        ChatServer server = new ChatServer(config);
        try
        {
            server.start();
        }
        catch (IOException e)
        {
            LOG.error("Error on binding listener to {}: {}", config.socketAddress(), e.getMessage());
            server.close();
            coordinator.shutdownComplete();
            return EXIT_FAILURE;
        }

        try
        {
            coordinator.awaitShutdownRequest();
            LOG.info("Received shutdown request, exiting");
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            LOG.info("Interrupted, exiting");
        }
        finally
        {
            server.close();
            coordinator.shutdownComplete();
        }
        return EXIT_OK;
    }

    private static void onSignal(ShutdownCoordinator coordinator)
    {
        if (coordinator.isShutdownComplete())
        {
            // Exiting on its own, with its own status
            return;
        }
        coordinator.requestShutdown();
        try
        {
            if (!coordinator.awaitCompletion(SHUTDOWN_TIMEOUT))
            {
                LOG.warn("Shutdown did not finish within {}s", SHUTDOWN_TIMEOUT.toSeconds());
            }
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
        // A signal would otherwise leave the JVM with its signal exit status
        Runtime.getRuntime().halt(EXIT_OK);
    }
}
