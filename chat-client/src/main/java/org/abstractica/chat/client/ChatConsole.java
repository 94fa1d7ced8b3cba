package org.abstractica.chat.client;

import org.abstractica.chat.session.ChatStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Line-based console client.
 *
 * <p>Usage: {@code ChatConsole [host] [port]}. Typed lines are sent as chat
 * messages; {@code /nick name} announces a new nickname, {@code /quit} exits
 * and any other line starting with {@code /} is sent as a command.</p>
 */
public class ChatConsole
{
    private static final Logger LOG = LoggerFactory.getLogger(ChatConsole.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final BufferedReader in;
    private final PrintStream out;
    private final Runnable onServerDisconnect;

    /**
     * A parsed line of user input.
     *
     * @param kind     what the line asks for
     * @param argument the text that goes with it, empty if none
     */
    record Input(Kind kind, String argument)
    {
        enum Kind
        {
            MESSAGE,
            NICK,
            COMMAND,
            QUIT,
            EMPTY
        }
    }

    public ChatConsole(BufferedReader in, PrintStream out, Runnable onServerDisconnect)
    {
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
        this.onServerDisconnect = Objects.requireNonNull(onServerDisconnect, "onServerDisconnect");
    }

    public static void main(String[] args)
    {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        ChatConsole console = new ChatConsole(in, System.out, () -> System.exit(EXIT_OK));
        System.exit(console.run(args));
    }

    /**
     * Connects and relays input until {@code /quit} or the end of input.
     *
     * @param args optional host and port
     * @return the exit status
     */
    int run(String[] args)
    {
        try
        {
            String host = args.length > 0 ? args[0] : prompt("Please input the server IP: ");
            int port = args.length > 1 ? Integer.parseInt(args[1]) : ChatStream.DEFAULT_PORT;
            if (host == null)
            {
                return EXIT_OK;
            }
            String nick = prompt("Enter nickname: ");
            if (nick == null)
            {
                return EXIT_OK;
            }

            out.println("Connecting to " + host + ":" + port);
            ChatClient client = ChatClient.builder()
                    .host(host)
                    .port(port)
                    .nickname(nick.trim())
                    .onMessage(message -> MessageFormatter.format(message).ifPresent(out::println))
                    .onDisconnect(cause ->
                    {
                        if (cause != null)
                        {
                            out.println("Disconnected from server.");
                            onServerDisconnect.run();
                        }
                    })
                    .build();

            try
            {
                client.connect();
            }
            catch (ConnectionRejectedException e)
            {
                out.println("Server refused connection: " + e.getReason());
                return EXIT_OK;
            }
            catch (IOException e)
            {
                out.println("Error on connecting: " + e.getMessage());
                return EXIT_FAILURE;
            }

            out.println(client.isEncrypted() ? "Connected. Encrypted." : "Connected.");
            try
            {
                inputLoop(client);
            }
            finally
            {
                client.close();
            }
            return EXIT_OK;
        }
        catch (NumberFormatException e)
        {
            out.println("Invalid port: " + args[1]);
            return EXIT_FAILURE;
        }
        catch (IOException e)
        {
            LOG.error("Console failed", e);
            return EXIT_FAILURE;
        }
    }

    private void inputLoop(ChatClient client) throws IOException
    {
        String line;
        while ((line = in.readLine()) != null)
        {
            Input input = parse(line);
            try
            {
                switch (input.kind())
                {
                    case QUIT ->
                    {
                        return;
                    }
                    case NICK -> client.changeNick(input.argument());
                    case COMMAND -> client.sendCommand(input.argument());
                    case MESSAGE -> client.sendMessage(input.argument());
                    case EMPTY ->
                    {
                    }
                }
            }
            catch (IOException e)
            {
                out.println("Could not send: " + e.getMessage());
                if (!client.isConnected())
                {
                    return;
                }
            }
        }
    }

    private String prompt(String text) throws IOException
    {
        out.print(text);
        out.flush();
        return in.readLine();
    }

    /**
     * Interprets one line of user input.
     *
     * @param line the line without its terminator
     * @return what to do with it
     */
    static Input parse(String line)
    {
        if (line.isBlank())
        {
            return new Input(Input.Kind.EMPTY, "");
        }
        if (!line.startsWith("/"))
        {
            return new Input(Input.Kind.MESSAGE, line);
        }

        String body = line.substring(1);
        if (body.trim().equals("quit"))
        {
            return new Input(Input.Kind.QUIT, "");
        }
        if (body.startsWith("nick "))
        {
            String nick = body.substring("nick ".length()).trim();
            if (!nick.isEmpty())
            {
                return new Input(Input.Kind.NICK, nick);
            }
        }
        return new Input(Input.Kind.COMMAND, body);
    }
}
