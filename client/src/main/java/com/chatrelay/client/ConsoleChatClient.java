package com.chatrelay.client;

import com.chatrelay.client.console.ChatCommand;
import com.chatrelay.client.console.EnvelopeFormatter;
import com.chatrelay.client.console.Roster;
import com.chatrelay.client.model.Envelope;
import com.chatrelay.client.model.EnvelopeType;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Line-oriented chat client: reads commands from stdin, prints the room to stdout.
 * <p>
 * Characters of a chat line drive a {@link TypingNotifier}, so other users see
 * {@code typing} while a line is being entered and {@code stop_typing} once it
 * is sent. A terminal in line mode only delivers input on Enter, so there the
 * indicator is brief. Commands starting with {@code /} send no typing signal.
 * <p>
 * Usage: {@code ConsoleChatClient <host> <port> <username>}
 */
@Slf4j
public class ConsoleChatClient implements EnvelopeListener {

    private static final String DEFAULT_HOST = "localhost";
    private static final int DEFAULT_PORT = 5000;

    private final PrintStream out;
    private final Roster roster = new Roster();
    private final EnvelopeFormatter formatter;
    private final CountDownLatch disconnected = new CountDownLatch(1);
    private final RelayClient client;
    private final long typingIdleMillis;
    private volatile boolean quitting;

    public ConsoleChatClient(PrintStream out, ZoneId zone) {
        this(out, zone, TypingNotifier.DEFAULT_IDLE_MILLIS);
    }

    public ConsoleChatClient(PrintStream out, ZoneId zone, long typingIdleMillis) {
        this.out = out;
        this.formatter = new EnvelopeFormatter(zone);
        this.client = new RelayClient(this);
        this.typingIdleMillis = typingIdleMillis;
    }

    public static void main(String[] args) {
        if (args.length < 3) {
            log.error("Usage: java ConsoleChatClient <host> <port> <username>");
            System.exit(1);
        }

        String host = args[0].isBlank() ? DEFAULT_HOST : args[0];
        int port;
        try {
            port = Integer.parseInt(args[1]);
        } catch (NumberFormatException e) {
            log.warn("Invalid port '{}', using {}", args[1], DEFAULT_PORT);
            port = DEFAULT_PORT;
        }

        ConsoleChatClient console = new ConsoleChatClient(System.out, ZoneId.systemDefault());
        try {
            console.run(host, port, args[2],
                    new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        } catch (IOException e) {
            log.error("Connect failed: {}", e.getMessage());
            System.exit(1);
        }
    }

    public void run(String host, int port, String username, BufferedReader input) throws IOException {
        client.connect(host, port, username);
        out.println("[system] connected");
        out.println("Type a message, /w <user> <text> for a private message, /users, or /quit");

        ScheduledExecutorService typingTimer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "typing-timer");
            t.setDaemon(true);
            return t;
        });
        TypingNotifier typing = new TypingNotifier(this::sendTypingSignal, typingTimer, typingIdleMillis);
        try {
            String line;
            while (disconnected.getCount() > 0 && (line = readLine(input, typing)) != null) {
                boolean keepGoing = handle(ChatCommand.parse(line));
                typing.reset();
                if (!keepGoing) {
                    break;
                }
            }
        } finally {
            typingTimer.shutdownNow();
        }

        quitting = true;
        client.disconnect();
        try {
            disconnected.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Reads one line, reporting each character of a chat line as typing input.
     *
     * @return the line without its terminator, or null at end of input
     */
    private String readLine(BufferedReader input, TypingNotifier typing) throws IOException {
        StringBuilder line = new StringBuilder();
        int c;
        while ((c = input.read()) != -1) {
            if (c == '\n') {
                int end = line.length();
                if (end > 0 && line.charAt(end - 1) == '\r') {
                    line.setLength(end - 1);
                }
                return line.toString();
            }
            line.append((char) c);
            if (line.charAt(0) != '/' && !Character.isWhitespace(c)) {
                typing.onInput();
            }
        }
        return line.length() > 0 ? line.toString() : null;
    }

    private void sendTypingSignal(EnvelopeType signal) {
        try {
            client.sendTypingSignal(signal);
        } catch (IOException | IllegalStateException e) {
            log.debug("Could not send {}: {}", signal.getWireName(), e.getMessage());
        }
    }

    /**
     * @return false once the user asked to quit
     */
    boolean handle(ChatCommand command) {
        try {
            switch (command.getKind()) {
                case MESSAGE:
                    client.sendMessage(command.getText());
                    break;
                case PRIVATE:
                    client.sendPrivate(command.getTarget(), command.getText());
                    break;
                case USERS:
                    out.println("[system] online: " + String.join(", ", roster.getOnline()));
                    break;
                case INVALID:
                    out.println("[system] " + command.getText());
                    break;
                case QUIT:
                    return false;
                default:
                    break;
            }
        } catch (IOException | IllegalStateException e) {
            out.println("[system] send error: " + e.getMessage());
        }
        return true;
    }

    @Override
    public void onEnvelope(Envelope envelope) {
        boolean changed = roster.apply(envelope);
        if (envelope.isTypingSignal() && !changed) {
            return;
        }
        String rendered = formatter.format(envelope);
        if (rendered != null) {
            out.println(rendered);
        }
    }

    @Override
    public void onDisconnected(Exception cause) {
        if (cause != null) {
            out.println("[system] receive loop error: " + cause.getMessage());
        }
        out.println("[system] disconnected");
        if (!quitting) {
            // the input loop is still blocked on stdin
            out.println("[system] press Enter to exit");
        }
        roster.clear();
        disconnected.countDown();
    }

    Roster getRoster() {
        return roster;
    }
}
