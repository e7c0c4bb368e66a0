package com.chatrelay.client.console;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * One parsed line of console input.
 */
@Getter
@AllArgsConstructor
public class ChatCommand {

    public enum Kind {
        MESSAGE, PRIVATE, USERS, QUIT, EMPTY, INVALID
    }

    private final Kind kind;
    private final String target;
    private final String text;

    static final String PM_USAGE = "PM format: /w user message";

    /**
     * Parses console input. {@code /w user text} is a private message,
     * {@code /users} and {@code /quit} are local commands, anything else is
     * sent to everyone.
     */
    public static ChatCommand parse(String input) {
        String line = input == null ? "" : input.trim();
        if (line.isEmpty()) {
            return new ChatCommand(Kind.EMPTY, null, null);
        }
        if (line.equals("/quit")) {
            return new ChatCommand(Kind.QUIT, null, null);
        }
        if (line.equals("/users")) {
            return new ChatCommand(Kind.USERS, null, null);
        }
        if (line.equals("/w") || line.startsWith("/w ")) {
            String[] parts = line.split("\\s+", 3);
            if (parts.length < 3) {
                return new ChatCommand(Kind.INVALID, null, PM_USAGE);
            }
            return new ChatCommand(Kind.PRIVATE, parts[1], parts[2]);
        }
        return new ChatCommand(Kind.MESSAGE, null, line);
    }
}
