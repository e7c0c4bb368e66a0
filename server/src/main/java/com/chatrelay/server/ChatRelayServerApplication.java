package com.chatrelay.server;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Slf4j
@SpringBootApplication
public class ChatRelayServerApplication {

    public static void main(String[] args) {
        log.info("Starting ChatRelay Server...");
        SpringApplication.run(ChatRelayServerApplication.class, toApplicationArgs(args));
    }

    /**
     * Maps an optional leading port argument onto {@code --relay.port}.
     * A port that does not parse falls back to the configured default.
     */
    static String[] toApplicationArgs(String[] args) {
        if (args.length == 0 || args[0].startsWith("--")) {
            return args;
        }

        List<String> result = new ArrayList<>(Arrays.asList(args).subList(1, args.length));
        try {
            int port = Integer.parseInt(args[0].trim());
            if (port < 0 || port > 65535) {
                throw new NumberFormatException("out of range");
            }
            result.add(0, "--relay.port=" + port);
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid port argument '{}', using configured default", args[0]);
        }
        return result.toArray(new String[0]);
    }
}
