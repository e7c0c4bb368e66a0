package com.chatrelay.server.session;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * A registered, live connection. The channel is borrowed for writes only;
 * the connection handler that created the session owns and closes it.
 */
@Getter
@RequiredArgsConstructor
@ToString(exclude = "channel")
public class Session {

    private final String username;
    private final SessionChannel channel;
    private final Instant connectedAt;
}
