package com.chatrelay.server.session;

import java.io.IOException;

/**
 * Write side of a connection. Implementations must be safe to call from
 * several threads; each call writes one complete line.
 */
public interface SessionChannel {

    void send(String line) throws IOException;
}
