package com.chatrelay.server.session;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Newline-framed UTF-8 writer over a socket output stream.
 */
public class SocketSessionChannel implements SessionChannel {

    private final Writer writer;

    public SocketSessionChannel(OutputStream out) {
        this.writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
    }

    @Override
    public void send(String line) throws IOException {
        // Serialize writers so concurrent broadcasts never interleave within a line
        synchronized (writer) {
            writer.write(line);
            writer.write('\n');
            writer.flush();
        }
    }
}
