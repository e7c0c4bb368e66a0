package com.chatrelay.client;

import com.chatrelay.client.model.Envelope;
import com.chatrelay.client.model.EnvelopeType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * Connection to a relay server. Joins on connect and hands every received
 * envelope to an {@link EnvelopeListener} on a background thread.
 */
@Slf4j
public class RelayClient implements Closeable {

    private final ObjectMapper objectMapper;
    private final EnvelopeListener listener;

    private Socket socket;
    private Writer writer;
    private String username;
    private volatile boolean disconnectRequested;

    public RelayClient(EnvelopeListener listener) {
        this(new ObjectMapper(), listener);
    }

    public RelayClient(ObjectMapper objectMapper, EnvelopeListener listener) {
        this.objectMapper = objectMapper;
        this.listener = listener;
    }

    public void connect(String host, int port, String username) throws IOException {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("username is required");
        }
        if (socket != null) {
            throw new IllegalStateException("Already connected");
        }

        this.username = username.trim();
        this.disconnectRequested = false;
        this.socket = new Socket(host, port);
        this.writer = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
        BufferedReader reader = new BufferedReader(
                new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));

        send(Envelope.outbound(EnvelopeType.JOIN, this.username, null, null));

        Thread receiver = new Thread(() -> receiveLoop(reader), "relay-receiver");
        receiver.setDaemon(true);
        receiver.start();
        log.debug("Connected to {}:{} as {}", host, port, this.username);
    }

    public void sendMessage(String text) throws IOException {
        send(Envelope.outbound(EnvelopeType.MSG, username, null, text));
    }

    public void sendPrivate(String to, String text) throws IOException {
        send(Envelope.outbound(EnvelopeType.PM, username, to, text));
    }

    public void sendTypingSignal(EnvelopeType signal) throws IOException {
        if (signal != EnvelopeType.TYPING && signal != EnvelopeType.STOP_TYPING) {
            throw new IllegalArgumentException("Not a typing signal: " + signal);
        }
        send(Envelope.outbound(signal, username, null, null));
    }

    public synchronized void send(Envelope envelope) throws IOException {
        if (writer == null) {
            throw new IllegalStateException("Not connected");
        }
        writer.write(objectMapper.writeValueAsString(envelope));
        writer.write('\n');
        writer.flush();
    }

    private void receiveLoop(BufferedReader reader) {
        Exception failure = null;
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                Envelope envelope;
                try {
                    envelope = objectMapper.readValue(line, Envelope.class);
                } catch (JsonProcessingException e) {
                    log.debug("Ignoring unreadable line: {}", e.getOriginalMessage());
                    continue;
                }
                if (envelope == null || envelope.getType() == null) {
                    continue;
                }
                listener.onEnvelope(envelope);
            }
        } catch (IOException e) {
            if (!disconnectRequested) {
                failure = e;
            }
        } finally {
            closeSocket();
            listener.onDisconnected(failure);
        }
    }

    /**
     * Sends {@code leave} and closes the connection. The receive thread reports
     * the disconnect through {@link EnvelopeListener#onDisconnected(Exception)}.
     */
    public void disconnect() {
        disconnectRequested = true;
        try {
            if (writer != null) {
                send(Envelope.outbound(EnvelopeType.LEAVE, username, null, null));
            }
        } catch (IOException e) {
            log.debug("Could not send leave: {}", e.getMessage());
        }
        closeSocket();
    }

    @Override
    public void close() {
        disconnect();
    }

    private synchronized void closeSocket() {
        if (socket == null) {
            return;
        }
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing socket: {}", e.getMessage());
        }
        socket = null;
        writer = null;
    }

    public synchronized boolean isConnected() {
        return socket != null && !socket.isClosed();
    }

    public String getUsername() {
        return username;
    }
}
