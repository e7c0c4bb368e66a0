package com.chatrelay.server.handler;

import com.chatrelay.server.codec.EnvelopeCodec;
import com.chatrelay.server.codec.EnvelopeDecodeException;
import com.chatrelay.server.model.Envelope;
import com.chatrelay.server.model.EnvelopeType;
import com.chatrelay.server.service.ConnectionMetricsService;
import com.chatrelay.server.service.MessageDispatcher;
import com.chatrelay.server.service.SessionRegistry;
import com.chatrelay.server.service.SessionRegistry.Registration;
import com.chatrelay.server.session.SessionChannel;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;

/**
 * Drives one connection from handshake to close.
 * <p>
 * The first line must be a {@code join} envelope with a non-blank {@code From}.
 * After that every line is decoded, re-stamped with the registered username and
 * the server time, and routed by type. The handler owns the transport: it is the
 * only place that unregisters the session and closes the connection.
 */
@Slf4j
public class ConnectionHandler implements Runnable {

    static final String INVALID_JOIN = "Invalid join";

    private final String connectionId;
    private final BufferedReader reader;
    private final SessionChannel channel;
    private final Closeable transport;
    private final SessionRegistry registry;
    private final MessageDispatcher dispatcher;
    private final EnvelopeCodec codec;
    private final ConnectionMetricsService metrics;
    private final Clock clock;

    private volatile ConnectionState state = ConnectionState.AWAITING_JOIN;
    private volatile String username;

    @Builder
    public ConnectionHandler(String connectionId, BufferedReader reader, SessionChannel channel,
                             Closeable transport, SessionRegistry registry, MessageDispatcher dispatcher,
                             EnvelopeCodec codec, ConnectionMetricsService metrics, Clock clock) {
        this.connectionId = connectionId;
        this.reader = reader;
        this.channel = channel;
        this.transport = transport;
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.codec = codec;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public void run() {
        metrics.incrementConnections();
        try {
            if (awaitJoin()) {
                readLoop();
            }
        } catch (IOException e) {
            log.info("Connection {} ({}) lost: {}", connectionId, username, e.getMessage());
        } catch (Exception e) {
            log.error("Unexpected error on connection {} ({}): {}", connectionId, username, e.getMessage(), e);
        } finally {
            close();
            metrics.decrementConnections();
        }
    }

    /**
     * @return true if the connection joined and is now active
     */
    private boolean awaitJoin() throws IOException {
        String line = reader.readLine();
        if (line == null) {
            log.debug("Connection {} closed before joining", connectionId);
            return false;
        }

        Envelope join;
        try {
            join = codec.decode(line);
        } catch (EnvelopeDecodeException e) {
            reject(e.getMessage());
            return false;
        }

        if (join.getType() != EnvelopeType.JOIN) {
            reject("first envelope was " + join.getType().getWireName());
            return false;
        }
        if (join.getFrom() == null || join.getFrom().isBlank()) {
            reject("missing username");
            return false;
        }

        Registration registration = registry.register(join.getFrom().trim(), channel);
        username = registration.getUsername();
        log.info("Connection {} joined as {}", connectionId, username);

        for (String online : registration.getAlreadyOnline()) {
            Envelope backlog = Envelope.presence(EnvelopeType.JOIN, online, online + " (already online)", now());
            dispatcher.sendTo(registration.getSession(), backlog);
        }

        dispatcher.broadcast(Envelope.presence(EnvelopeType.JOIN, username, username + " joined", now()));
        state = ConnectionState.ACTIVE;
        return true;
    }

    private void readLoop() throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            Envelope envelope;
            try {
                envelope = codec.decode(line);
            } catch (EnvelopeDecodeException e) {
                metrics.recordLineDropped();
                log.debug("Dropped line from {}: {}", username, e.getMessage());
                continue;
            }

            envelope.setFrom(username);
            envelope.setTimestamp(now());

            switch (envelope.getType()) {
                case MSG, TYPING, STOP_TYPING -> dispatcher.broadcast(envelope);
                case PM -> dispatcher.sendDirected(envelope.getTo(), envelope);
                case LEAVE -> {
                    log.debug("{} sent leave", username);
                    return;
                }
                default -> log.debug("Ignoring {} from {}", envelope.getType(), username);
            }
        }
    }

    private void reject(String reason) {
        metrics.recordHandshakeRejected();
        log.warn("Connection {} rejected: {}", connectionId, reason);
        try {
            channel.send(codec.encode(Envelope.system(INVALID_JOIN, now())));
        } catch (IOException e) {
            log.debug("Could not notify rejected connection {}: {}", connectionId, e.getMessage());
        }
    }

    private void close() {
        state = ConnectionState.CLOSED;

        String name = username;
        if (name != null && registry.unregister(name)) {
            log.info("{} disconnected", name);
            dispatcher.broadcast(Envelope.presence(EnvelopeType.LEAVE, name, name + " left", now()));
        }

        try {
            transport.close();
        } catch (IOException e) {
            log.debug("Error closing connection {}: {}", connectionId, e.getMessage());
        }
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    public ConnectionState getState() {
        return state;
    }

    public String getUsername() {
        return username;
    }
}
