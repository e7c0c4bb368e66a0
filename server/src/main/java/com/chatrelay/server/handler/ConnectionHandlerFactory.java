package com.chatrelay.server.handler;

import com.chatrelay.server.codec.EnvelopeCodec;
import com.chatrelay.server.service.ConnectionMetricsService;
import com.chatrelay.server.service.MessageDispatcher;
import com.chatrelay.server.service.SessionRegistry;
import com.chatrelay.server.session.SocketSessionChannel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * Wires an accepted socket to a new {@link ConnectionHandler}.
 */
@Component
@RequiredArgsConstructor
public class ConnectionHandlerFactory {

    private final SessionRegistry registry;
    private final MessageDispatcher dispatcher;
    private final EnvelopeCodec codec;
    private final ConnectionMetricsService metrics;
    private final Clock clock;

    public ConnectionHandler create(Socket socket) throws IOException {
        BufferedReader reader = new BufferedReader(
                new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));

        return ConnectionHandler.builder()
                .connectionId(String.valueOf(socket.getRemoteSocketAddress()))
                .reader(reader)
                .channel(new SocketSessionChannel(socket.getOutputStream()))
                .transport(socket)
                .registry(registry)
                .dispatcher(dispatcher)
                .codec(codec)
                .metrics(metrics)
                .clock(clock)
                .build();
    }
}
