package com.chatrelay.server.listener;

import com.chatrelay.server.handler.ConnectionHandler;
import com.chatrelay.server.handler.ConnectionHandlerFactory;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Accepts TCP connections and runs one {@link ConnectionHandler} per connection.
 * <p>
 * Stopping closes the server socket and ends the accept loop. Connections that
 * are already open are left to finish on their own.
 */
@Component
@Slf4j
public class RelayListener {

    private final ConnectionHandlerFactory handlerFactory;

    @Value("${relay.port:5000}")
    private int port;

    @Value("${relay.worker-thread-prefix:relay-conn-}")
    private String workerThreadPrefix;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private ServerSocket serverSocket;
    private ExecutorService connectionExecutor;
    private Thread acceptThread;

    public RelayListener(ConnectionHandlerFactory handlerFactory) {
        this.handlerFactory = handlerFactory;
    }

    @PostConstruct
    public void start() {
        try {
            serverSocket = new ServerSocket(port);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to bind relay port " + port + ": " + e.getMessage(), e);
        }

        AtomicInteger threadCount = new AtomicInteger(0);
        connectionExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, workerThreadPrefix + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        running.set(true);
        acceptThread = new Thread(this::acceptLoop, "relay-acceptor");
        acceptThread.start();

        log.info("Relay listening on port {} (Ctrl+C to stop)", serverSocket.getLocalPort());
    }

    private void acceptLoop() {
        while (running.get()) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (IOException e) {
                if (serverSocket.isClosed()) {
                    break;
                }
                log.error("Accept failed: {}", e.getMessage(), e);
                continue;
            }

            try {
                ConnectionHandler handler = handlerFactory.create(socket);
                connectionExecutor.execute(handler);
            } catch (IOException | RejectedExecutionException e) {
                log.warn("Could not start handler for {}: {}", socket.getRemoteSocketAddress(), e.getMessage());
                closeQuietly(socket);
            }
        }
        log.info("Relay accept loop stopped");
    }

    @PreDestroy
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping relay listener...");

        try {
            serverSocket.close();
        } catch (IOException e) {
            log.debug("Error closing server socket: {}", e.getMessage());
        }

        // Open connections keep running until their peers disconnect
        connectionExecutor.shutdown();

        try {
            acceptThread.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing socket {}: {}", socket.getRemoteSocketAddress(), e.getMessage());
        }
    }

    public boolean isAccepting() {
        return running.get() && serverSocket != null && !serverSocket.isClosed();
    }

    public int getLocalPort() {
        return serverSocket != null ? serverSocket.getLocalPort() : -1;
    }
}
