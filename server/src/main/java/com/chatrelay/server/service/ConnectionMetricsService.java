package com.chatrelay.server.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Service
public class ConnectionMetricsService {

    private final AtomicInteger activeConnections = new AtomicInteger(0);
    private final AtomicLong totalConnections = new AtomicLong(0);
    private final AtomicLong handshakesRejected = new AtomicLong(0);
    private final AtomicLong linesDropped = new AtomicLong(0);

    public void incrementConnections() {
        totalConnections.incrementAndGet();
        int count = activeConnections.incrementAndGet();
        log.debug(">>> Connection added. Total: {}", count);
    }

    public void decrementConnections() {
        int count = activeConnections.decrementAndGet();
        log.debug("<<< Connection removed. Total: {}", count);
    }

    public void recordHandshakeRejected() {
        handshakesRejected.incrementAndGet();
    }

    public void recordLineDropped() {
        linesDropped.incrementAndGet();
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }

    public long getTotalConnections() {
        return totalConnections.get();
    }

    public long getHandshakesRejected() {
        return handshakesRejected.get();
    }

    public long getLinesDropped() {
        return linesDropped.get();
    }
}
