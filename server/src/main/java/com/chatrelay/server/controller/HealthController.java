package com.chatrelay.server.controller;

import com.chatrelay.server.listener.RelayListener;
import com.chatrelay.server.service.ConnectionMetricsService;
import com.chatrelay.server.service.MessageDispatcher;
import com.chatrelay.server.service.SessionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
@Slf4j
public class HealthController {

    @Autowired
    private RelayListener relayListener;

    @Autowired
    private SessionRegistry sessionRegistry;

    @Autowired
    private MessageDispatcher dispatcher;

    @Autowired
    private ConnectionMetricsService connectionMetrics;

    /**
     * Liveness of the relay listener.
     *
     * @return 200 while the listener accepts connections, 503 otherwise
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("timestamp", System.currentTimeMillis());
        health.put("relayPort", relayListener.getLocalPort());
        health.put("activeSessions", sessionRegistry.size());

        boolean accepting = relayListener.isAccepting();
        health.put("status", accepting ? "UP" : "DOWN");

        if (!accepting) {
            log.warn("Health check: relay listener is not accepting connections");
            return ResponseEntity.status(503).body(health);
        }
        return ResponseEntity.ok(health);
    }

    @GetMapping("/metrics")
    public ResponseEntity<Map<String, Object>> metrics() {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("timestamp", System.currentTimeMillis());

        Map<String, Object> sessionMetrics = new HashMap<>();
        sessionMetrics.put("activeSessions", sessionRegistry.size());
        sessionMetrics.put("usernames", sessionRegistry.usernames());
        metrics.put("sessions", sessionMetrics);

        Map<String, Object> connections = new HashMap<>();
        connections.put("active", connectionMetrics.getActiveConnections());
        connections.put("total", connectionMetrics.getTotalConnections());
        connections.put("handshakesRejected", connectionMetrics.getHandshakesRejected());
        connections.put("linesDropped", connectionMetrics.getLinesDropped());
        metrics.put("connections", connections);

        Map<String, Object> dispatch = new HashMap<>();
        dispatch.put("messagesBroadcast", dispatcher.getMessagesBroadcast());
        dispatch.put("broadcastFailures", dispatcher.getBroadcastFailures());
        dispatch.put("directDeliveries", dispatcher.getDirectDeliveries());
        dispatch.put("targetsNotFound", dispatcher.getTargetsNotFound());
        metrics.put("dispatcher", dispatch);

        return ResponseEntity.ok(metrics);
    }
}
