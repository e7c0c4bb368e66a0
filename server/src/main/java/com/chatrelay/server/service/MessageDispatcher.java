package com.chatrelay.server.service;

import com.chatrelay.server.codec.EnvelopeCodec;
import com.chatrelay.server.model.Envelope;
import com.chatrelay.server.session.Session;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Routes envelopes to live sessions.
 * <p>
 * Writes are best-effort: a failed write is logged and counted, never retried
 * and never reported to the sender. The failing session's own read loop
 * notices the broken connection and unregisters it.
 */
@Service
@Slf4j
public class MessageDispatcher {

    private final SessionRegistry registry;
    private final EnvelopeCodec codec;
    private final Clock clock;

    private final AtomicLong messagesBroadcast = new AtomicLong(0);
    private final AtomicLong broadcastFailures = new AtomicLong(0);
    private final AtomicLong directDeliveries = new AtomicLong(0);
    private final AtomicLong targetsNotFound = new AtomicLong(0);

    public MessageDispatcher(SessionRegistry registry, EnvelopeCodec codec, Clock clock) {
        this.registry = registry;
        this.codec = codec;
        this.clock = clock;
    }

    /**
     * Deliver an envelope to every session registered at the time of the call.
     */
    public BroadcastResult broadcast(Envelope envelope) {
        String line = codec.encode(envelope);
        List<Session> recipients = registry.snapshot();

        int successCount = 0;
        int failureCount = 0;
        List<String> failedUsernames = new ArrayList<>();

        for (Session session : recipients) {
            if (write(session, line)) {
                successCount++;
                messagesBroadcast.incrementAndGet();
            } else {
                failureCount++;
                failedUsernames.add(session.getUsername());
                broadcastFailures.incrementAndGet();
            }
        }

        log.debug("Broadcast {} from {}: success={}, failures={}",
                envelope.getType(), envelope.getFrom(), successCount, failureCount);
        return new BroadcastResult(successCount, failureCount, failedUsernames);
    }

    /**
     * Deliver an envelope to one named session. If the target is not online the
     * sender (the envelope's {@code from}) gets a system notice instead.
     */
    public DirectedResult sendDirected(String toName, Envelope envelope) {
        if (toName == null || toName.isBlank()) {
            return DirectedResult.IGNORED;
        }

        Optional<Session> target = registry.lookup(toName);
        if (target.isPresent()) {
            if (write(target.get(), codec.encode(envelope))) {
                directDeliveries.incrementAndGet();
                return DirectedResult.DELIVERED;
            }
            return DirectedResult.FAILED;
        }

        Optional<Session> sender = registry.lookup(envelope.getFrom());
        if (sender.isEmpty()) {
            log.debug("Dropping pm from {} to {}: neither session is online", envelope.getFrom(), toName);
            return DirectedResult.DROPPED;
        }

        targetsNotFound.incrementAndGet();
        Envelope notice = Envelope.system("User '" + toName + "' not found", clock.instant().getEpochSecond());
        write(sender.get(), codec.encode(notice));
        return DirectedResult.TARGET_NOT_FOUND;
    }

    /**
     * Single best-effort write to one session.
     */
    public boolean sendTo(Session session, Envelope envelope) {
        return write(session, codec.encode(envelope));
    }

    private boolean write(Session session, String line) {
        try {
            session.getChannel().send(line);
            return true;
        } catch (Exception e) {
            log.warn("Write to session {} failed: {}", session.getUsername(), e.getMessage());
            return false;
        }
    }

    public long getMessagesBroadcast() {
        return messagesBroadcast.get();
    }

    public long getBroadcastFailures() {
        return broadcastFailures.get();
    }

    public long getDirectDeliveries() {
        return directDeliveries.get();
    }

    public long getTargetsNotFound() {
        return targetsNotFound.get();
    }

    /**
     * Per-call outcome of {@link #broadcast(Envelope)}.
     */
    @Data
    public static class BroadcastResult {
        private final int successCount;
        private final int failureCount;
        private final List<String> failedUsernames;
    }

    public enum DirectedResult {
        DELIVERED,
        FAILED,
        TARGET_NOT_FOUND,
        DROPPED,
        IGNORED
    }
}
