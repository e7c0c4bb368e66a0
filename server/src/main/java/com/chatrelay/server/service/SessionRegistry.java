package com.chatrelay.server.service;

import com.chatrelay.server.session.Session;
import com.chatrelay.server.session.SessionChannel;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Username to session mapping shared by every connection.
 * <p>
 * All reads and mutations of the map happen under one lock. The lock is never
 * held while writing to a session: callers take a {@link #snapshot()} and do
 * their I/O against the copy.
 */
@Service
@Slf4j
public class SessionRegistry {

    private final Map<String, Session> sessions = new LinkedHashMap<>();
    private final Lock lock = new ReentrantLock();
    private final Clock clock;

    public SessionRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Register a session under {@code candidateName}, or under the first free
     * {@code candidateName + n} (n = 1, 2, ...) if the name is taken.
     *
     * @return the final username plus the usernames that were online just before
     * @throws IllegalArgumentException if the candidate name is blank
     */
    public Registration register(String candidateName, SessionChannel channel) {
        if (candidateName == null || candidateName.isBlank()) {
            throw new IllegalArgumentException("username must not be blank");
        }
        Objects.requireNonNull(channel, "channel");

        Registration registration;
        lock.lock();
        try {
            String username = candidateName;
            int suffix = 1;
            while (sessions.containsKey(username)) {
                username = candidateName + suffix++;
            }

            List<String> alreadyOnline = new ArrayList<>(sessions.keySet());
            Session session = new Session(username, channel, clock.instant());
            sessions.put(username, session);
            registration = new Registration(session, alreadyOnline);
        } finally {
            lock.unlock();
        }

        if (!registration.getUsername().equals(candidateName)) {
            log.info("Username '{}' taken, registered as '{}'", candidateName, registration.getUsername());
        }
        log.debug("Registered session {}", registration.getUsername());
        return registration;
    }

    /**
     * Remove a session. Removing an absent name is a no-op.
     *
     * @return true if a session was removed
     */
    public boolean unregister(String username) {
        Session removed;
        lock.lock();
        try {
            removed = sessions.remove(username);
        } finally {
            lock.unlock();
        }

        if (removed != null) {
            log.debug("Unregistered session {}", username);
        }
        return removed != null;
    }

    public Optional<Session> lookup(String username) {
        if (username == null) {
            return Optional.empty();
        }
        lock.lock();
        try {
            return Optional.ofNullable(sessions.get(username));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Point-in-time copy of all sessions in registration order.
     */
    public List<Session> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(sessions.values());
        } finally {
            lock.unlock();
        }
    }

    public List<String> usernames() {
        lock.lock();
        try {
            return new ArrayList<>(sessions.keySet());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return sessions.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Outcome of a successful {@link #register} call.
     */
    @Data
    public static class Registration {
        private final Session session;
        private final List<String> alreadyOnline;

        public String getUsername() {
            return session.getUsername();
        }
    }
}
