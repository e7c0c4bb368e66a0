package com.chatrelay.client.console;

import com.chatrelay.client.model.Envelope;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Who is online and who is typing, rebuilt from presence and typing envelopes.
 * The server sends a join per already-online user right after the handshake,
 * so no separate roster message is needed.
 */
public class Roster {

    private final Set<String> online = new LinkedHashSet<>();
    private final Set<String> typing = new LinkedHashSet<>();

    /**
     * @return true if the envelope changed the roster
     */
    public synchronized boolean apply(Envelope envelope) {
        String user = envelope.getFrom();
        if (user == null) {
            return false;
        }
        switch (envelope.getType()) {
            case JOIN:
                return online.add(user);
            case LEAVE:
                typing.remove(user);
                return online.remove(user);
            case TYPING:
                return typing.add(user);
            case STOP_TYPING:
                return typing.remove(user);
            case MSG:
            case PM:
                // a sent message ends that user's typing indicator
                return typing.remove(user);
            default:
                return false;
        }
    }

    public synchronized List<String> getOnline() {
        return new ArrayList<>(online);
    }

    public synchronized List<String> getTyping() {
        return new ArrayList<>(typing);
    }

    public synchronized boolean isTyping(String user) {
        return typing.contains(user);
    }

    public synchronized void clear() {
        online.clear();
        typing.clear();
    }
}
