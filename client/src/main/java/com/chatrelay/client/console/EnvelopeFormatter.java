package com.chatrelay.client.console;

import com.chatrelay.client.model.Envelope;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Renders received envelopes as console lines.
 */
public class EnvelopeFormatter {

    private final DateTimeFormatter timeFormat;

    public EnvelopeFormatter(ZoneId zone) {
        this.timeFormat = DateTimeFormatter.ofPattern("HH:mm:ss").withZone(zone);
    }

    /**
     * @return the line to print, or null if the envelope has no visible form
     */
    public String format(Envelope envelope) {
        String when = "[" + timeFormat.format(Instant.ofEpochSecond(envelope.getTimestamp())) + "]";
        switch (envelope.getType()) {
            case JOIN:
                return when + " * " + envelope.getFrom() + " joined";
            case LEAVE:
                return when + " * " + envelope.getFrom() + " left";
            case MSG:
                return when + " " + envelope.getFrom() + ": " + envelope.getText();
            case PM:
                return when + " (PM) " + envelope.getFrom() + " -> " + envelope.getTo() + ": " + envelope.getText();
            case SYS:
                return when + " [system] " + envelope.getText();
            case TYPING:
                return when + " * " + envelope.getFrom() + " is typing...";
            default:
                return null;
        }
    }
}
