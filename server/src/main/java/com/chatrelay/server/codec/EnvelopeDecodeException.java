package com.chatrelay.server.codec;

/**
 * Raised when a line cannot be turned into an {@link com.chatrelay.server.model.Envelope}.
 * Callers in the read loop drop the line and keep the connection open.
 */
public class EnvelopeDecodeException extends Exception {

    public EnvelopeDecodeException(String message) {
        super(message);
    }

    public EnvelopeDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
