package com.chatrelay.client;

import com.chatrelay.client.model.Envelope;

/**
 * Callbacks from the {@link RelayClient} receive thread.
 */
public interface EnvelopeListener {

    void onEnvelope(Envelope envelope);

    /**
     * Called once when the receive loop ends.
     *
     * @param cause the read failure, or null for a requested disconnect or a clean close by the server
     */
    void onDisconnected(Exception cause);
}
