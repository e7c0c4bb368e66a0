package com.chatrelay.client;

import com.chatrelay.client.model.EnvelopeType;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Client-side debounce for typing indicators: the first keystroke sends
 * {@code typing}, and {@code stop_typing} follows once input has been idle
 * for the configured period. The server only relays both signals.
 */
@Slf4j
public class TypingNotifier {

    public static final long DEFAULT_IDLE_MILLIS = 2000;

    private final Consumer<EnvelopeType> signalSink;
    private final ScheduledExecutorService scheduler;
    private final long idleMillis;

    private boolean typing;
    private long generation;
    private ScheduledFuture<?> pendingStop;

    public TypingNotifier(Consumer<EnvelopeType> signalSink, ScheduledExecutorService scheduler, long idleMillis) {
        this.signalSink = signalSink;
        this.scheduler = scheduler;
        this.idleMillis = idleMillis;
    }

    public synchronized void onInput() {
        if (!typing) {
            typing = true;
            signalSink.accept(EnvelopeType.TYPING);
        }
        if (pendingStop != null) {
            pendingStop.cancel(false);
        }
        long scheduled = ++generation;
        pendingStop = scheduler.schedule(() -> idle(scheduled), idleMillis, TimeUnit.MILLISECONDS);
    }

    /**
     * Ends the typing state immediately, for example when the line is sent.
     */
    public synchronized void reset() {
        generation++;
        if (pendingStop != null) {
            pendingStop.cancel(false);
            pendingStop = null;
        }
        if (typing) {
            typing = false;
            signalSink.accept(EnvelopeType.STOP_TYPING);
        }
    }

    private synchronized void idle(long scheduled) {
        // superseded by later input or a reset
        if (scheduled != generation) {
            return;
        }
        pendingStop = null;
        if (typing) {
            typing = false;
            log.debug("Input idle for {} ms", idleMillis);
            signalSink.accept(EnvelopeType.STOP_TYPING);
        }
    }

    public synchronized boolean isTyping() {
        return typing;
    }
}
