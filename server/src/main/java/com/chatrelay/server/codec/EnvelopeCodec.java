package com.chatrelay.server.codec;

import com.chatrelay.server.model.Envelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Converts between one line of JSON text and an {@link Envelope}.
 * Encoded lines carry no trailing newline; framing is the channel's job.
 */
@Component
public class EnvelopeCodec {

    private final ObjectMapper objectMapper;

    public EnvelopeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(Envelope envelope) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Envelope could not be encoded: " + e.getMessage(), e);
        }
    }

    public Envelope decode(String line) throws EnvelopeDecodeException {
        if (line == null || line.isBlank()) {
            throw new EnvelopeDecodeException("Empty line");
        }

        Envelope envelope;
        try {
            envelope = objectMapper.readValue(line, Envelope.class);
        } catch (JsonProcessingException e) {
            throw new EnvelopeDecodeException("Invalid envelope: " + e.getOriginalMessage(), e);
        }

        if (envelope == null) {
            throw new EnvelopeDecodeException("Envelope is null");
        }
        if (envelope.getType() == null) {
            throw new EnvelopeDecodeException("Envelope has no Type");
        }
        return envelope;
    }
}
