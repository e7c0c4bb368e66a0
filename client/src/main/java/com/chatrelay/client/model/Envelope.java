package com.chatrelay.client.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Envelope {

    @JsonProperty("Type")
    private EnvelopeType type;

    @JsonProperty("From")
    private String from;  // overwritten by the server

    @JsonProperty("To")
    private String to;

    @JsonProperty("Text")
    private String text;

    @JsonProperty("Ts")
    private long timestamp;  // unix seconds, re-stamped by the server

    public static Envelope outbound(EnvelopeType type, String from, String to, String text) {
        return new Envelope(type, from, to, text, Instant.now().getEpochSecond());
    }

    @JsonIgnore
    public boolean isTypingSignal() {
        return type == EnvelopeType.TYPING || type == EnvelopeType.STOP_TYPING;
    }
}
