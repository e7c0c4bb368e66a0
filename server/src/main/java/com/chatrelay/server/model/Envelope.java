package com.chatrelay.server.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One routed protocol message. Serialized as a single JSON line.
 */
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
    private String from;

    @JsonProperty("To")
    private String to;  // pm only

    @JsonProperty("Text")
    private String text;

    @JsonProperty("Ts")
    private long timestamp;  // unix seconds

    public static Envelope presence(EnvelopeType type, String username, String text, long timestamp) {
        return Envelope.builder()
                .type(type)
                .from(username)
                .text(text)
                .timestamp(timestamp)
                .build();
    }

    public static Envelope system(String text, long timestamp) {
        return Envelope.builder()
                .type(EnvelopeType.SYS)
                .text(text)
                .timestamp(timestamp)
                .build();
    }
}
