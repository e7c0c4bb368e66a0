package com.chatrelay.server.codec;

import com.chatrelay.server.model.Envelope;
import com.chatrelay.server.model.EnvelopeType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvelopeCodecTest {

    private final EnvelopeCodec codec = new EnvelopeCodec(new ObjectMapper());

    @Test
    void decodesAllWireFields() throws Exception {
        Envelope envelope = codec.decode(
                "{\"Type\":\"pm\",\"From\":\"alice\",\"To\":\"bob\",\"Text\":\"hey\",\"Ts\":1700000000}");

        assertThat(envelope.getType()).isEqualTo(EnvelopeType.PM);
        assertThat(envelope.getFrom()).isEqualTo("alice");
        assertThat(envelope.getTo()).isEqualTo("bob");
        assertThat(envelope.getText()).isEqualTo("hey");
        assertThat(envelope.getTimestamp()).isEqualTo(1700000000L);
    }

    @Test
    void decodesSnakeCaseTypingKind() throws Exception {
        assertThat(codec.decode("{\"Type\":\"stop_typing\"}").getType()).isEqualTo(EnvelopeType.STOP_TYPING);
    }

    @Test
    void ignoresUnknownFields() throws Exception {
        Envelope envelope = codec.decode("{\"Type\":\"msg\",\"Text\":\"hi\",\"Color\":\"red\",\"Meta\":{\"a\":1}}");

        assertThat(envelope.getType()).isEqualTo(EnvelopeType.MSG);
        assertThat(envelope.getText()).isEqualTo("hi");
    }

    @Test
    void rejectsUnknownType() {
        assertThatThrownBy(() -> codec.decode("{\"Type\":\"shout\",\"Text\":\"hi\"}"))
                .isInstanceOf(EnvelopeDecodeException.class);
    }

    @Test
    void rejectsOrdinalAndDigitTypes() {
        assertThatThrownBy(() -> codec.decode("{\"Type\":2,\"Text\":\"x\"}"))
                .isInstanceOf(EnvelopeDecodeException.class);
        assertThatThrownBy(() -> codec.decode("{\"Type\":\"2\",\"Text\":\"x\"}"))
                .isInstanceOf(EnvelopeDecodeException.class);
        assertThatThrownBy(() -> codec.decode("{\"Type\":0,\"From\":\"bob\"}"))
                .isInstanceOf(EnvelopeDecodeException.class);
    }

    @Test
    void rejectsWrongCaseAndNonScalarTypes() {
        assertThatThrownBy(() -> codec.decode("{\"Type\":\"MSG\",\"Text\":\"x\"}"))
                .isInstanceOf(EnvelopeDecodeException.class);
        assertThatThrownBy(() -> codec.decode("{\"Type\":{\"kind\":\"msg\"}}"))
                .isInstanceOf(EnvelopeDecodeException.class);
    }

    @Test
    void rejectsMissingType() {
        assertThatThrownBy(() -> codec.decode("{\"From\":\"alice\"}"))
                .isInstanceOf(EnvelopeDecodeException.class)
                .hasMessageContaining("Type");
    }

    @Test
    void rejectsMalformedJson() {
        assertThatThrownBy(() -> codec.decode("{\"Type\":\"msg\""))
                .isInstanceOf(EnvelopeDecodeException.class);
        assertThatThrownBy(() -> codec.decode("not json at all"))
                .isInstanceOf(EnvelopeDecodeException.class);
        assertThatThrownBy(() -> codec.decode("null"))
                .isInstanceOf(EnvelopeDecodeException.class);
        assertThatThrownBy(() -> codec.decode("   "))
                .isInstanceOf(EnvelopeDecodeException.class);
    }

    @Test
    void encodeUsesWireNamesAndOmitsAbsentFields() {
        String line = codec.encode(Envelope.system("User 'carol' not found", 42L));

        assertThat(line).isEqualTo("{\"Type\":\"sys\",\"Text\":\"User 'carol' not found\",\"Ts\":42}");
        assertThat(line).doesNotContain("\n");
    }

    @Test
    void encodedEnvelopeDecodesToEqualValue() throws Exception {
        Envelope original = Envelope.builder()
                .type(EnvelopeType.PM)
                .from("alice")
                .to("bob")
                .text("line with \"quotes\" and ünïcode")
                .timestamp(7L)
                .build();

        assertThat(codec.decode(codec.encode(original))).isEqualTo(original);
    }
}
