package com.chatrelay.server.listener;

import com.chatrelay.server.codec.EnvelopeCodec;
import com.chatrelay.server.model.Envelope;
import com.chatrelay.server.model.EnvelopeType;
import com.chatrelay.server.service.SessionRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "relay.port=0")
class RelayServerIntegrationTest {

    @Autowired
    private RelayListener listener;

    @Autowired
    private SessionRegistry registry;

    @Autowired
    private EnvelopeCodec codec;

    @Test
    void listenerIsAcceptingOnEphemeralPort() {
        assertThat(listener.isAccepting()).isTrue();
        assertThat(listener.getLocalPort()).isPositive();
    }

    @Test
    void duplicateUsernameIsSuffixedAndPresenceIsExchanged() throws Exception {
        try (LineClient a = new LineClient(listener.getLocalPort(), codec);
             LineClient b = new LineClient(listener.getLocalPort(), codec)) {
            a.join("ann");
            a.readUntil(EnvelopeType.JOIN, "ann");

            b.join("ann");
            Envelope backlog = b.readUntil(EnvelopeType.JOIN, "ann");
            assertThat(backlog.getText()).isEqualTo("ann (already online)");

            Envelope ownJoin = b.readUntil(EnvelopeType.JOIN, "ann1");
            assertThat(ownJoin.getText()).isEqualTo("ann1 joined");

            Envelope announced = a.readUntil(EnvelopeType.JOIN, "ann1");
            assertThat(announced.getText()).isEqualTo("ann1 joined");
            assertThat(registry.lookup("ann1")).isPresent();
        }
    }

    @Test
    void messageIsRestampedAndBroadcastToEveryone() throws Exception {
        try (LineClient a = new LineClient(listener.getLocalPort(), codec);
             LineClient b = new LineClient(listener.getLocalPort(), codec)) {
            a.join("bella");
            a.readUntil(EnvelopeType.JOIN, "bella");
            b.join("boris");
            b.readUntil(EnvelopeType.JOIN, "boris");

            long before = Instant.now().getEpochSecond();
            a.send("{\"Type\":\"msg\",\"From\":\"someone-else\",\"Text\":\"hi bella\",\"Ts\":12}");

            Envelope atB = b.readUntil(e -> e.getType() == EnvelopeType.MSG && "hi bella".equals(e.getText()));
            assertThat(atB.getFrom()).isEqualTo("bella");
            assertThat(atB.getTimestamp()).isGreaterThanOrEqualTo(before);

            Envelope atA = a.readUntil(e -> e.getType() == EnvelopeType.MSG && "hi bella".equals(e.getText()));
            assertThat(atA.getFrom()).isEqualTo("bella");
        }
    }

    @Test
    void privateMessageToUnknownUserReturnsNotice() throws Exception {
        try (LineClient a = new LineClient(listener.getLocalPort(), codec)) {
            a.join("cleo");
            a.readUntil(EnvelopeType.JOIN, "cleo");

            a.send("{\"Type\":\"pm\",\"To\":\"carol\",\"Text\":\"hey\"}");

            Envelope notice = a.readUntil(e -> e.getType() == EnvelopeType.SYS);
            assertThat(notice.getText()).isEqualTo("User 'carol' not found");
        }
    }

    @Test
    void invalidHandshakeIsRejectedAndClosed() throws Exception {
        try (LineClient a = new LineClient(listener.getLocalPort(), codec)) {
            a.send("{\"Type\":\"msg\",\"Text\":\"no join\"}");

            Envelope notice = a.read();
            assertThat(notice.getType()).isEqualTo(EnvelopeType.SYS);
            assertThat(notice.getText()).isEqualTo("Invalid join");
            assertThat(a.readLine()).isNull();
        }
    }

    @Test
    void ordinalJoinTypeIsRejected() throws Exception {
        try (LineClient a = new LineClient(listener.getLocalPort(), codec)) {
            a.send("{\"Type\":0,\"From\":\"bob\"}");

            Envelope notice = a.read();
            assertThat(notice.getType()).isEqualTo(EnvelopeType.SYS);
            assertThat(notice.getText()).isEqualTo("Invalid join");
            assertThat(a.readLine()).isNull();
        }
    }

    @Test
    void abruptDisconnectBroadcastsLeaveOnce() throws Exception {
        try (LineClient a = new LineClient(listener.getLocalPort(), codec)) {
            a.join("dora");
            a.readUntil(EnvelopeType.JOIN, "dora");

            LineClient b = new LineClient(listener.getLocalPort(), codec);
            b.join("dexter");
            b.readUntil(EnvelopeType.JOIN, "dexter");
            a.readUntil(EnvelopeType.JOIN, "dexter");

            b.close();

            a.readUntil(EnvelopeType.LEAVE, "dexter");
            assertThat(registry.lookup("dexter")).isEmpty();

            a.send("{\"Type\":\"msg\",\"Text\":\"dora still here\"}");
            List<Envelope> inBetween = new ArrayList<>();
            a.readUntil(e -> e.getType() == EnvelopeType.MSG && "dora still here".equals(e.getText()), inBetween);
            assertThat(inBetween)
                    .noneMatch(e -> e.getType() == EnvelopeType.LEAVE && "dexter".equals(e.getFrom()));
        }
    }
}
