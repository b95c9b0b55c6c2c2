package com.example.presence.live.protocol.inbound;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InboundMessageDecoderTest {

    private final InboundMessageDecoder decoder = new InboundMessageDecoder(new ObjectMapper());

    @Test
    void shouldDecodeEveryKnownAction() {
        assertThat(decoder.decode("{\"type\":\"guest_location\",\"latitude\":51.5,\"longitude\":-0.12}"))
                .isEqualTo(new GuestLocationMessage(51.5, -0.12));
        assertThat(decoder.decode("{\"type\":\"guest_stop_sharing\"}")).isInstanceOf(StopSharingMessage.class);
        assertThat(decoder.decode("{\"type\":\"chat_message\",\"text\":\"hello\"}"))
                .isEqualTo(new ChatSendMessage("hello"));
        assertThat(decoder.decode("{\"type\":\"guest_leave\"}")).isInstanceOf(LeaveMessage.class);
    }

    @Test
    void pingShouldBeTheLivenessProbe() {
        assertThat(decoder.decode("ping")).isSameAs(LivenessProbe.INSTANCE);
    }

    @Test
    void extraFieldsShouldBeTolerated() {
        assertThat(decoder.decode("{\"type\":\"chat_message\",\"text\":\"hi\",\"client_ts\":123}"))
                .isEqualTo(new ChatSendMessage("hi"));
    }

    @Test
    void unknownOrMalformedFramesShouldDecodeToUnknown() {
        assertThat(decoder.decode("{\"type\":\"dance\"}")).isInstanceOf(UnknownMessage.class);
        assertThat(decoder.decode("{\"latitude\":1}")).isInstanceOf(UnknownMessage.class);
        assertThat(decoder.decode("not json")).isInstanceOf(UnknownMessage.class);
        assertThat(decoder.decode("[1,2]")).isInstanceOf(UnknownMessage.class);
        assertThat(decoder.decode("")).isInstanceOf(UnknownMessage.class);
    }

    @Test
    void missingCoordinatesShouldStillDecode() {
        assertThat(decoder.decode("{\"type\":\"guest_location\",\"latitude\":51.5}"))
                .isEqualTo(new GuestLocationMessage(51.5, null));
    }
}
