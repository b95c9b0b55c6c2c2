package com.example.presence.live.transport;

import com.example.presence.shared.exception.HandshakeRejectedException;
import com.example.presence.shared.util.Constants;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.socket.HandshakeInfo;
import reactor.core.publisher.Mono;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HandshakeRequestTest {

    private static HandshakeInfo handshake(String uri, HttpHeaders headers) {
        return new HandshakeInfo(URI.create(uri), headers, Mono.empty(), null);
    }

    @Test
    void bearerHeaderShouldIdentifyAMember() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth("token-alice");

        HandshakeRequest request = HandshakeRequest.from(handshake("ws://host/ws/events/event-100", headers));

        assertThat(request.eventId()).isEqualTo("event-100");
        assertThat(request.token()).isEqualTo("token-alice");
        assertThat(request.isMember()).isTrue();
    }

    @Test
    void tokenQueryParameterShouldBeAcceptedWhenNoHeaderIsSent() {
        HandshakeRequest request = HandshakeRequest.from(
                handshake("ws://host/ws/events/event-100?token=token-bob", new HttpHeaders()));

        assertThat(request.token()).isEqualTo("token-bob");
    }

    @Test
    void headerShouldWinOverQueryParameter() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth("from-header");

        HandshakeRequest request = HandshakeRequest.from(
                handshake("ws://host/ws/events/event-100?token=from-query", headers));

        assertThat(request.token()).isEqualTo("from-header");
    }

    @Test
    void guestParametersShouldBeDecoded() {
        HandshakeRequest request = HandshakeRequest.from(
                handshake("ws://host/ws/events/event-100?guest_id=g-1&name=Zo%C3%AB%20B", new HttpHeaders()));

        assertThat(request.isMember()).isFalse();
        assertThat(request.guestId()).isEqualTo("g-1");
        assertThat(request.guestName()).isEqualTo("Zoë B");
    }

    @Test
    void guestWithoutNameShouldBeRejected() {
        assertThatThrownBy(() -> HandshakeRequest.from(
                handshake("ws://host/ws/events/event-100?guest_id=g-1", new HttpHeaders())))
                .isInstanceOf(HandshakeRejectedException.class)
                .extracting(e -> ((HandshakeRejectedException) e).getCloseCode())
                .isEqualTo(Constants.CloseCodes.BAD_HANDSHAKE);
    }

    @Test
    void bearerTokenShouldIgnoreOtherSchemes() {
        HttpHeaders basic = new HttpHeaders();
        basic.setBasicAuth("user", "pass");
        HttpHeaders empty = new HttpHeaders();
        empty.set(HttpHeaders.AUTHORIZATION, "Bearer   ");

        assertThat(HandshakeRequest.bearerToken(basic)).isNull();
        assertThat(HandshakeRequest.bearerToken(empty)).isNull();
        assertThat(HandshakeRequest.bearerToken(new HttpHeaders())).isNull();
    }
}
