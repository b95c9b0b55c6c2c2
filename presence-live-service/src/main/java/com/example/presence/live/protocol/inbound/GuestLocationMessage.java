package com.example.presence.live.protocol.inbound;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GuestLocationMessage(Double latitude, Double longitude) implements InboundMessage {
}
