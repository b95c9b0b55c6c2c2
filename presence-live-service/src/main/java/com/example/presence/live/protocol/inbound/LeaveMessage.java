package com.example.presence.live.protocol.inbound;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LeaveMessage() implements InboundMessage {
}
