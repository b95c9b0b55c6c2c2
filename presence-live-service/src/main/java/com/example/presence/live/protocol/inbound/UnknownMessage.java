package com.example.presence.live.protocol.inbound;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Anything we can't decode: a newer client's message type, or text that isn't JSON at all.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UnknownMessage() implements InboundMessage {

    public static final UnknownMessage INSTANCE = new UnknownMessage();
}
