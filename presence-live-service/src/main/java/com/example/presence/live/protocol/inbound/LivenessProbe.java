package com.example.presence.live.protocol.inbound;

/**
 * The bare {@code ping} text frame. Answered by the session and never broadcast.
 */
public record LivenessProbe() implements InboundMessage {

    public static final LivenessProbe INSTANCE = new LivenessProbe();
}
