package com.example.presence.live.commentary;

/**
 * Where an engine sends what it generated.
 */
@FunctionalInterface
public interface CommentaryPublisher {

    void publish(String eventId, ChatEntry entry);
}
