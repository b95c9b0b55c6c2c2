package com.example.presence.live.commentary;

import com.example.presence.shared.util.Constants.SenderKind;

/**
 * Input to a commentary engine. Each variant carries just enough to decide whether to react and
 * to phrase the reaction.
 */
public interface DomainEvent {

    record Joined(String name) implements DomainEvent {}

    record Left(String name) implements DomainEvent {}

    record Chat(String sender, String text, SenderKind senderKind) implements DomainEvent {}

    record LocationUpdate(String name, boolean arrived) implements DomainEvent {}

    /** Synthesized by the engine after a quiet period. */
    record IdleTick() implements DomainEvent {}
}
