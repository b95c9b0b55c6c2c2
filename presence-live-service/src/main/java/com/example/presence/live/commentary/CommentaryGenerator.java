package com.example.presence.live.commentary;

import reactor.core.publisher.Mono;

/**
 * External text generation. An empty result or an error means "say nothing".
 */
public interface CommentaryGenerator {

    boolean isEnabled();

    Mono<String> generate(CommentaryPrompt prompt);
}
