package com.example.presence.live.commentary;

public class CommentaryGenerationException extends RuntimeException {
    public CommentaryGenerationException(String message) {
        super(message);
    }
}
