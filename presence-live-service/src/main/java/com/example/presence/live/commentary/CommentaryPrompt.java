package com.example.presence.live.commentary;

public record CommentaryPrompt(String system, String user) {
}
