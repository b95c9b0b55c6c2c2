package com.example.presence.live.commentary;

import com.example.presence.shared.util.Constants.SenderKind;

import java.time.Instant;

public record ChatEntry(String senderId,
                        String sender,
                        SenderKind senderKind,
                        String text,
                        boolean commentary,
                        Instant timestamp) {
}
