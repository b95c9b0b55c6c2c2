package com.example.presence.shared.exception;

import lombok.Getter;

/**
 * Raised while accepting a live connection. The close code is sent back to the client in the
 * WebSocket close frame; no session state exists when this is thrown.
 */
@Getter
public class HandshakeRejectedException extends RuntimeException {

    private final int closeCode;

    public HandshakeRejectedException(int closeCode, String reason) {
        super(reason);
        this.closeCode = closeCode;
    }
}
