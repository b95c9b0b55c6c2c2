package com.example.presence.live.session;

public enum SessionState {
    CONNECTING,
    ACTIVE,
    /** Terminal: the participant said goodbye. */
    EXPLICIT_LEAVE,
    /** Terminal: the transport went away without a goodbye. */
    DROPPED
}
