package com.example.presence.live.session;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Live state of one participant in one event. Survives a dropped connection for the grace
 * period so a reconnect is not announced as a new join.
 */
@Value
@Builder(toBuilder = true)
public class LiveRecord {
    Participant participant;
    Double latitude;
    Double longitude;
    boolean sharing;
    int liveConnections;
    Instant joinedAt;
    /** Set when the last connection dropped; null while connected. */
    Instant droppedAt;

    public boolean hasLocation() {
        return latitude != null && longitude != null;
    }
}
