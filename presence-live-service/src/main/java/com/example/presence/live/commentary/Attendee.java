package com.example.presence.live.commentary;

import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * An engine's view of one person currently connected to the event.
 */
@Value
@With
public class Attendee {
    String id;
    String displayName;
    Double lastLatitude;
    Double lastLongitude;
    Instant lastSeen;
}
