package com.example.presence.shared.model;

import lombok.Builder;
import lombok.Value;

/**
 * Venue and host metadata for a live event, as known to the event store.
 */
@Value
@Builder(toBuilder = true)
public class EventContext {
    String eventId;
    String venueName;
    String venueAddress;
    double latitude;
    double longitude;
    String hostName;
    String message;
}
