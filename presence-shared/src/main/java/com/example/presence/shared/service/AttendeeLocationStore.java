package com.example.presence.shared.service;

import com.example.presence.shared.model.AttendeeLocation;
import com.example.presence.shared.util.Constants.ParticipantKind;

/**
 * Durable record of attendee locations, keyed by event and participant.
 */
public interface AttendeeLocationStore {

    void upsert(AttendeeLocation location);

    void delete(String eventId, ParticipantKind kind, String participantId);
}
