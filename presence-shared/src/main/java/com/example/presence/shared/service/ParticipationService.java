package com.example.presence.shared.service;

import java.util.List;

public interface ParticipationService {

    /** True when the user created the event or was invited to it. */
    boolean isParticipant(String userId, String eventId);

    /** Every authenticated participant of the event, host included. */
    List<String> getParticipantIds(String eventId);
}
