package com.example.presence.shared.model;

import com.example.presence.shared.util.Constants.ParticipantKind;
import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

@Value
@Builder(toBuilder = true)
public class AttendeeLocation {
    String eventId;
    ParticipantKind kind;
    String participantId;
    String displayName;
    Double latitude;
    Double longitude;
    boolean sharing;
    OffsetDateTime updatedAt;
}
