package com.example.presence.live.protocol.outbound;

import com.example.presence.shared.util.Constants.ParticipantKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * {@code guest_joined}, {@code guest_left} and {@code guest_location_stopped}: the notices that
 * only say who changed.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PresenceNotice {
    String type;
    String eventId;
    String participantId;
    ParticipantKind kind;
    String displayName;
}
