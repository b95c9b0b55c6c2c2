package com.example.presence.live.protocol.outbound;

import com.example.presence.shared.util.Constants;
import com.example.presence.shared.util.Constants.ParticipantKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LocationSharedMessage {
    String eventId;
    String participantId;
    ParticipantKind kind;
    String displayName;
    double latitude;
    double longitude;

    public String getType() {
        return Constants.MessageTypes.GUEST_LOCATION_SHARED;
    }
}
