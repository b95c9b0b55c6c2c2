package com.example.presence.live.protocol.outbound;

import com.example.presence.shared.util.Constants;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Snapshot of everyone currently sharing a location, sent once to a connection that just joined.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class InitialStateMessage {
    String eventId;
    List<AttendeeView> attendees;

    public String getType() {
        return Constants.MessageTypes.INITIAL_STATE;
    }
}
