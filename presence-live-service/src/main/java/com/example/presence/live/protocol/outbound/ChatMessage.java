package com.example.presence.live.protocol.outbound;

import com.example.presence.shared.util.Constants;
import com.example.presence.shared.util.Constants.SenderKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ChatMessage {
    String eventId;
    String senderId;
    String sender;
    SenderKind senderKind;
    String text;
    @JsonProperty("is_commentary")
    boolean commentary;
    /** Epoch milliseconds. */
    long timestamp;

    public String getType() {
        return Constants.MessageTypes.CHAT_MESSAGE;
    }
}
