package com.example.presence.live.protocol.inbound;

import com.example.presence.shared.util.Constants;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Client-to-server actions on an event connection. Unknown {@code type} values decode to
 * {@link UnknownMessage} and are ignored by the session.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type", defaultImpl = UnknownMessage.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = GuestLocationMessage.class, name = Constants.MessageTypes.GUEST_LOCATION),
        @JsonSubTypes.Type(value = StopSharingMessage.class, name = Constants.MessageTypes.GUEST_STOP_SHARING),
        @JsonSubTypes.Type(value = ChatSendMessage.class, name = Constants.MessageTypes.CHAT_MESSAGE),
        @JsonSubTypes.Type(value = LeaveMessage.class, name = Constants.MessageTypes.GUEST_LEAVE)
})
public interface InboundMessage {
}
