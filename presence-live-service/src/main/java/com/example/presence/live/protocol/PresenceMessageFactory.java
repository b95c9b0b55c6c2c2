package com.example.presence.live.protocol;

import com.example.presence.live.commentary.ChatEntry;
import com.example.presence.live.protocol.outbound.AttendeeView;
import com.example.presence.live.protocol.outbound.ChatHistoryMessage;
import com.example.presence.live.protocol.outbound.ChatMessage;
import com.example.presence.live.protocol.outbound.InitialStateMessage;
import com.example.presence.live.protocol.outbound.LocationSharedMessage;
import com.example.presence.live.protocol.outbound.PresenceNotice;
import com.example.presence.live.session.LiveRecord;
import com.example.presence.live.session.Participant;
import com.example.presence.shared.util.Constants;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the client-facing messages. Every message carries the event id and the participant it is
 * about, so none depends on an earlier one having been seen.
 */
@Component
public class PresenceMessageFactory {

    public InitialStateMessage initialState(String eventId, List<LiveRecord> sharing) {
        List<AttendeeView> attendees = sharing.stream()
                .map(record -> AttendeeView.builder()
                        .participantId(record.getParticipant().id())
                        .kind(record.getParticipant().kind())
                        .displayName(record.getParticipant().displayName())
                        .latitude(record.getLatitude())
                        .longitude(record.getLongitude())
                        .build())
                .toList();
        return InitialStateMessage.builder()
                .eventId(eventId)
                .attendees(attendees)
                .build();
    }

    public PresenceNotice joined(String eventId, Participant participant) {
        return notice(Constants.MessageTypes.GUEST_JOINED, eventId, participant);
    }

    public PresenceNotice left(String eventId, Participant participant) {
        return notice(Constants.MessageTypes.GUEST_LEFT, eventId, participant);
    }

    public PresenceNotice locationStopped(String eventId, Participant participant) {
        return notice(Constants.MessageTypes.GUEST_LOCATION_STOPPED, eventId, participant);
    }

    public LocationSharedMessage locationShared(String eventId, Participant participant, double latitude, double longitude) {
        return LocationSharedMessage.builder()
                .eventId(eventId)
                .participantId(participant.id())
                .kind(participant.kind())
                .displayName(participant.displayName())
                .latitude(latitude)
                .longitude(longitude)
                .build();
    }

    public ChatMessage chat(String eventId, ChatEntry entry) {
        return ChatMessage.builder()
                .eventId(eventId)
                .senderId(entry.senderId())
                .sender(entry.sender())
                .senderKind(entry.senderKind())
                .text(entry.text())
                .commentary(entry.commentary())
                .timestamp(entry.timestamp().toEpochMilli())
                .build();
    }

    public ChatHistoryMessage chatHistory(String eventId, List<ChatEntry> entries) {
        return ChatHistoryMessage.builder()
                .eventId(eventId)
                .messages(entries.stream().map(entry -> chat(eventId, entry)).toList())
                .build();
    }

    private PresenceNotice notice(String type, String eventId, Participant participant) {
        return PresenceNotice.builder()
                .type(type)
                .eventId(eventId)
                .participantId(participant.id())
                .kind(participant.kind())
                .displayName(participant.displayName())
                .build();
    }
}
