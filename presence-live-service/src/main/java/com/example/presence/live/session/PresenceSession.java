package com.example.presence.live.session;

import com.example.presence.live.commentary.ChatEntry;
import com.example.presence.live.commentary.CommentaryEngineManager;
import com.example.presence.live.commentary.DomainEvent;
import com.example.presence.live.protocol.PresenceMessageFactory;
import com.example.presence.live.protocol.inbound.ChatSendMessage;
import com.example.presence.live.protocol.inbound.GuestLocationMessage;
import com.example.presence.live.protocol.inbound.InboundMessage;
import com.example.presence.live.protocol.inbound.LeaveMessage;
import com.example.presence.live.protocol.inbound.LivenessProbe;
import com.example.presence.live.protocol.inbound.StopSharingMessage;
import com.example.presence.live.registry.AudienceKey;
import com.example.presence.live.registry.Connection;
import com.example.presence.live.registry.ConnectionRegistry;
import com.example.presence.shared.model.AttendeeLocation;
import com.example.presence.shared.model.EventContext;
import com.example.presence.shared.model.PushPayload;
import com.example.presence.shared.util.Constants;
import com.example.presence.shared.util.GeoUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Protocol driver for one connection to one live event.
 * <p>
 * {@code CONNECTING -> ACTIVE -> EXPLICIT_LEAVE | DROPPED}. Inbound actions are handled one at a
 * time in arrival order; the transport guarantees that by feeding {@link #handle} sequentially.
 */
@Slf4j
public class PresenceSession {

    private final PresenceHub hub;
    @Getter
    private final Connection connection;
    @Getter
    private final Participant participant;
    private final EventContext event;
    private final String eventId;
    private final List<AudienceKey> audiences;
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CONNECTING);
    private final Runnable transportCloser;

    public PresenceSession(PresenceHub hub, Connection connection, Participant participant, EventContext event,
                           Runnable transportCloser) {
        this.hub = hub;
        this.connection = connection;
        this.participant = participant;
        this.event = event;
        this.eventId = event.getEventId();
        this.transportCloser = transportCloser;
        List<AudienceKey> keys = new ArrayList<>();
        keys.add(AudienceKey.event(eventId));
        if (participant.isMember()) {
            keys.add(participant.personalAudience());
        }
        this.audiences = List.copyOf(keys);
    }

    public SessionState state() {
        return state.get();
    }

    /**
     * Enters {@code ACTIVE}: registers the connection, sends the snapshot and recent chat to it and,
     * for a first join only, announces the participant.
     */
    public void activate() {
        if (!state.compareAndSet(SessionState.CONNECTING, SessionState.ACTIVE)) {
            return;
        }
        ConnectionRegistry registry = hub.getConnectionRegistry();
        PresenceMessageFactory messages = hub.getMessageFactory();
        CommentaryEngineManager engines = hub.getCommentaryEngines();

        audiences.forEach(key -> registry.register(connection, key));
        LivePresenceStore.AttachResult attach = hub.getPresenceStore().attach(eventId, participant);
        if (attach.firstLiveConnection()) {
            engines.join(event, participant.key(), participant.displayName());
        }

        registry.sendTo(connection, messages.initialState(eventId, hub.getPresenceStore().sharingSnapshot(eventId)));
        List<ChatEntry> history = engines.history(eventId);
        if (!history.isEmpty()) {
            registry.sendTo(connection, messages.chatHistory(eventId, history));
        }

        if (attach.firstJoin()) {
            log.info("{} {} joined event {}", participant.kind(), participant.id(), eventId);
            registry.publish(AudienceKey.event(eventId), messages.joined(eventId, participant));
            engines.push(eventId, new DomainEvent.Joined(participant.displayName()));
            notifyParticipantsOfJoin();
        } else {
            log.info("{} {} reconnected to event {} ({} live connections)",
                    participant.kind(), participant.id(), eventId, attach.record().getLiveConnections());
        }
    }

    /**
     * Handles one decoded inbound message. Unknown messages are ignored; nothing here closes the
     * connection except an explicit leave.
     */
    public void handle(InboundMessage message) {
        if (state.get() != SessionState.ACTIVE) {
            return;
        }
        if (message instanceof LivenessProbe) {
            connection.send(Constants.PONG);
        } else if (message instanceof GuestLocationMessage location) {
            onLocation(location);
        } else if (message instanceof StopSharingMessage) {
            onStopSharing();
        } else if (message instanceof ChatSendMessage chat) {
            onChat(chat);
        } else if (message instanceof LeaveMessage) {
            leave();
        } else {
            log.debug("Ignoring unrecognised message on {}", connection);
        }
    }

    /**
     * Transport closed without a goodbye. The live record is kept for the grace period with sharing
     * cleared; observers see "stopped sharing", never "left".
     */
    public void onTransportClosed() {
        if (!state.compareAndSet(SessionState.ACTIVE, SessionState.DROPPED)) {
            // Never activated, or already left explicitly
            state.compareAndSet(SessionState.CONNECTING, SessionState.DROPPED);
            return;
        }
        audiences.forEach(key -> hub.getConnectionRegistry().unregister(connection, key));
        connection.close();

        hub.getPresenceStore().detach(eventId, participant).ifPresent(detach -> {
            if (!detach.lastConnection()) {
                log.info("Connection {} dropped, {} still connected to event {} elsewhere", connection, participant.id(), eventId);
                return;
            }
            log.info("{} {} dropped from event {}", participant.kind(), participant.id(), eventId);
            publishToEventAndParticipants(hub.getMessageFactory().locationStopped(eventId, participant));
            persist(detach.record(), false);
            hub.getCommentaryEngines().vacate(eventId, participant.key());
        });
    }

    void onLocation(GuestLocationMessage message) {
        if (!GeoUtils.isValidCoordinate(message.latitude(), message.longitude())) {
            log.debug("Ignoring invalid coordinates from {}: {}, {}", participant.id(), message.latitude(), message.longitude());
            return;
        }
        double latitude = message.latitude();
        double longitude = message.longitude();
        if (hub.getPresenceStore().updateLocation(eventId, participant, latitude, longitude).isEmpty()) {
            return;
        }
        hub.fireAndForget("persist location", () -> hub.getAttendeeLocationStore().upsert(AttendeeLocation.builder()
                .eventId(eventId)
                .kind(participant.kind())
                .participantId(participant.id())
                .displayName(participant.displayName())
                .latitude(latitude)
                .longitude(longitude)
                .sharing(true)
                .updatedAt(OffsetDateTime.now(hub.getClock()))
                .build()));
        publishToEventAndParticipants(hub.getMessageFactory().locationShared(eventId, participant, latitude, longitude));
        hub.getCommentaryEngines().onLocation(eventId, participant.key(), participant.displayName(), latitude, longitude);
    }

    void onStopSharing() {
        hub.getPresenceStore().stopSharing(eventId, participant).ifPresent(record -> {
            persist(record, false);
            publishToEventAndParticipants(hub.getMessageFactory().locationStopped(eventId, participant));
        });
    }

    void onChat(ChatSendMessage message) {
        String text = message.text() == null ? "" : message.text().strip();
        if (text.isEmpty() || text.length() > hub.getAppProperties().getSession().getChatMaxLength()) {
            log.debug("Dropping chat from {}: empty or over {} characters", participant.id(),
                    hub.getAppProperties().getSession().getChatMaxLength());
            return;
        }
        ChatEntry entry = new ChatEntry(participant.id(), participant.displayName(), participant.senderKind(),
                text, false, hub.getClock().instant());
        hub.getCommentaryEngines().appendChat(eventId, entry);
        hub.getConnectionRegistry().publish(AudienceKey.event(eventId), hub.getMessageFactory().chat(eventId, entry));
        hub.getCommentaryEngines().push(eventId, new DomainEvent.Chat(participant.displayName(), text, participant.senderKind()));
    }

    /**
     * Intentional departure. Removes the live record even if the same participant has other tabs
     * open; those stay connected but are no longer counted as present.
     */
    public void leave() {
        if (!state.compareAndSet(SessionState.ACTIVE, SessionState.EXPLICIT_LEAVE)) {
            return;
        }
        log.info("{} {} left event {}", participant.kind(), participant.id(), eventId);
        hub.getPresenceStore().remove(eventId, participant);
        hub.fireAndForget("delete location", () ->
                hub.getAttendeeLocationStore().delete(eventId, participant.kind(), participant.id()));
        hub.getConnectionRegistry().publish(AudienceKey.event(eventId), hub.getMessageFactory().left(eventId, participant));
        hub.getCommentaryEngines().push(eventId, new DomainEvent.Left(participant.displayName()));
        hub.getCommentaryEngines().vacate(eventId, participant.key());

        audiences.forEach(key -> hub.getConnectionRegistry().unregister(connection, key));
        connection.close();
        transportCloser.run();
    }

    private void publishToEventAndParticipants(Object message) {
        List<AudienceKey> keys = new ArrayList<>();
        keys.add(AudienceKey.event(eventId));
        try {
            hub.getParticipationService().getParticipantIds(eventId).forEach(id -> keys.add(AudienceKey.user(id)));
        } catch (Exception e) {
            log.warn("Could not load participants of event {}, notifying the event audience only: {}", eventId, e.getMessage());
        }
        hub.getConnectionRegistry().publish(keys, message);
    }

    private void persist(LiveRecord record, boolean sharing) {
        hub.fireAndForget("persist sharing state", () -> hub.getAttendeeLocationStore().upsert(AttendeeLocation.builder()
                .eventId(eventId)
                .kind(participant.kind())
                .participantId(participant.id())
                .displayName(participant.displayName())
                .latitude(record.getLatitude())
                .longitude(record.getLongitude())
                .sharing(sharing)
                .updatedAt(OffsetDateTime.now(hub.getClock()))
                .build()));
    }

    private void notifyParticipantsOfJoin() {
        PushPayload payload = new PushPayload(
                event.getVenueName() != null ? event.getVenueName() : "Live event",
                participant.displayName() + " joined",
                Map.of("type", Constants.MessageTypes.GUEST_JOINED, "event_id", eventId));
        hub.fireAndForget("push join notification", () -> hub.getParticipationService().getParticipantIds(eventId).stream()
                .filter(id -> !(participant.isMember() && id.equals(participant.id())))
                .forEach(id -> hub.getPushNotificationService().dispatch(id, payload)));
    }

    @Override
    public String toString() {
        return "PresenceSession[" + participant.key() + " @ " + eventId + ", " + state.get() + "]";
    }
}
