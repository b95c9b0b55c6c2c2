package com.example.presence.shared.service.simulated;

import com.example.presence.shared.aspect.Monitored;
import com.example.presence.shared.model.AttendeeLocation;
import com.example.presence.shared.service.AttendeeLocationStore;
import com.example.presence.shared.util.Constants.ParticipantKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Service
@Slf4j
@Monitored("collaborator")
public class InMemoryAttendeeLocationStore implements AttendeeLocationStore {

    private final Map<String, AttendeeLocation> locations = new ConcurrentHashMap<>();

    @Override
    public void upsert(AttendeeLocation location) {
        locations.put(key(location.getEventId(), location.getKind(), location.getParticipantId()), location);
        log.debug("Stored location for {} {} in event {} (sharing={})",
                location.getKind(), location.getParticipantId(), location.getEventId(), location.isSharing());
    }

    @Override
    public void delete(String eventId, ParticipantKind kind, String participantId) {
        locations.remove(key(eventId, kind, participantId));
    }

    public Optional<AttendeeLocation> find(String eventId, ParticipantKind kind, String participantId) {
        return Optional.ofNullable(locations.get(key(eventId, kind, participantId)));
    }

    private static String key(String eventId, ParticipantKind kind, String participantId) {
        return eventId + ":" + kind.name().toLowerCase() + ":" + participantId;
    }
}
