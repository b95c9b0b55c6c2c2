package com.example.presence.shared.service.simulated;

import com.example.presence.shared.aspect.Monitored;
import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.model.EventContext;
import com.example.presence.shared.service.EventDirectory;
import com.example.presence.shared.service.ParticipationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Serves events and their participant lists from presence.simulation.events.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Monitored("collaborator")
public class SimulatedEventDirectory implements EventDirectory, ParticipationService {

    private final AppProperties appProperties;

    @Override
    public Optional<EventContext> findActiveEvent(String eventId) {
        AppProperties.Simulation.SimulatedEvent event = appProperties.getSimulation().getEvents().get(eventId);
        if (event == null || !event.isActive()) {
            return Optional.empty();
        }
        return Optional.of(EventContext.builder()
                .eventId(eventId)
                .venueName(event.getVenueName())
                .venueAddress(event.getVenueAddress())
                .latitude(event.getLatitude())
                .longitude(event.getLongitude())
                .hostName(event.getHostName())
                .message(event.getMessage())
                .build());
    }

    @Override
    public boolean isParticipant(String userId, String eventId) {
        return getParticipantIds(eventId).contains(userId);
    }

    @Override
    public List<String> getParticipantIds(String eventId) {
        AppProperties.Simulation.SimulatedEvent event = appProperties.getSimulation().getEvents().get(eventId);
        if (event == null) {
            return List.of();
        }
        return List.copyOf(event.getParticipants());
    }
}
