package com.example.presence.live.transport;

import com.example.presence.live.session.Participant;
import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.exception.HandshakeRejectedException;
import com.example.presence.shared.model.EventContext;
import com.example.presence.shared.model.VerifiedIdentity;
import com.example.presence.shared.service.EventDirectory;
import com.example.presence.shared.service.IdentityService;
import com.example.presence.shared.service.ParticipationService;
import com.example.presence.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Validates a connection attempt against the identity, event and participation collaborators.
 * Rejections carry the close code the transport sends back.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PresenceHandshakeService {

    private final EventDirectory eventDirectory;
    private final IdentityService identityService;
    private final ParticipationService participationService;
    private final AppProperties appProperties;
    @Qualifier("sessionScheduler")
    private final Scheduler sessionScheduler;

    public Mono<AuthorizedJoin> authorize(HandshakeRequest request) {
        return Mono.fromCallable(() -> authorizeBlocking(request))
                .subscribeOn(sessionScheduler);
    }

    AuthorizedJoin authorizeBlocking(HandshakeRequest request) {
        EventContext event = eventDirectory.findActiveEvent(request.eventId())
                .orElseThrow(() -> new HandshakeRejectedException(Constants.CloseCodes.EVENT_NOT_FOUND,
                        "Event not found or inactive"));

        if (!request.isMember()) {
            Participant guest = Participant.guest(request.guestId(), displayName(request.guestName()));
            return new AuthorizedJoin(event, guest, event.getEventId());
        }

        VerifiedIdentity identity = identityService.verifyToken(request.token())
                .filter(VerifiedIdentity::active)
                .orElseThrow(() -> new HandshakeRejectedException(Constants.CloseCodes.INVALID_IDENTITY,
                        "Invalid or expired token"));
        if (!participationService.isParticipant(identity.userId(), event.getEventId())) {
            log.info("User {} is not a participant of event {}", identity.userId(), event.getEventId());
            throw new HandshakeRejectedException(Constants.CloseCodes.NOT_A_PARTICIPANT,
                    "Not a participant of this event");
        }
        Participant member = Participant.member(identity.userId(), displayName(identity.displayName()));
        return new AuthorizedJoin(event, member, identity.userId());
    }

    private String displayName(String raw) {
        int max = appProperties.getSession().getDisplayNameMaxLength();
        String name = raw == null ? "" : raw.strip();
        if (name.isEmpty()) {
            return "Someone";
        }
        return name.length() > max ? name.substring(0, max) : name;
    }
}
