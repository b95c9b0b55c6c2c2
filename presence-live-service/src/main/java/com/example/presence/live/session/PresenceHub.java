package com.example.presence.live.session;

import com.example.presence.live.commentary.CommentaryEngineManager;
import com.example.presence.live.protocol.PresenceMessageFactory;
import com.example.presence.live.registry.ConnectionRegistry;
import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.service.AttendeeLocationStore;
import com.example.presence.shared.service.ParticipationService;
import com.example.presence.shared.service.PushNotificationService;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;

/**
 * Everything a presence session works against, handed to each session on creation.
 */
@Component
@Getter
@Slf4j
@RequiredArgsConstructor
public class PresenceHub {

    private final ConnectionRegistry connectionRegistry;
    private final LivePresenceStore presenceStore;
    private final CommentaryEngineManager commentaryEngines;
    private final PresenceMessageFactory messageFactory;
    private final ParticipationService participationService;
    private final AttendeeLocationStore attendeeLocationStore;
    private final PushNotificationService pushNotificationService;
    private final AppProperties appProperties;
    @Qualifier("sessionScheduler")
    private final Scheduler sessionScheduler;
    private final Clock clock;

    /**
     * Runs a collaborator call off the caller's thread. Failures are logged and go no further.
     */
    public void fireAndForget(String description, Runnable action) {
        Mono.fromRunnable(action)
                .subscribeOn(sessionScheduler)
                .doOnError(e -> log.warn("Background task '{}' failed: {}", description, e.getMessage()))
                .onErrorResume(e -> Mono.empty())
                .subscribe();
    }
}
