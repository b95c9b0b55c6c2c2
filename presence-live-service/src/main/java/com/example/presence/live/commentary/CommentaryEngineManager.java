package com.example.presence.live.commentary;

import com.example.presence.live.protocol.PresenceMessageFactory;
import com.example.presence.live.registry.AudienceKey;
import com.example.presence.live.registry.ConnectionRegistry;
import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.config.MonitoringConfig;
import com.example.presence.shared.model.EventContext;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns one commentary engine per event with at least one attendee on this pod. The engine is
 * created with the first attendee and torn down, awaiting its worker, when the last one goes.
 */
@Service
@Slf4j
public class CommentaryEngineManager {

    private final Map<String, CommentaryEngine> engines = new ConcurrentHashMap<>();

    private final ConnectionRegistry connectionRegistry;
    private final PresenceMessageFactory messageFactory;
    private final CommentaryGenerator generator;
    private final AppProperties appProperties;
    private final MonitoringConfig.PresenceMetricsCollector metricsCollector;
    private final Scheduler commentaryScheduler;
    private final Clock clock;

    public CommentaryEngineManager(ConnectionRegistry connectionRegistry,
                                   PresenceMessageFactory messageFactory,
                                   CommentaryGenerator generator,
                                   AppProperties appProperties,
                                   MonitoringConfig.PresenceMetricsCollector metricsCollector,
                                   @Qualifier("commentaryScheduler") Scheduler commentaryScheduler,
                                   Clock clock) {
        this.connectionRegistry = connectionRegistry;
        this.messageFactory = messageFactory;
        this.generator = generator;
        this.appProperties = appProperties;
        this.metricsCollector = metricsCollector;
        this.commentaryScheduler = commentaryScheduler;
        this.clock = clock;
    }

    /**
     * Adds an attendee, creating and starting the event's engine if there is none.
     */
    public void join(EventContext context, String attendeeId, String displayName) {
        engines.compute(context.getEventId(), (eventId, engine) -> {
            CommentaryEngine target = engine;
            if (target == null) {
                target = new CommentaryEngine(context, generator, this::publish,
                        appProperties.getCommentary(), metricsCollector, clock);
                target.start(commentaryScheduler);
            }
            target.addAttendee(attendeeId, displayName);
            return target;
        });
    }

    /**
     * Removes an attendee. When the directory becomes empty the engine is removed and stopped.
     */
    public void vacate(String eventId, String attendeeId) {
        AtomicReference<CommentaryEngine> retired = new AtomicReference<>();
        engines.computeIfPresent(eventId, (id, engine) -> {
            engine.removeAttendee(attendeeId);
            if (engine.hasAttendees()) {
                return engine;
            }
            retired.set(engine);
            return null;
        });
        CommentaryEngine engine = retired.get();
        if (engine != null) {
            log.info("Last attendee left event {}, tearing down its commentary engine", eventId);
            engine.stop();
        }
    }

    public void push(String eventId, DomainEvent event) {
        CommentaryEngine engine = engines.get(eventId);
        if (engine != null) {
            engine.push(event);
        }
    }

    public void onLocation(String eventId, String attendeeId, String displayName, double latitude, double longitude) {
        CommentaryEngine engine = engines.get(eventId);
        if (engine != null) {
            engine.updateLocation(attendeeId, displayName, latitude, longitude);
        }
    }

    public void appendChat(String eventId, ChatEntry entry) {
        CommentaryEngine engine = engines.get(eventId);
        if (engine != null) {
            engine.appendChat(entry);
        }
    }

    public List<ChatEntry> history(String eventId) {
        CommentaryEngine engine = engines.get(eventId);
        return engine != null ? engine.history() : List.of();
    }

    public int activeEngineCount() {
        return engines.size();
    }

    public boolean hasEngine(String eventId) {
        return engines.containsKey(eventId);
    }

    @PreDestroy
    public void shutdown() {
        List<CommentaryEngine> running = new ArrayList<>(engines.values());
        engines.clear();
        log.info("Stopping {} commentary engines", running.size());
        running.forEach(CommentaryEngine::stop);
    }

    private void publish(String eventId, ChatEntry entry) {
        connectionRegistry.publish(AudienceKey.event(eventId), messageFactory.chat(eventId, entry));
    }
}
