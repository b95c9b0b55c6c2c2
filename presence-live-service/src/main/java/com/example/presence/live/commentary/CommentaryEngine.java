package com.example.presence.live.commentary;

import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.config.MonitoringConfig;
import com.example.presence.shared.model.EventContext;
import com.example.presence.shared.util.Constants.SenderKind;
import com.example.presence.shared.util.GeoUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Commentary for one live event. Domain events are queued without blocking the caller and consumed
 * by a single worker that throttles itself, decides whether the event deserves a remark, asks the
 * generator for one and publishes the result into the event's chat.
 * <p>
 * The queue is lossy: when it is full new events are dropped. A cooldown applies between generated
 * messages, and events arriving inside it are discarded rather than deferred.
 */
@Slf4j
public class CommentaryEngine {

    public static final String COMMENTARY_SENDER_ID = "commentary";

    @Getter
    private final String eventId;
    private final EventContext context;
    private final BlockingQueue<DomainEvent> queue;
    private final ChatHistoryBuffer history;
    private final Map<String, Attendee> attendees = new ConcurrentHashMap<>();
    private final CommentaryPromptBuilder promptBuilder;
    private final CommentaryGenerator generator;
    private final CommentaryPublisher publisher;
    private final AppProperties.Commentary settings;
    private final MonitoringConfig.PresenceMetricsCollector metricsCollector;
    private final Clock clock;

    private volatile Instant lastCommentaryAt = Instant.EPOCH;
    private volatile boolean stopped;
    private volatile boolean loopStarted;
    private volatile Thread worker;
    private Disposable loopTask;
    private CountDownLatch loopFinished;

    public CommentaryEngine(EventContext context,
                            CommentaryGenerator generator,
                            CommentaryPublisher publisher,
                            AppProperties.Commentary settings,
                            MonitoringConfig.PresenceMetricsCollector metricsCollector,
                            Clock clock) {
        this.eventId = context.getEventId();
        this.context = context;
        this.queue = new ArrayBlockingQueue<>(settings.getQueueCapacity());
        this.history = new ChatHistoryBuffer(settings.getChatHistorySize());
        this.promptBuilder = new CommentaryPromptBuilder(context);
        this.generator = generator;
        this.publisher = publisher;
        this.settings = settings;
        this.metricsCollector = metricsCollector;
        this.clock = clock;
    }

    public synchronized void start(Scheduler scheduler) {
        if (loopTask != null) {
            return;
        }
        loopFinished = new CountDownLatch(1);
        try {
            loopTask = scheduler.schedule(this::runLoop);
        } catch (RejectedExecutionException e) {
            log.warn("No commentary worker available for event {}, running silent: {}", eventId, e.getMessage());
            return;
        }
        log.info("Commentary engine started for event {}", eventId);
    }

    /**
     * Stops the worker and waits for it to finish, so no generation call outlives the engine. A loop
     * still queued behind busy workers is cancelled without waiting.
     */
    public synchronized void stop() {
        stopped = true;
        if (loopTask == null) {
            return;
        }
        if (!loopStarted) {
            loopTask.dispose();
            queue.clear();
            log.info("Commentary engine for event {} stopped before its worker started", eventId);
            return;
        }
        Thread current = worker;
        if (current != null) {
            current.interrupt();
        }
        try {
            if (!loopFinished.await(settings.getShutdownTimeout(), TimeUnit.MILLISECONDS)) {
                log.warn("Commentary engine for event {} did not stop within {} ms", eventId, settings.getShutdownTimeout());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        loopTask.dispose();
        queue.clear();
        log.info("Commentary engine stopped for event {}", eventId);
    }

    /**
     * Never blocks. Returns false if the queue was full and the event was dropped.
     */
    public boolean push(DomainEvent event) {
        boolean accepted = queue.offer(event);
        if (!accepted) {
            log.debug("Commentary queue full for event {}, dropping {}", eventId, event.getClass().getSimpleName());
            metricsCollector.incrementCounter(MonitoringConfig.COMMENTARY_DROPPED);
        }
        return accepted;
    }

    public void addAttendee(String attendeeId, String displayName) {
        attendees.compute(attendeeId, (id, existing) -> existing != null
                ? existing.withDisplayName(displayName).withLastSeen(clock.instant())
                : new Attendee(id, displayName, null, null, clock.instant()));
    }

    public void removeAttendee(String attendeeId) {
        attendees.remove(attendeeId);
    }

    public boolean hasAttendees() {
        return !attendees.isEmpty();
    }

    public Collection<Attendee> attendees() {
        return List.copyOf(attendees.values());
    }

    /**
     * Records a new position and queues an arrival when the attendee moves from beyond the far
     * threshold to within the arrived threshold. Staying inside the arrived radius never re-fires.
     */
    public void updateLocation(String attendeeId, String displayName, double latitude, double longitude) {
        Attendee previous = attendees.get(attendeeId);
        double previousDistance = previous != null && previous.getLastLatitude() != null && previous.getLastLongitude() != null
                ? distanceToVenue(previous.getLastLatitude(), previous.getLastLongitude())
                : Double.POSITIVE_INFINITY;
        double newDistance = distanceToVenue(latitude, longitude);

        attendees.put(attendeeId, new Attendee(attendeeId, displayName, latitude, longitude, clock.instant()));

        if (previousDistance > settings.getFarThresholdMeters() && newDistance <= settings.getArrivedThresholdMeters()) {
            log.debug("{} arrived at the venue of event {} ({} m)", displayName, eventId, (long) newDistance);
            push(new DomainEvent.LocationUpdate(displayName, true));
        }
    }

    public void appendChat(ChatEntry entry) {
        history.append(entry);
    }

    public List<ChatEntry> history() {
        return history.snapshot();
    }

    boolean isLoopStarted() {
        return loopStarted;
    }

    public int queuedEvents() {
        return queue.size();
    }

    private void runLoop() {
        loopStarted = true;
        if (stopped) {
            loopFinished.countDown();
            return;
        }
        worker = Thread.currentThread();
        try {
            while (!stopped) {
                DomainEvent event = queue.poll(settings.getIdleTimeout(), TimeUnit.MILLISECONDS);
                if (event == null) {
                    if (attendees.isEmpty()) {
                        continue;
                    }
                    event = new DomainEvent.IdleTick();
                }
                process(event);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("Commentary loop for event {} terminated unexpectedly: {}", eventId, e.getMessage(), e);
        } finally {
            worker = null;
            loopFinished.countDown();
        }
    }

    void process(DomainEvent event) {
        if (!settings.isEnabled() || !generator.isEnabled()) {
            return;
        }
        Instant now = clock.instant();
        Duration sinceLast = Duration.between(lastCommentaryAt, now);
        if (sinceLast.toMillis() < settings.getCooldown()) {
            log.trace("Event {} discarded for event {}: inside the cooldown", event.getClass().getSimpleName(), eventId);
            return;
        }
        if (!isEligible(event, sinceLast)) {
            return;
        }

        CommentaryPrompt prompt = promptBuilder.build(event, attendees(), history.lastEntries(settings.getContextChatLines()));
        long start = System.currentTimeMillis();
        String text;
        try {
            text = generator.generate(prompt).block(Duration.ofMillis(settings.getGenerationTimeout()));
        } catch (Exception e) {
            log.error("Commentary generation failed for event {}: {}", eventId, e.getMessage());
            metricsCollector.incrementCounter(MonitoringConfig.COMMENTARY_FAILED);
            return;
        }
        metricsCollector.recordTimer(MonitoringConfig.COMMENTARY_LATENCY, System.currentTimeMillis() - start);
        if (text == null || text.isBlank() || stopped) {
            return;
        }

        Instant at = clock.instant();
        lastCommentaryAt = at;
        ChatEntry entry = new ChatEntry(COMMENTARY_SENDER_ID, settings.getSenderName(), SenderKind.COMMENTARY, text.strip(), true, at);
        history.append(entry);
        try {
            publisher.publish(eventId, entry);
            metricsCollector.incrementCounter(MonitoringConfig.COMMENTARY_GENERATED);
        } catch (Exception e) {
            log.warn("Failed to publish commentary for event {}: {}", eventId, e.getMessage());
        }
    }

    private boolean isEligible(DomainEvent event, Duration sinceLast) {
        if (event instanceof DomainEvent.Joined || event instanceof DomainEvent.Left || event instanceof DomainEvent.Chat) {
            return true;
        }
        if (event instanceof DomainEvent.IdleTick) {
            return sinceLast.toMillis() >= 2 * settings.getCooldown();
        }
        if (event instanceof DomainEvent.LocationUpdate update) {
            return update.arrived();
        }
        return false;
    }

    private double distanceToVenue(double latitude, double longitude) {
        return GeoUtils.haversineMeters(latitude, longitude, context.getLatitude(), context.getLongitude());
    }

    @Override
    public String toString() {
        return "CommentaryEngine[" + eventId + ", attendees=" + new ArrayList<>(attendees.keySet()) + "]";
    }
}
