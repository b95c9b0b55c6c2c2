package com.example.presence.live.commentary;

import com.example.presence.live.support.MutableClock;
import com.example.presence.live.support.TestProperties;
import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.model.EventContext;
import com.example.presence.shared.util.Constants.SenderKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CommentaryEngineTest {

    private static final double VENUE_LAT = 51.5072;
    private static final double VENUE_LNG = -0.1276;
    // Roughly 1.4 km, 67 m and 11 m north of the venue
    private static final double FAR_LAT = 51.5200;
    private static final double BETWEEN_LAT = 51.5078;
    private static final double NEAR_LAT = 51.5073;

    @Mock
    private CommentaryGenerator generator;

    private final List<ChatEntry> published = new CopyOnWriteArrayList<>();
    private AppProperties.Commentary settings;
    private MutableClock clock;
    private CommentaryEngine engine;
    private Scheduler scheduler;

    @BeforeEach
    void setUp() {
        settings = new AppProperties.Commentary();
        clock = new MutableClock(Instant.parse("2025-06-01T20:00:00Z"));
        lenient().when(generator.isEnabled()).thenReturn(true);
        lenient().when(generator.generate(any())).thenReturn(Mono.just("What a turnout."));
        engine = newEngine();
    }

    @AfterEach
    void tearDown() {
        engine.stop();
        if (scheduler != null) {
            scheduler.dispose();
        }
    }

    private CommentaryEngine newEngine() {
        EventContext context = EventContext.builder()
                .eventId("e1")
                .venueName("The Lighthouse")
                .latitude(VENUE_LAT)
                .longitude(VENUE_LNG)
                .hostName("Alice")
                .build();
        return new CommentaryEngine(context, generator, (eventId, entry) -> published.add(entry),
                settings, TestProperties.metrics(), clock);
    }

    @Test
    void shouldNeverCommentTwiceWithinTheCooldown() {
        // Given
        engine.addAttendee("a", "Alice");

        // When
        engine.process(new DomainEvent.Joined("Alice"));
        engine.process(new DomainEvent.Chat("Alice", "hello", SenderKind.GUEST));
        clock.advance(Duration.ofSeconds(29));
        engine.process(new DomainEvent.Left("Bob"));

        // Then
        verify(generator, times(1)).generate(any());
        assertThat(published).hasSize(1);

        clock.advance(Duration.ofSeconds(2));
        engine.process(new DomainEvent.Left("Bob"));
        verify(generator, times(2)).generate(any());
        assertThat(published).hasSize(2);
    }

    @Test
    void generatedCommentShouldBeAttributedToTheEngineAndKeptInHistory() {
        engine.process(new DomainEvent.Joined("Alice"));

        assertThat(published).singleElement().satisfies(entry -> {
            assertThat(entry.sender()).isEqualTo("Event AI");
            assertThat(entry.senderKind()).isEqualTo(SenderKind.COMMENTARY);
            assertThat(entry.commentary()).isTrue();
            assertThat(entry.text()).isEqualTo("What a turnout.");
        });
        assertThat(engine.history()).containsExactlyElementsOf(published);
    }

    @Test
    void idleTickShouldNeedTwiceTheCooldown() {
        engine.addAttendee("a", "Alice");
        engine.process(new DomainEvent.Joined("Alice"));

        clock.advance(Duration.ofSeconds(31));
        engine.process(new DomainEvent.IdleTick());
        verify(generator, times(1)).generate(any());

        clock.advance(Duration.ofSeconds(30));
        engine.process(new DomainEvent.IdleTick());
        verify(generator, times(2)).generate(any());
    }

    @Test
    void plainLocationUpdateShouldNotBeEligible() {
        engine.process(new DomainEvent.LocationUpdate("Alice", false));

        verify(generator, never()).generate(any());
    }

    @Test
    void arrivalShouldFireOnceWhenCrossingFromFarToNear() {
        engine.addAttendee("a", "Alice");

        engine.updateLocation("a", "Alice", FAR_LAT, VENUE_LNG);
        assertThat(engine.queuedEvents()).isZero();

        engine.updateLocation("a", "Alice", NEAR_LAT, VENUE_LNG);
        assertThat(engine.queuedEvents()).isEqualTo(1);

        // Jitter around the venue never re-fires
        engine.updateLocation("a", "Alice", NEAR_LAT, VENUE_LNG);
        engine.updateLocation("a", "Alice", BETWEEN_LAT, VENUE_LNG);
        engine.updateLocation("a", "Alice", NEAR_LAT, VENUE_LNG);
        assertThat(engine.queuedEvents()).isEqualTo(1);

        // Leaving and coming back does
        engine.updateLocation("a", "Alice", FAR_LAT, VENUE_LNG);
        engine.updateLocation("a", "Alice", NEAR_LAT, VENUE_LNG);
        assertThat(engine.queuedEvents()).isEqualTo(2);
    }

    @Test
    void firstFixAtTheVenueShouldCountAsArrival() {
        engine.addAttendee("a", "Alice");

        engine.updateLocation("a", "Alice", NEAR_LAT, VENUE_LNG);

        assertThat(engine.queuedEvents()).isEqualTo(1);
    }

    @Test
    void arrivalEventShouldBeEligible() {
        engine.process(new DomainEvent.LocationUpdate("Alice", true));

        ArgumentCaptor<CommentaryPrompt> prompt = ArgumentCaptor.forClass(CommentaryPrompt.class);
        verify(generator).generate(prompt.capture());
        assertThat(prompt.getValue().user()).startsWith("Alice just arrived at the venue!");
    }

    @Test
    void failedGenerationShouldBeSkippedWithoutStartingTheCooldown() {
        when(generator.generate(any()))
                .thenReturn(Mono.error(new CommentaryGenerationException("Anthropic API 529: overloaded")))
                .thenReturn(Mono.just("Second time lucky."));

        engine.process(new DomainEvent.Joined("Alice"));
        assertThat(published).isEmpty();
        assertThat(engine.history()).isEmpty();

        engine.process(new DomainEvent.Joined("Bob"));
        assertThat(published).extracting(ChatEntry::text).containsExactly("Second time lucky.");
    }

    @Test
    void emptyGenerationShouldPublishNothing() {
        when(generator.generate(any())).thenReturn(Mono.empty());

        engine.process(new DomainEvent.Joined("Alice"));

        assertThat(published).isEmpty();
    }

    @Test
    void disabledGeneratorShouldConsumeEventsSilently() {
        when(generator.isEnabled()).thenReturn(false);

        engine.process(new DomainEvent.Joined("Alice"));

        verify(generator, never()).generate(any());
        assertThat(published).isEmpty();
    }

    @Test
    void fullQueueShouldDropNewEventsWithoutBlocking() {
        settings.setQueueCapacity(2);
        engine = newEngine();

        assertThat(engine.push(new DomainEvent.Joined("A"))).isTrue();
        assertThat(engine.push(new DomainEvent.Joined("B"))).isTrue();
        assertThat(engine.push(new DomainEvent.Joined("C"))).isFalse();
        assertThat(engine.queuedEvents()).isEqualTo(2);
    }

    @Test
    void promptShouldIncludeOnlyTheLastContextLines() {
        settings.setContextChatLines(2);
        engine = newEngine();
        engine.appendChat(new ChatEntry("g1", "Alice", SenderKind.GUEST, "first", false, clock.instant()));
        engine.appendChat(new ChatEntry("g1", "Alice", SenderKind.GUEST, "second", false, clock.instant()));
        engine.appendChat(new ChatEntry("g2", "Bob", SenderKind.GUEST, "third", false, clock.instant()));

        engine.process(new DomainEvent.Chat("Bob", "third", SenderKind.GUEST));

        ArgumentCaptor<CommentaryPrompt> prompt = ArgumentCaptor.forClass(CommentaryPrompt.class);
        verify(generator).generate(prompt.capture());
        assertThat(prompt.getValue().user())
                .contains("Alice: second", "Bob: third")
                .doesNotContain("first");
    }

    @Test
    void runningLoopShouldConsumePushedEvents() {
        scheduler = Schedulers.newBoundedElastic(2, 10, "commentary-test");
        engine.start(scheduler);

        engine.push(new DomainEvent.Joined("Alice"));

        verify(generator, timeout(2000)).generate(any());
    }

    @Test
    void quietEventShouldProduceAnIdleTick() {
        settings.setIdleTimeout(50);
        engine = newEngine();
        engine.addAttendee("a", "Alice");
        scheduler = Schedulers.newBoundedElastic(2, 10, "commentary-test");
        engine.start(scheduler);

        verify(generator, timeout(2000)).generate(argThat(prompt -> prompt.user().startsWith("It's been quiet.")));
    }

    @Test
    void stopShouldWaitForTheLoopToFinish() {
        scheduler = Schedulers.newBoundedElastic(2, 10, "commentary-test");
        engine.start(scheduler);

        long started = System.currentTimeMillis();
        engine.stop();

        assertThat(System.currentTimeMillis() - started).isLessThan(settings.getShutdownTimeout());
        assertThat(engine.push(new DomainEvent.Joined("late"))).isTrue();
        verify(generator, never()).generate(any());
    }

    @Test
    void stopShouldNotWaitForALoopStillQueuedBehindBusyWorkers() throws Exception {
        // Given the only worker is taken by another engine's loop
        scheduler = Schedulers.newBoundedElastic(1, 10, "commentary-test");
        CountDownLatch release = new CountDownLatch(1);
        scheduler.schedule(() -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        engine.start(scheduler);

        // When
        long started = System.currentTimeMillis();
        engine.stop();

        // Then
        assertThat(System.currentTimeMillis() - started).isLessThan(1000);
        assertThat(engine.isLoopStarted()).isFalse();
        release.countDown();
        verify(generator, never()).generate(any());
    }
}
