package com.example.presence.live.commentary;

import com.example.presence.shared.model.EventContext;
import com.example.presence.shared.util.Constants.SenderKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CommentaryPromptBuilderTest {

    private static final Instant NOW = Instant.parse("2025-06-01T20:00:00Z");

    private final CommentaryPromptBuilder builder = new CommentaryPromptBuilder(EventContext.builder()
            .eventId("e1")
            .venueName("The Lighthouse")
            .venueAddress("1 Harbour Road")
            .hostName("Hana")
            .message("Bring a jacket")
            .latitude(51.5072)
            .longitude(-0.1276)
            .build());

    private final Attendee alice = new Attendee("GUEST:a", "Alice", null, null, NOW);
    private final Attendee bob = new Attendee("GUEST:b", "Bob", 51.5162, -0.1276, NOW);

    @Test
    void systemPromptShouldDescribeVenueHostAndAttendees() {
        String system = builder.systemPrompt(List.of(alice, bob));

        assertThat(system)
                .contains("The venue is The Lighthouse at 1 Harbour Road.")
                .contains("Host: Hana.")
                .contains("Host says: \"Bring a jacket\".")
                .contains("Current attendees: Alice, Bob.")
                .contains("No emojis");
    }

    @Test
    void systemPromptShouldCopeWithMissingDetails() {
        CommentaryPromptBuilder sparse = new CommentaryPromptBuilder(EventContext.builder().eventId("e2").build());

        String system = sparse.systemPrompt(List.of());

        assertThat(system)
                .contains("The venue is the venue.")
                .contains("Host: the host.")
                .contains("Current attendees: none yet.")
                .doesNotContain("Host says");
    }

    @Test
    void joinPromptShouldCountPeopleAndCarryRecentChat() {
        List<ChatEntry> chat = List.of(
                new ChatEntry("a", "Alice", SenderKind.GUEST, "running late", false, NOW),
                new ChatEntry("commentary", "Event AI", SenderKind.COMMENTARY, "Classic Alice.", true, NOW));

        String user = builder.eventPrompt(new DomainEvent.Joined("Bob"), List.of(alice, bob), chat);

        assertThat(user).isEqualTo("Bob just joined. There are now 2 people.\n"
                + "Recent chat:\nAlice: running late\nEvent AI: Classic Alice.");
    }

    @Test
    void eventPromptsShouldNameWhatHappened() {
        assertThat(builder.eventPrompt(new DomainEvent.Left("Alice"), List.of(bob), List.of()))
                .isEqualTo("Alice left.");
        assertThat(builder.eventPrompt(new DomainEvent.Chat("Bob", "hi all", SenderKind.GUEST), List.of(bob), List.of()))
                .isEqualTo("Bob said: \"hi all\"");
        assertThat(builder.eventPrompt(new DomainEvent.LocationUpdate("Bob", true), List.of(bob), List.of()))
                .isEqualTo("Bob just arrived at the venue!");
    }

    @Test
    void idlePromptShouldReportDistancesOfThoseWithAFix() {
        String user = builder.eventPrompt(new DomainEvent.IdleTick(), List.of(alice, bob), List.of());

        assertThat(user).startsWith("It's been quiet. Bob is ").endsWith("m away.");
        assertThat(user).doesNotContain("Alice");
        long meters = Long.parseLong(user.replaceAll("\\D", ""));
        assertThat(meters).isBetween(990L, 1010L);
    }

    @Test
    void idlePromptWithoutAnyFixShouldSaySo() {
        String user = builder.eventPrompt(new DomainEvent.IdleTick(), List.of(alice), List.of());

        assertThat(user).isEqualTo("It's been quiet. No location data.");
    }

    @Test
    void buildShouldPairBothHalves() {
        CommentaryPrompt prompt = builder.build(new DomainEvent.Left("Alice"), List.of(bob), List.of());

        assertThat(prompt.system()).contains("Current attendees: Bob.");
        assertThat(prompt.user()).isEqualTo("Alice left.");
    }
}
