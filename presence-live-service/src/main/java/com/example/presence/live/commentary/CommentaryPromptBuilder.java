package com.example.presence.live.commentary;

import com.example.presence.shared.model.EventContext;
import com.example.presence.shared.util.GeoUtils;
import org.springframework.util.StringUtils;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns an engine's state and one domain event into the two prompt halves: a system part describing
 * the event and who is in it, and a user part describing what just happened plus recent chat.
 */
public class CommentaryPromptBuilder {

    private static final String STYLE_GUIDE = "Keep responses to 1-2 short sentences max. Be fun, dry and witty, "
            + "like a sports commentator providing colour on a night out. Not every message needs a reply. "
            + "No emojis. No hashtags. Refer to people by name.";

    private final EventContext context;

    public CommentaryPromptBuilder(EventContext context) {
        this.context = context;
    }

    public CommentaryPrompt build(DomainEvent event, Collection<Attendee> attendees, List<ChatEntry> recentChat) {
        return new CommentaryPrompt(systemPrompt(attendees), eventPrompt(event, attendees, recentChat));
    }

    String systemPrompt(Collection<Attendee> attendees) {
        StringBuilder sb = new StringBuilder("You are a witty, warm running commentator for a live group meetup.");
        String venue = StringUtils.hasText(context.getVenueName()) ? context.getVenueName() : "the venue";
        sb.append(" The venue is ").append(venue);
        if (StringUtils.hasText(context.getVenueAddress())) {
            sb.append(" at ").append(context.getVenueAddress());
        }
        sb.append('.');
        String host = StringUtils.hasText(context.getHostName()) ? context.getHostName() : "the host";
        sb.append(" Host: ").append(host).append('.');
        if (StringUtils.hasText(context.getMessage())) {
            sb.append(" Host says: \"").append(context.getMessage()).append("\".");
        }
        String names = attendees.stream().map(Attendee::getDisplayName).collect(Collectors.joining(", "));
        sb.append(" Current attendees: ").append(names.isEmpty() ? "none yet" : names).append('.');
        sb.append(' ').append(STYLE_GUIDE);
        return sb.toString();
    }

    String eventPrompt(DomainEvent event, Collection<Attendee> attendees, List<ChatEntry> recentChat) {
        String chatContext = recentChat.isEmpty() ? "" : "\nRecent chat:\n" + recentChat.stream()
                .map(entry -> entry.sender() + ": " + entry.text())
                .collect(Collectors.joining("\n"));

        if (event instanceof DomainEvent.Joined joined) {
            return joined.name() + " just joined. There are now " + attendees.size() + " people." + chatContext;
        }
        if (event instanceof DomainEvent.Left left) {
            return left.name() + " left." + chatContext;
        }
        if (event instanceof DomainEvent.Chat chat) {
            return chat.sender() + " said: \"" + chat.text() + "\"" + chatContext;
        }
        if (event instanceof DomainEvent.IdleTick) {
            String distances = attendees.stream()
                    .filter(a -> a.getLastLatitude() != null && a.getLastLongitude() != null)
                    .map(a -> a.getDisplayName() + " is " + (long) GeoUtils.haversineMeters(
                            a.getLastLatitude(), a.getLastLongitude(), context.getLatitude(), context.getLongitude()) + "m away")
                    .collect(Collectors.joining(". "));
            return "It's been quiet. " + (distances.isEmpty() ? "No location data" : distances) + "." + chatContext;
        }
        if (event instanceof DomainEvent.LocationUpdate update) {
            return update.name() + " just arrived at the venue!" + chatContext;
        }
        return "Something happened at the event." + chatContext;
    }
}
