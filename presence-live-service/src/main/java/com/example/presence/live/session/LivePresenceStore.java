package com.example.presence.live.session;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * "Who is here" for every event live on this pod. Every mutation of an event's records runs inside
 * {@link ConcurrentHashMap#compute} on that event, so joins, drops and leaves for one event are
 * serialized and the first-join check is atomic with record creation.
 */
@Component
@Slf4j
public class LivePresenceStore {

    private final Map<String, Map<String, LiveRecord>> events = new ConcurrentHashMap<>();
    private final Clock clock;

    public LivePresenceStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * Result of attaching a connection.
     *
     * @param firstJoin           no record existed, this is a new arrival
     * @param firstLiveConnection no other connection for this participant was live
     */
    public record AttachResult(LiveRecord record, boolean firstJoin, boolean firstLiveConnection) {}

    /**
     * @param lastConnection this was the participant's last live connection
     */
    public record DetachResult(LiveRecord record, boolean lastConnection) {}

    public AttachResult attach(String eventId, Participant participant) {
        AtomicReference<AttachResult> result = new AtomicReference<>();
        events.compute(eventId, (id, records) -> {
            Map<String, LiveRecord> current = records != null ? records : new HashMap<>();
            LiveRecord existing = current.get(participant.key());
            LiveRecord updated;
            if (existing == null) {
                updated = LiveRecord.builder()
                        .participant(participant)
                        .liveConnections(1)
                        .joinedAt(clock.instant())
                        .build();
            } else {
                updated = existing.toBuilder()
                        .participant(participant)
                        .liveConnections(existing.getLiveConnections() + 1)
                        .droppedAt(null)
                        .build();
            }
            current.put(participant.key(), updated);
            result.set(new AttachResult(updated, existing == null, existing == null || existing.getLiveConnections() == 0));
            return current;
        });
        return result.get();
    }

    /**
     * Accounts for a closed transport. When the last connection goes the record stays, with
     * sharing cleared and the drop time stamped.
     */
    public Optional<DetachResult> detach(String eventId, Participant participant) {
        AtomicReference<DetachResult> result = new AtomicReference<>();
        events.computeIfPresent(eventId, (id, records) -> {
            LiveRecord existing = records.get(participant.key());
            if (existing == null) {
                return records;
            }
            int remaining = Math.max(0, existing.getLiveConnections() - 1);
            LiveRecord updated = remaining > 0
                    ? existing.toBuilder().liveConnections(remaining).build()
                    : existing.toBuilder().liveConnections(0).sharing(false).droppedAt(clock.instant()).build();
            records.put(participant.key(), updated);
            result.set(new DetachResult(updated, remaining == 0));
            return records;
        });
        return Optional.ofNullable(result.get());
    }

    /** Explicit leave: the record is gone regardless of other connections. */
    public Optional<LiveRecord> remove(String eventId, Participant participant) {
        AtomicReference<LiveRecord> removed = new AtomicReference<>();
        events.computeIfPresent(eventId, (id, records) -> {
            removed.set(records.remove(participant.key()));
            return records.isEmpty() ? null : records;
        });
        return Optional.ofNullable(removed.get());
    }

    /**
     * Stores new coordinates and turns sharing on.
     *
     * @return the previous record state, or empty if the participant has no record
     */
    public Optional<LiveRecord> updateLocation(String eventId, Participant participant, double latitude, double longitude) {
        AtomicReference<LiveRecord> previous = new AtomicReference<>();
        events.computeIfPresent(eventId, (id, records) -> {
            LiveRecord existing = records.get(participant.key());
            if (existing != null) {
                previous.set(existing);
                records.put(participant.key(), existing.toBuilder()
                        .latitude(latitude)
                        .longitude(longitude)
                        .sharing(true)
                        .build());
            }
            return records;
        });
        return Optional.ofNullable(previous.get());
    }

    public Optional<LiveRecord> stopSharing(String eventId, Participant participant) {
        AtomicReference<LiveRecord> updated = new AtomicReference<>();
        events.computeIfPresent(eventId, (id, records) -> {
            LiveRecord existing = records.get(participant.key());
            if (existing != null) {
                LiveRecord next = existing.toBuilder().sharing(false).build();
                records.put(participant.key(), next);
                updated.set(next);
            }
            return records;
        });
        return Optional.ofNullable(updated.get());
    }

    public Optional<LiveRecord> find(String eventId, Participant participant) {
        return Optional.ofNullable(snapshotOf(eventId).get(participant.key()));
    }

    /** Participants currently sharing a known location. */
    public List<LiveRecord> sharingSnapshot(String eventId) {
        return snapshotOf(eventId).values().stream()
                .filter(LiveRecord::isSharing)
                .filter(LiveRecord::hasLocation)
                .toList();
    }

    /**
     * Forgets records whose last connection dropped before {@code cutoff}.
     *
     * @return the number of records removed
     */
    public int sweepExpired(Instant cutoff) {
        int removed = 0;
        for (String eventId : new ArrayList<>(events.keySet())) {
            AtomicReference<Integer> count = new AtomicReference<>(0);
            events.computeIfPresent(eventId, (id, records) -> {
                int before = records.size();
                records.values().removeIf(r -> r.getDroppedAt() != null && r.getDroppedAt().isBefore(cutoff));
                count.set(before - records.size());
                return records.isEmpty() ? null : records;
            });
            removed += count.get();
        }
        if (removed > 0) {
            log.info("Swept {} live records past their reconnect grace period", removed);
        }
        return removed;
    }

    public int eventCount() {
        return events.size();
    }

    public int recordCount() {
        return events.values().stream().mapToInt(Map::size).sum();
    }

    private Map<String, LiveRecord> snapshotOf(String eventId) {
        // Copy under the bin lock so readers never see a half-applied compute
        AtomicReference<Map<String, LiveRecord>> copy = new AtomicReference<>(Map.of());
        events.computeIfPresent(eventId, (id, current) -> {
            copy.set(new HashMap<>(current));
            return current;
        });
        return copy.get();
    }
}
