package com.example.presence.live.session;

import com.example.presence.shared.config.AppProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Forgets participants whose connection dropped and never came back within the grace period, so
 * their next connection is announced as a new join.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LiveRecordSweeper {

    private final LivePresenceStore presenceStore;
    private final AppProperties appProperties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${presence.session.sweep-interval:60000}", initialDelayString = "${presence.session.sweep-interval:60000}")
    public void sweepExpiredRecords() {
        try {
            Duration grace = Duration.ofMillis(appProperties.getSession().getDropGracePeriod());
            int removed = presenceStore.sweepExpired(clock.instant().minus(grace));
            log.debug("Live record sweep complete, {} removed", removed);
        } catch (Exception e) {
            log.error("Error during live record sweep: {}", e.getMessage(), e);
        }
    }
}
