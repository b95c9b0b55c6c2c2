package com.example.presence.shared.service.simulated;

import com.example.presence.shared.aspect.Monitored;
import com.example.presence.shared.model.PushPayload;
import com.example.presence.shared.service.PushNotificationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Stand-in for the device push gateway: records what would have been sent.
 */
@Service
@Slf4j
@Monitored("collaborator")
public class LoggingPushNotificationService implements PushNotificationService {

    @Override
    public void dispatch(String userId, PushPayload payload) {
        log.info("Push to user {}: '{}' - {}", userId, payload.title(), payload.body());
    }
}
