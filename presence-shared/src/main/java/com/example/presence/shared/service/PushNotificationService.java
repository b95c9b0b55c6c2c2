package com.example.presence.shared.service;

import com.example.presence.shared.model.PushPayload;

/**
 * Fire-and-forget delivery of device push notifications.
 */
public interface PushNotificationService {

    void dispatch(String userId, PushPayload payload);
}
