package com.example.presence.live.bus;

@FunctionalInterface
public interface BusMessageHandler {

    void onMessage(String channel, String payload);
}
