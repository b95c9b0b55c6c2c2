package com.example.presence.live;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Live presence service: WebSocket sessions for live events, cluster fan-out over Redis Pub/Sub
 * and per-event commentary.
 */
@SpringBootApplication(scanBasePackages = "com.example.presence")
@EnableScheduling
public class PresenceLiveApplication {

    public static void main(String[] args) {
        SpringApplication.run(PresenceLiveApplication.class, args);
    }
}
