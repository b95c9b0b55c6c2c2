package com.example.presence.shared.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@Validated
public class AppProperties {

    private String podName;
    private String clusterName;

    private final Bus bus = new Bus();
    private final Session session = new Session();
    private final Commentary commentary = new Commentary();
    private final Anthropic anthropic = new Anthropic();
    private final Simulation simulation = new Simulation();

    public enum DegradedMode {
        /** Deliver to this pod's connections only; remote pods miss the message. */
        LOCAL_ONLY,
        /** Deliver locally and republish on the bus once it is reachable again. */
        LOCAL_AND_REPLAY
    }

    @Data
    public static class Bus {
        @NotBlank
        private String channelPrefix = "presence";
        @Positive
        private long reconnectBackoff = 2000L;
        private DegradedMode degradedMode = DegradedMode.LOCAL_ONLY;
        @Positive
        private int replayBufferSize = 500;
    }

    @Data
    public static class Session {
        @Positive
        private int chatMaxLength = 500;
        @Positive
        private int displayNameMaxLength = 50;
        @Positive
        private long dropGracePeriod = 600000L;
        @Positive
        private long sweepInterval = 60000L;
        @Positive
        private int dedupeWindow = 128;
        @Positive
        private int outboundBufferSize = 256;
        @Positive
        private int handshakeRateLimit = 50;
    }

    @Data
    public static class Commentary {
        private boolean enabled = true;
        @Positive
        private long cooldown = 30000L;
        @Positive
        private long idleTimeout = 120000L;
        @Positive
        private double farThresholdMeters = 100.0;
        @Positive
        private double arrivedThresholdMeters = 50.0;
        @Positive
        private int chatHistorySize = 50;
        @Positive
        private int queueCapacity = 100;
        @Positive
        private int contextChatLines = 8;
        @NotBlank
        private String senderName = "Event AI";
        @Positive
        private long generationTimeout = 10000L;
        @Positive
        private long shutdownTimeout = 5000L;
        /** Worker threads for commentary loops; engines beyond this wait for a free worker and stay silent meanwhile. */
        @Positive
        private int maxEngines = 200;
    }

    @Data
    public static class Anthropic {
        private String apiKey = "";
        private String baseUrl = "https://api.anthropic.com";
        private String model = "claude-3-5-haiku-latest";
        @Positive
        private int maxTokens = 150;
        private String apiVersion = "2023-06-01";
    }

    /**
     * Seed data for the in-memory collaborators used when no real user/event store is wired in.
     */
    @Data
    public static class Simulation {
        private Map<String, SimulatedUser> tokens = new HashMap<>();
        private Map<String, SimulatedEvent> events = new HashMap<>();

        @Data
        public static class SimulatedUser {
            private String userId;
            private String displayName;
            private boolean active = true;
        }

        @Data
        public static class SimulatedEvent {
            private String venueName;
            private String venueAddress;
            private double latitude;
            private double longitude;
            private String hostName;
            private String message;
            private boolean active = true;
            private List<String> participants = new ArrayList<>();
        }
    }
}
