package com.example.presence.shared.util;

public final class Constants {

    private Constants() {}

    public static final String PING = "ping";
    public static final String PONG = "pong";

    public static final class CloseCodes {
        private CloseCodes() {}
        public static final int INVALID_IDENTITY = 4001;
        public static final int NOT_A_PARTICIPANT = 4003;
        public static final int EVENT_NOT_FOUND = 4004;
        public static final int BAD_HANDSHAKE = 4400;
        public static final int RATE_LIMITED = 4429;
    }

    public static final class MessageTypes {
        private MessageTypes() {}
        // inbound
        public static final String GUEST_LOCATION = "guest_location";
        public static final String GUEST_STOP_SHARING = "guest_stop_sharing";
        public static final String CHAT_MESSAGE = "chat_message";
        public static final String GUEST_LEAVE = "guest_leave";
        // outbound
        public static final String INITIAL_STATE = "initial_state";
        public static final String GUEST_JOINED = "guest_joined";
        public static final String GUEST_LEFT = "guest_left";
        public static final String GUEST_LOCATION_SHARED = "guest_location_shared";
        public static final String GUEST_LOCATION_STOPPED = "guest_location_stopped";
        public static final String CHAT_HISTORY = "chat_history";
    }

    public enum ParticipantKind {
        MEMBER,
        GUEST
    }

    public enum SenderKind {
        MEMBER,
        GUEST,
        COMMENTARY
    }
}
