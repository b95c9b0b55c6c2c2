package com.example.presence.live.protocol.inbound;

import com.example.presence.shared.util.Constants;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class InboundMessageDecoder {

    private final ObjectMapper objectMapper;

    public InboundMessage decode(String frame) {
        if (frame == null || frame.isBlank()) {
            return UnknownMessage.INSTANCE;
        }
        if (Constants.PING.equals(frame.trim())) {
            return LivenessProbe.INSTANCE;
        }
        try {
            InboundMessage message = objectMapper.readValue(frame, InboundMessage.class);
            return message != null ? message : UnknownMessage.INSTANCE;
        } catch (JsonProcessingException e) {
            log.debug("Ignoring undecodable frame: {}", e.getOriginalMessage());
            return UnknownMessage.INSTANCE;
        }
    }
}
