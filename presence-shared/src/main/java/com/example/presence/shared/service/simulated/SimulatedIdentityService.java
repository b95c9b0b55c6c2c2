package com.example.presence.shared.service.simulated;

import com.example.presence.shared.aspect.Monitored;
import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.model.VerifiedIdentity;
import com.example.presence.shared.service.IdentityService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Token lookup against the tokens configured under presence.simulation.tokens.
 * A real deployment replaces this with a client of the authentication service.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Monitored("collaborator")
public class SimulatedIdentityService implements IdentityService {

    private final AppProperties appProperties;

    @Override
    public Optional<VerifiedIdentity> verifyToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        AppProperties.Simulation.SimulatedUser user = appProperties.getSimulation().getTokens().get(token);
        if (user == null) {
            log.debug("Unknown token presented");
            return Optional.empty();
        }
        return Optional.of(new VerifiedIdentity(user.getUserId(), user.getDisplayName(), user.isActive()));
    }
}
