package com.example.presence.shared.service;

import com.example.presence.shared.model.VerifiedIdentity;

import java.util.Optional;

/**
 * Validates bearer tokens issued by the authentication service.
 */
public interface IdentityService {

    /**
     * @return the identity behind the token, or empty when the token is unknown, malformed or expired
     */
    Optional<VerifiedIdentity> verifyToken(String token);
}
