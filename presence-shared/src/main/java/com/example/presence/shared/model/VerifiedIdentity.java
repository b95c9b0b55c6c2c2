package com.example.presence.shared.model;

/**
 * Result of validating a bearer token. An inactive identity is known but must not connect.
 */
public record VerifiedIdentity(String userId, String displayName, boolean active) {}
