package com.example.presence.shared.model;

import java.util.Map;

public record PushPayload(String title, String body, Map<String, String> data) {}
