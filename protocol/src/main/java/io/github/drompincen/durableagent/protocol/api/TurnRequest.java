package io.github.drompincen.durableagent.protocol.api;

public record TurnRequest(
        String userId,
        String message,
        String sessionId
) {}
