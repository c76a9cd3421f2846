package io.github.drompincen.durableagent.runtime.graph;

public record TurnInput(String threadId, String userId, String sessionId, String message) {
}
