package io.github.drompincen.durableagent.runtime.session;

public record ThreadResolution(String threadId, String sessionId, boolean isNew) {
}
