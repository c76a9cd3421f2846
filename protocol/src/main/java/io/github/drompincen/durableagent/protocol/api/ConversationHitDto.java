package io.github.drompincen.durableagent.protocol.api;

import java.time.Instant;

public record ConversationHitDto(
        String threadId,
        String sessionId,
        String userId,
        String intent,
        String orderId,
        boolean resolved,
        boolean awaitingExternalInput,
        int messageCount,
        Instant timestamp,
        String traceId
) {}
