package io.github.drompincen.durableagent.protocol.api;

public record TurnResponse(
        String sessionId,
        String threadId,
        TurnStatus status,
        String reply,
        String intent,
        String orderId,
        boolean awaitingExternalInput,
        Boolean resolved,
        int turnCount,
        String traceId,
        FailureKind failureKind
) {}
