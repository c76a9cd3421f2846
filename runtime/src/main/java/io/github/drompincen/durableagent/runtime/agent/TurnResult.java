package io.github.drompincen.durableagent.runtime.agent;

import io.github.drompincen.durableagent.protocol.api.FailureKind;
import io.github.drompincen.durableagent.protocol.api.TurnResponse;
import io.github.drompincen.durableagent.protocol.api.TurnStatus;
import io.github.drompincen.durableagent.runtime.graph.WorkflowState;

public record TurnResult(WorkflowState state, String sessionId, boolean newSession, TurnStatus status,
                         FailureKind failureKind, String errorMessage) {

    public static TurnResult completed(WorkflowState state, String sessionId, boolean newSession) {
        return new TurnResult(state, sessionId, newSession, TurnStatus.COMPLETED, null, null);
    }

    public static TurnResult awaitingInput(WorkflowState state, String sessionId, boolean newSession) {
        return new TurnResult(state, sessionId, newSession, TurnStatus.AWAITING_INPUT, null, null);
    }

    public static TurnResult failed(WorkflowState state, String sessionId, boolean newSession,
                                    FailureKind kind, String errorMessage) {
        return new TurnResult(state, sessionId, newSession, TurnStatus.FAILED, kind, errorMessage);
    }

    public boolean failed() {
        return status == TurnStatus.FAILED;
    }

    public String reply() {
        return state.finalReply().orElse("");
    }

    public TurnResponse toResponse() {
        return new TurnResponse(
                sessionId,
                state.getThreadId(),
                status,
                reply(),
                state.intent().orElse(null),
                state.orderId().orElse(null),
                state.isAwaitingExternalInput(),
                state.resolution().orElse(null),
                state.getTurns().size(),
                state.getTraceId(),
                failureKind);
    }
}
