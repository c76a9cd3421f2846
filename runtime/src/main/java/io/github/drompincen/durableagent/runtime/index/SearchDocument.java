package io.github.drompincen.durableagent.runtime.index;

import io.github.drompincen.durableagent.protocol.api.ConversationHitDto;
import io.github.drompincen.durableagent.runtime.graph.TurnRecord;
import io.github.drompincen.durableagent.runtime.graph.WorkflowState;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/** Searchable projection of a thread's state. Rebuilt from scratch on every publish. */
public record SearchDocument(
        String threadId,
        String sessionId,
        String userId,
        String intent,
        String orderId,
        boolean resolved,
        boolean awaitingExternalInput,
        String messages,
        List<TurnRecord> turns,
        Instant timestamp,
        String traceId
) {

    public SearchDocument {
        turns = List.copyOf(turns);
    }

    public static SearchDocument from(WorkflowState state) {
        List<TurnRecord> turns = state.getTurns();
        return new SearchDocument(
                state.getThreadId(),
                state.getSessionId(),
                state.getUserId(),
                state.intent().orElse(null),
                state.orderId().orElse(null),
                state.resolution().orElse(false),
                state.isAwaitingExternalInput(),
                turns.stream().map(TurnRecord::getContent).collect(Collectors.joining(" ")),
                turns,
                state.getUpdatedAt(),
                state.getTraceId());
    }

    public ConversationHitDto toHit() {
        return new ConversationHitDto(threadId, sessionId, userId, intent, orderId, resolved,
                awaitingExternalInput, turns.size(), timestamp, traceId);
    }
}
