package io.github.drompincen.durableagent.runtime.graph;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Persisted unit of work for one conversation thread.
 * <p>
 * Instances are never mutated after construction: every {@code with*} method returns a copy, so a
 * state handed to a node cannot be changed behind the engine's back and a state produced by a
 * failed node is simply dropped.
 */
public class WorkflowState {

    private String threadId;
    private String userId;
    private String sessionId;
    private String message;
    private Map<StateField, String> fields;
    private boolean awaitingExternalInput;
    private Boolean resolved;
    private String traceId;
    private List<TurnRecord> turns;
    private Instant createdAt;
    private Instant updatedAt;

    private WorkflowState() {
        this.fields = new EnumMap<>(StateField.class);
        this.turns = new ArrayList<>();
    }

    public static WorkflowState newThread(String threadId, String userId, String sessionId,
                                          String traceId, Instant now) {
        WorkflowState s = new WorkflowState();
        s.threadId = Objects.requireNonNull(threadId, "threadId");
        s.userId = userId;
        s.sessionId = sessionId;
        s.traceId = traceId;
        s.createdAt = now;
        s.updatedAt = now;
        return s;
    }

    /**
     * Starts a turn: records the input message, appends the user turn record and clears the
     * outputs of the previous turn. Business fields such as intent or order id carry forward.
     */
    public WorkflowState beginTurn(String inputMessage, Instant now) {
        WorkflowState copy = copy();
        copy.message = inputMessage;
        copy.turns.add(new TurnRecord(TurnRecord.USER, inputMessage, now));
        copy.fields.keySet().removeIf(StateField::isTurnOutput);
        copy.resolved = null;
        copy.updatedAt = now;
        return copy;
    }

    public WorkflowState withField(StateField field, String value) {
        WorkflowState copy = copy();
        if (value == null) {
            copy.fields.remove(field);
        } else {
            copy.fields.put(field, value);
        }
        return copy;
    }

    public WorkflowState withAwaitingExternalInput(boolean awaiting) {
        WorkflowState copy = copy();
        copy.awaitingExternalInput = awaiting;
        return copy;
    }

    public WorkflowState withResolved(Boolean resolved) {
        WorkflowState copy = copy();
        copy.resolved = resolved;
        return copy;
    }

    public WorkflowState withAssistantTurn(String content, Instant now) {
        WorkflowState copy = copy();
        copy.turns.add(new TurnRecord(TurnRecord.ASSISTANT, content, now));
        return copy;
    }

    public WorkflowState withUpdatedAt(Instant now) {
        WorkflowState copy = copy();
        copy.updatedAt = now;
        return copy;
    }

    private WorkflowState copy() {
        WorkflowState s = new WorkflowState();
        s.threadId = this.threadId;
        s.userId = this.userId;
        s.sessionId = this.sessionId;
        s.message = this.message;
        s.fields = this.fields.isEmpty() ? new EnumMap<>(StateField.class) : new EnumMap<>(this.fields);
        s.awaitingExternalInput = this.awaitingExternalInput;
        s.resolved = this.resolved;
        s.traceId = this.traceId;
        s.turns = new ArrayList<>(this.turns);
        s.createdAt = this.createdAt;
        s.updatedAt = this.updatedAt;
        return s;
    }

    public Optional<String> field(StateField field) {
        return Optional.ofNullable(fields.get(field));
    }

    public Optional<String> intent() { return field(StateField.INTENT); }
    public Optional<String> orderId() { return field(StateField.ORDER_ID); }
    public Optional<String> pendingAction() { return field(StateField.PENDING_ACTION); }
    public Optional<String> draftReply() { return field(StateField.DRAFT_REPLY); }
    public Optional<String> finalReply() { return field(StateField.FINAL_REPLY); }

    public Optional<Boolean> resolution() { return Optional.ofNullable(resolved); }

    /** Business fields whose value differs between this state and {@code other}. */
    public Set<StateField> changedFields(WorkflowState other) {
        Set<StateField> changed = EnumSet.noneOf(StateField.class);
        for (StateField f : StateField.values()) {
            if (!Objects.equals(fields.get(f), other.fields.get(f))) {
                changed.add(f);
            }
        }
        return changed;
    }

    /** True when this state's turn records start with all of {@code earlier}'s records. */
    public boolean extendsTurnsOf(WorkflowState earlier) {
        return turns.size() >= earlier.turns.size()
                && turns.subList(0, earlier.turns.size()).equals(earlier.turns);
    }

    /** True when everything except the business fields is identical. */
    public boolean hasSameEnvelope(WorkflowState other) {
        return Objects.equals(threadId, other.threadId)
                && Objects.equals(userId, other.userId)
                && Objects.equals(sessionId, other.sessionId)
                && Objects.equals(message, other.message)
                && awaitingExternalInput == other.awaitingExternalInput
                && Objects.equals(resolved, other.resolved)
                && Objects.equals(traceId, other.traceId)
                && Objects.equals(turns, other.turns)
                && Objects.equals(createdAt, other.createdAt)
                && Objects.equals(updatedAt, other.updatedAt);
    }

    public String getThreadId() { return threadId; }
    public String getUserId() { return userId; }
    public String getSessionId() { return sessionId; }
    public String getMessage() { return message; }
    public boolean isAwaitingExternalInput() { return awaitingExternalInput; }
    public String getTraceId() { return traceId; }
    public List<TurnRecord> getTurns() { return Collections.unmodifiableList(turns); }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkflowState other)) return false;
        return hasSameEnvelope(other) && Objects.equals(fields, other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(threadId, userId, sessionId, message, fields, awaitingExternalInput,
                resolved, traceId, turns, createdAt, updatedAt);
    }

    @Override
    public String toString() {
        return "WorkflowState{thread=" + threadId + ", fields=" + fields
                + ", awaiting=" + awaitingExternalInput + ", resolved=" + resolved
                + ", turns=" + turns.size() + "}";
    }
}
