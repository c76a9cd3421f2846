package io.github.drompincen.durableagent.runtime.graph;

/**
 * Named business fields carried by a {@link WorkflowState}. Every field is optional; nodes
 * declare which of them they own when they are registered in a {@link GraphDefinition}.
 */
public enum StateField {
    INTENT,
    ORDER_ID,
    PENDING_ACTION,
    DRAFT_REPLY,
    FINAL_REPLY,
    REPLY_SOURCE;

    /** Fields produced fresh by every turn; cleared when new input arrives. */
    public boolean isTurnOutput() {
        return this == DRAFT_REPLY || this == FINAL_REPLY || this == REPLY_SOURCE;
    }
}
