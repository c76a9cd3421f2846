package io.github.drompincen.durableagent.runtime.graph;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowStateTest {

    private static final Instant T0 = Instant.parse("2024-12-01T10:00:00Z");
    private static final Instant T1 = Instant.parse("2024-12-01T10:05:00Z");

    private WorkflowState fresh() {
        return WorkflowState.newThread("u1:s1", "u1", "s1", "abcd1234", T0);
    }

    @Test
    void newThreadHasNoFieldsOrTurns() {
        WorkflowState state = fresh();

        assertThat(state.intent()).isEmpty();
        assertThat(state.resolution()).isEmpty();
        assertThat(state.getTurns()).isEmpty();
        assertThat(state.isAwaitingExternalInput()).isFalse();
        assertThat(state.getCreatedAt()).isEqualTo(T0);
    }

    @Test
    void withFieldReturnsNewInstance() {
        WorkflowState original = fresh();
        WorkflowState changed = original.withField(StateField.INTENT, "faq");

        assertThat(changed).isNotSameAs(original);
        assertThat(changed.intent()).contains("faq");
        assertThat(original.intent()).isEmpty();
    }

    @Test
    void withFieldNullRemovesValue() {
        WorkflowState state = fresh().withField(StateField.ORDER_ID, "12345").withField(StateField.ORDER_ID, null);

        assertThat(state.orderId()).isEmpty();
    }

    @Test
    void beginTurnAppendsUserRecordAndClearsTurnOutputs() {
        WorkflowState previous = fresh()
                .withField(StateField.INTENT, "order")
                .withField(StateField.ORDER_ID, "67890")
                .withField(StateField.DRAFT_REPLY, "draft")
                .withField(StateField.FINAL_REPLY, "final")
                .withResolved(true);

        WorkflowState next = previous.beginTurn("When will it arrive?", T1);

        assertThat(next.getMessage()).isEqualTo("When will it arrive?");
        assertThat(next.getTurns()).containsExactly(new TurnRecord(TurnRecord.USER, "When will it arrive?", T1));
        assertThat(next.draftReply()).isEmpty();
        assertThat(next.finalReply()).isEmpty();
        assertThat(next.resolution()).isEmpty();
        assertThat(next.intent()).contains("order");
        assertThat(next.orderId()).contains("67890");
        assertThat(next.getUpdatedAt()).isEqualTo(T1);
    }

    @Test
    void changedFieldsListsOnlyDifferences() {
        WorkflowState a = fresh().withField(StateField.INTENT, "faq");
        WorkflowState b = a.withField(StateField.INTENT, "order").withField(StateField.DRAFT_REPLY, "x");

        assertThat(a.changedFields(b)).containsExactlyInAnyOrder(StateField.INTENT, StateField.DRAFT_REPLY);
        assertThat(a.changedFields(a)).isEmpty();
    }

    @Test
    void extendsTurnsOfDetectsRewrittenHistory() {
        WorkflowState one = fresh().beginTurn("hi", T0);
        WorkflowState two = one.withAssistantTurn("hello", T1);
        WorkflowState other = fresh().beginTurn("different", T0);

        assertThat(two.extendsTurnsOf(one)).isTrue();
        assertThat(one.extendsTurnsOf(two)).isFalse();
        assertThat(other.extendsTurnsOf(one)).isFalse();
    }

    @Test
    void turnsAreReadOnly() {
        WorkflowState state = fresh().beginTurn("hi", T0);

        assertThatThrownBy(() -> state.getTurns().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
