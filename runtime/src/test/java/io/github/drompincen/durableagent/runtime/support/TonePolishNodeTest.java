package io.github.drompincen.durableagent.runtime.support;

import io.github.drompincen.durableagent.runtime.graph.StateField;
import io.github.drompincen.durableagent.runtime.graph.WorkflowState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TonePolishNodeTest {

    @Mock
    private ReplyPolisher polisher;

    private WorkflowState input(String draft) {
        WorkflowState s = WorkflowState.newThread("u1:s1", "u1", "s1", "trace", Instant.EPOCH)
                .beginTurn("hello", Instant.EPOCH);
        return draft == null ? s : s.withField(StateField.DRAFT_REPLY, draft);
    }

    @Test
    void writesFinalReplyAndSource() {
        when(polisher.polish("hello", "draft")).thenReturn(PolishResult.enriched("Polished"));

        WorkflowState result = new TonePolishNode(polisher).apply(input("draft"));

        assertThat(result.finalReply()).contains("Polished");
        assertThat(result.field(StateField.REPLY_SOURCE)).contains("enriched");
        assertThat(result.draftReply()).contains("draft");
    }

    @Test
    void missingDraftUsesDefault() {
        when(polisher.polish("hello", TonePolishNode.DEFAULT_DRAFT))
                .thenReturn(PolishResult.fallback(TonePolishNode.DEFAULT_DRAFT, "llm unavailable"));

        WorkflowState result = new TonePolishNode(polisher).apply(input(null));

        assertThat(result.finalReply()).contains(TonePolishNode.DEFAULT_DRAFT);
        assertThat(result.field(StateField.REPLY_SOURCE)).contains("fallback");
    }
}
