package io.github.drompincen.durableagent.runtime.index;

import io.github.drompincen.durableagent.protocol.api.ConversationHitDto;
import io.github.drompincen.durableagent.runtime.graph.StateField;
import io.github.drompincen.durableagent.runtime.graph.WorkflowState;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SearchDocumentTest {

    @Test
    void projectsStateAndConcatenatesTurnText() {
        Instant t = Instant.parse("2024-12-01T10:00:00Z");
        WorkflowState state = WorkflowState.newThread("u1:s1", "u1", "s1", "abcd1234", t)
                .beginTurn("What's your return policy?", t)
                .withField(StateField.INTENT, "faq")
                .withAssistantTurn("30 days.", t)
                .withResolved(true);

        SearchDocument doc = SearchDocument.from(state);

        assertThat(doc.messages()).isEqualTo("What's your return policy? 30 days.");
        assertThat(doc.intent()).isEqualTo("faq");
        assertThat(doc.orderId()).isNull();
        assertThat(doc.resolved()).isTrue();
        assertThat(doc.traceId()).isEqualTo("abcd1234");

        ConversationHitDto hit = doc.toHit();
        assertThat(hit.messageCount()).isEqualTo(2);
        assertThat(hit.threadId()).isEqualTo("u1:s1");
    }

    @Test
    void unresolvedStateProjectsFalse() {
        WorkflowState state = WorkflowState.newThread("u1:s1", "u1", "s1", "t", Instant.EPOCH)
                .withAwaitingExternalInput(true);

        SearchDocument doc = SearchDocument.from(state);

        assertThat(doc.resolved()).isFalse();
        assertThat(doc.awaitingExternalInput()).isTrue();
    }
}
