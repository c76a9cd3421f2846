package io.github.drompincen.durableagent.runtime.index;

import io.github.drompincen.durableagent.runtime.graph.StateField;
import io.github.drompincen.durableagent.runtime.graph.WorkflowState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class IndexerTest {

    private final RecordingSearchIndex index = new RecordingSearchIndex();
    private Indexer indexer;

    @AfterEach
    void tearDown() {
        if (indexer != null) {
            indexer.shutdown();
        }
    }

    private WorkflowState state(String threadId, String message) {
        return WorkflowState.newThread(threadId, "u1", "s1", "trace", Instant.EPOCH)
                .beginTurn(message, Instant.EPOCH)
                .withField(StateField.INTENT, "faq")
                .withResolved(true);
    }

    @Test
    void publishedStateIsIndexed() throws Exception {
        indexer = new Indexer(index, 3, 1, 100);

        indexer.publish(state("u1:s1", "return policy"));

        assertThat(indexer.awaitIdle(Duration.ofSeconds(5))).isTrue();
        SearchDocument doc = index.documents().get("u1:s1");
        assertThat(doc.intent()).isEqualTo("faq");
        assertThat(doc.resolved()).isTrue();
        assertThat(doc.messages()).isEqualTo("return policy");
        assertThat(indexer.indexedCount()).isEqualTo(1);
    }

    @Test
    void republishOverwritesDocument() throws Exception {
        indexer = new Indexer(index, 3, 1, 100);

        indexer.publish(state("u1:s1", "first"));
        indexer.awaitIdle(Duration.ofSeconds(5));
        indexer.publish(state("u1:s1", "second"));
        indexer.awaitIdle(Duration.ofSeconds(5));

        assertThat(index.documents()).hasSize(1);
        assertThat(index.documents().get("u1:s1").messages()).isEqualTo("second");
    }

    @Test
    void transientFailuresAreRetried() throws Exception {
        index.failNext(2);
        indexer = new Indexer(index, 3, 1, 100);

        indexer.publish(state("u1:s1", "hello"));

        assertThat(indexer.awaitIdle(Duration.ofSeconds(5))).isTrue();
        assertThat(index.attempts()).isEqualTo(3);
        assertThat(index.documents()).containsKey("u1:s1");
        assertThat(indexer.failedCount()).isZero();
    }

    @Test
    void persistentFailureIsDroppedAfterMaxAttempts() throws Exception {
        index.failAlways(true);
        indexer = new Indexer(index, 2, 1, 100);

        indexer.publish(state("u1:s1", "hello"));

        assertThat(indexer.awaitIdle(Duration.ofSeconds(5))).isTrue();
        assertThat(index.attempts()).isEqualTo(2);
        assertThat(indexer.failedCount()).isEqualTo(1);
        assertThat(index.documents()).isEmpty();
    }

    @Test
    void publishDoesNotBlockWhileIndexIsSlow() throws Exception {
        index.failAlways(true);
        indexer = new Indexer(index, 2, 50, 100);

        long start = System.nanoTime();
        for (int i = 0; i < 10; i++) {
            indexer.publish(state("u1:s" + i, "msg " + i));
        }
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertThat(elapsedMs).isLessThan(500);
    }

    @Test
    void overflowIsDropped() {
        index.failAlways(true);
        indexer = new Indexer(index, 2, 300, 1);

        for (int i = 0; i < 5; i++) {
            indexer.publish(state("u1:s" + i, "msg " + i));
        }

        assertThat(indexer.droppedCount()).isPositive();
    }

    @Test
    void disabledIndexSkipsPublishing() throws Exception {
        indexer = new Indexer(new DisabledSearchIndex(), 3, 1, 100);

        indexer.publish(state("u1:s1", "hello"));

        assertThat(indexer.awaitIdle(Duration.ofMillis(100))).isTrue();
        assertThat(indexer.indexedCount()).isZero();
    }
}
