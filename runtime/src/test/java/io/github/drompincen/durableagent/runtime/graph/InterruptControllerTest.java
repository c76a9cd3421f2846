package io.github.drompincen.durableagent.runtime.graph;

import io.github.drompincen.durableagent.runtime.checkpoint.Checkpoint;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class InterruptControllerTest {

    private final InterruptController controller = new InterruptController();

    private final GraphDefinition graph = GraphDefinition.builder("g")
            .node("a", s -> s)
            .node("review", s -> s)
            .start("a")
            .edge("a", "review")
            .edge("review", GraphDefinition.END)
            .interruptBefore("review")
            .build();

    private Checkpoint checkpointAt(String nextNode) {
        WorkflowState state = WorkflowState.newThread("t", "u", "s", "trace", Instant.EPOCH);
        return new Checkpoint("t", 1, state, nextNode, Instant.EPOCH);
    }

    @Test
    void interruptsOnlyBeforeDeclaredNodes() {
        assertThat(controller.shouldInterrupt(graph, "review")).isTrue();
        assertThat(controller.shouldInterrupt(graph, "a")).isFalse();
        assertThat(controller.shouldInterrupt(graph, GraphDefinition.END)).isFalse();
    }

    @Test
    void resumeIntoInterruptedNode() {
        assertThat(controller.isResumeInto(Optional.of(checkpointAt("review")), graph)).isTrue();
    }

    @Test
    void terminalOrMissingCheckpointIsNotAResume() {
        assertThat(controller.isResumeInto(Optional.empty(), graph)).isFalse();
        assertThat(controller.isResumeInto(Optional.of(checkpointAt(null)), graph)).isFalse();
        assertThat(controller.isResumeInto(Optional.of(checkpointAt("a")), graph)).isFalse();
    }
}
