package io.github.drompincen.durableagent.runtime.graph;

import io.github.drompincen.durableagent.runtime.checkpoint.Checkpoint;
import io.github.drompincen.durableagent.runtime.checkpoint.CheckpointManager;
import io.github.drompincen.durableagent.runtime.checkpoint.InMemoryStateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphEngineTest {

    private static final String THREAD = "u1:s1";

    private InMemoryStateStore store;
    private CheckpointManager checkpointManager;
    private GraphEngine engine;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-12-01T10:00:00Z"), ZoneOffset.UTC);
        store = new InMemoryStateStore();
        checkpointManager = new CheckpointManager(store, clock);
        engine = new GraphEngine(checkpointManager, new InterruptController(), clock);
    }

    private TurnExecution run(GraphDefinition graph, String message) {
        Optional<Checkpoint> prior = checkpointManager.load(THREAD);
        WorkflowState prepared = engine.beginTurn(prior, new TurnInput(THREAD, "u1", "s1", message));
        return engine.executeTurn(graph, prepared, prior);
    }

    @Test
    void newThreadGetsShortTraceIdAndUserRecord() {
        WorkflowState state = engine.beginTurn(Optional.empty(), new TurnInput(THREAD, "u1", "s1", "hello"));

        assertThat(state.getTraceId()).hasSize(8);
        assertThat(state.getTurns()).extracting(TurnRecord::getRole).containsExactly(TurnRecord.USER);
        assertThat(state.getMessage()).isEqualTo("hello");
    }

    @Test
    void linearGraphCompletesAndCheckpointsEveryNode() {
        GraphDefinition graph = GraphDefinition.builder("linear")
                .node("a", s -> s.withField(StateField.INTENT, "faq"), StateField.INTENT)
                .node("b", s -> s.withField(StateField.FINAL_REPLY, "done"), StateField.FINAL_REPLY)
                .start("a")
                .edge("a", "b")
                .edge("b", GraphDefinition.END)
                .build();

        TurnExecution result = run(graph, "hi");

        assertThat(result.outcome()).isEqualTo(TurnExecution.Outcome.COMPLETED);
        assertThat(result.steps()).isEqualTo(2);
        assertThat(result.checkpointVersion()).isEqualTo(2);
        assertThat(result.nextNode()).isNull();
        assertThat(result.state().resolution()).contains(true);
        assertThat(result.state().isAwaitingExternalInput()).isFalse();
        assertThat(result.state().getTurns()).extracting(TurnRecord::getRole)
                .containsExactly(TurnRecord.USER, TurnRecord.ASSISTANT);

        Checkpoint saved = checkpointManager.load(THREAD).orElseThrow();
        assertThat(saved.version()).isEqualTo(2);
        assertThat(saved.hasNextNode()).isFalse();
        assertThat(saved.state()).isEqualTo(result.state());
    }

    @Test
    void noAssistantRecordWithoutFinalReply() {
        GraphDefinition graph = GraphDefinition.builder("silent")
                .node("a", s -> s)
                .start("a")
                .edge("a", GraphDefinition.END)
                .build();

        TurnExecution result = run(graph, "hi");

        assertThat(result.state().getTurns()).extracting(TurnRecord::getRole).containsExactly(TurnRecord.USER);
    }

    @Test
    void resolutionPolicyDecidesResolvedFlag() {
        GraphDefinition graph = GraphDefinition.builder("policy")
                .node("a", s -> s.withField(StateField.PENDING_ACTION, "verify"), StateField.PENDING_ACTION)
                .start("a")
                .edge("a", GraphDefinition.END)
                .resolutionPolicy(s -> s.pendingAction().isEmpty())
                .build();

        assertThat(run(graph, "hi").state().resolution()).contains(false);
    }

    @Test
    void haltsBeforeInterruptNodeAndResumesIntoIt() {
        AtomicInteger reviewCalls = new AtomicInteger();
        GraphDefinition graph = GraphDefinition.builder("review")
                .node("triage", s -> s.withField(StateField.INTENT, "human")
                        .withField(StateField.DRAFT_REPLY, "escalated"), StateField.INTENT, StateField.DRAFT_REPLY)
                .node("review", s -> {
                    reviewCalls.incrementAndGet();
                    return s.withField(StateField.FINAL_REPLY, "reviewed: " + s.getMessage());
                }, StateField.FINAL_REPLY)
                .start("triage")
                .edge("triage", "review")
                .edge("review", GraphDefinition.END)
                .interruptBefore("review")
                .build();

        TurnExecution halted = run(graph, "I am furious");

        assertThat(halted.interrupted()).isTrue();
        assertThat(halted.nextNode()).isEqualTo("review");
        assertThat(halted.state().isAwaitingExternalInput()).isTrue();
        assertThat(halted.state().resolution()).contains(false);
        assertThat(halted.state().finalReply()).contains("escalated");
        assertThat(reviewCalls).hasValue(0);
        assertThat(checkpointManager.load(THREAD).orElseThrow().nextNode()).isEqualTo("review");

        TurnExecution resumed = run(graph, "approved");

        assertThat(reviewCalls).hasValue(1);
        assertThat(resumed.outcome()).isEqualTo(TurnExecution.Outcome.COMPLETED);
        assertThat(resumed.state().finalReply()).contains("reviewed: approved");
        assertThat(resumed.state().intent()).contains("human");
        assertThat(resumed.state().isAwaitingExternalInput()).isFalse();
        assertThat(resumed.state().resolution()).contains(true);
        assertThat(resumed.state().getTurns()).hasSize(4);
    }

    @Test
    void interruptBeforeStartNodeHaltsWithoutRunningIt() {
        AtomicInteger calls = new AtomicInteger();
        GraphDefinition graph = GraphDefinition.builder("gate")
                .node("gate", s -> {
                    calls.incrementAndGet();
                    return s;
                })
                .start("gate")
                .edge("gate", GraphDefinition.END)
                .interruptBefore("gate")
                .build();

        TurnExecution first = run(graph, "hello");

        assertThat(first.interrupted()).isTrue();
        assertThat(first.steps()).isZero();
        assertThat(calls).hasValue(0);

        TurnExecution second = run(graph, "go");

        assertThat(second.outcome()).isEqualTo(TurnExecution.Outcome.COMPLETED);
        assertThat(calls).hasValue(1);
    }

    @Test
    void failingNodeLeavesLastCheckpointAndRetryContinuesFromIt() {
        AtomicInteger aCalls = new AtomicInteger();
        AtomicInteger bCalls = new AtomicInteger();
        GraphDefinition graph = GraphDefinition.builder("flaky")
                .node("a", s -> {
                    aCalls.incrementAndGet();
                    return s.withField(StateField.ORDER_ID, "12345");
                }, StateField.ORDER_ID)
                .node("b", s -> {
                    if (bCalls.incrementAndGet() == 1) {
                        throw new IllegalStateException("boom");
                    }
                    return s.withField(StateField.FINAL_REPLY, "ok");
                }, StateField.FINAL_REPLY)
                .start("a")
                .edge("a", "b")
                .edge("b", GraphDefinition.END)
                .build();

        assertThatThrownBy(() -> run(graph, "first"))
                .isInstanceOf(NodeExecutionException.class)
                .hasMessageContaining("'b'")
                .hasRootCauseMessage("boom");

        Checkpoint afterFailure = checkpointManager.load(THREAD).orElseThrow();
        assertThat(afterFailure.version()).isEqualTo(1);
        assertThat(afterFailure.nextNode()).isEqualTo("b");
        assertThat(afterFailure.state().finalReply()).isEmpty();

        TurnExecution retry = run(graph, "first");

        assertThat(aCalls).hasValue(1);
        assertThat(retry.state().orderId()).contains("12345");
        assertThat(retry.state().finalReply()).contains("ok");
    }

    @Test
    void nodeChangingUnownedFieldIsRejected() {
        GraphDefinition graph = GraphDefinition.builder("rogue")
                .node("a", s -> s.withField(StateField.INTENT, "faq"), StateField.DRAFT_REPLY)
                .start("a")
                .edge("a", GraphDefinition.END)
                .build();

        assertThatThrownBy(() -> run(graph, "hi"))
                .isInstanceOf(NodeExecutionException.class)
                .hasMessageContaining("INTENT");
        assertThat(store.size()).isZero();
    }

    @Test
    void nodeReturningNullIsRejected() {
        GraphDefinition graph = GraphDefinition.builder("null")
                .node("a", s -> null)
                .start("a")
                .edge("a", GraphDefinition.END)
                .build();

        assertThatThrownBy(() -> run(graph, "hi"))
                .isInstanceOf(NodeExecutionException.class)
                .hasMessageContaining("no state");
    }

    @Test
    void stepLimitStopsCycles() {
        GraphDefinition graph = GraphDefinition.builder("loop")
                .node("spin", s -> s)
                .start("spin")
                .edge("spin", "spin")
                .maxSteps(3)
                .build();

        assertThatThrownBy(() -> run(graph, "hi"))
                .isInstanceOf(GraphExecutionException.class)
                .hasMessageContaining("Step limit of 3");
    }

    @Test
    void businessFieldsSurviveAcrossTurns() {
        GraphDefinition graph = GraphDefinition.builder("remember")
                .node("a", s -> s.orderId().isPresent() ? s
                        : s.withField(StateField.ORDER_ID, "67890"), StateField.ORDER_ID)
                .start("a")
                .edge("a", GraphDefinition.END)
                .build();

        run(graph, "my order #67890");
        TurnExecution second = run(graph, "when will it arrive?");

        assertThat(second.state().orderId()).contains("67890");
        assertThat(second.state().getTurns()).extracting(TurnRecord::getContent)
                .containsExactly("my order #67890", "when will it arrive?");
    }
}
