package io.github.drompincen.durableagent.runtime.graph;

import io.github.drompincen.durableagent.runtime.checkpoint.Checkpoint;
import io.github.drompincen.durableagent.runtime.checkpoint.CheckpointManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Runs one turn of a {@link GraphDefinition} for one thread. Every executed node is followed by a
 * checkpoint, so a restarted process continues from the last node that completed.
 * <p>
 * The caller must hold the thread's lock for the duration of {@link #beginTurn} and
 * {@link #executeTurn}.
 */
@Component
public class GraphEngine {

    private static final Logger log = LoggerFactory.getLogger(GraphEngine.class);

    private final CheckpointManager checkpointManager;
    private final InterruptController interruptController;
    private final Clock clock;

    public GraphEngine(CheckpointManager checkpointManager, InterruptController interruptController, Clock clock) {
        this.checkpointManager = checkpointManager;
        this.interruptController = interruptController;
        this.clock = clock;
    }

    /**
     * Prepares the state a turn starts from: the checkpointed state of an existing thread, or a
     * fresh state with a new trace id. The input message is appended as a user turn record.
     */
    public WorkflowState beginTurn(Optional<Checkpoint> prior, TurnInput input) {
        Instant now = clock.instant();
        WorkflowState base = prior.map(Checkpoint::state)
                .orElseGet(() -> WorkflowState.newThread(input.threadId(), input.userId(), input.sessionId(),
                        UUID.randomUUID().toString().substring(0, 8), now));
        return base.beginTurn(input.message(), now);
    }

    public TurnExecution executeTurn(GraphDefinition graph, WorkflowState prepared, Optional<Checkpoint> prior) {
        String threadId = prepared.getThreadId();
        boolean resuming = interruptController.isResumeInto(prior, graph);
        String current = prior.filter(Checkpoint::hasNextNode)
                .map(Checkpoint::nextNode)
                .orElse(graph.startNode());
        if (!graph.hasNode(current)) {
            throw new GraphConfigurationException("Checkpoint of thread " + threadId
                    + " resumes at unknown node '" + current + "'");
        }

        if (!resuming && interruptController.shouldInterrupt(graph, current)) {
            log.info("[{}] Thread {} halts before '{}' without running a node", prepared.getTraceId(), threadId, current);
            return halt(prepared, current, 0);
        }
        if (resuming) {
            log.info("[{}] Resuming thread {} into '{}' with external input", prepared.getTraceId(), threadId, current);
        }

        WorkflowState state = prepared;
        int steps = 0;
        while (true) {
            if (steps >= graph.maxSteps()) {
                throw new GraphExecutionException(threadId, "Step limit of " + graph.maxSteps()
                        + " exceeded in graph " + graph.name());
            }
            NodeSpec node = graph.node(current);
            WorkflowState result = invoke(node, state);
            steps++;

            String next = graph.resolveNext(current, result);
            log.debug("[{}] {} -> {}", result.getTraceId(), current, next);

            if (GraphDefinition.END.equals(next)) {
                return finish(graph, result, steps);
            }
            if (interruptController.shouldInterrupt(graph, next)) {
                log.info("[{}] Thread {} interrupted before '{}'", result.getTraceId(), threadId, next);
                return halt(result, next, steps);
            }
            checkpointManager.save(threadId, result, next);
            state = result;
            current = next;
        }
    }

    private WorkflowState invoke(NodeSpec node, WorkflowState input) {
        WorkflowState result;
        try {
            result = node.function().apply(input);
        } catch (Exception e) {
            log.error("[{}] Node '{}' failed on thread {}", input.getTraceId(), node.name(), input.getThreadId(), e);
            throw new NodeExecutionException(node.name(), e);
        }
        checkBoundary(node, input, result);
        return result;
    }

    private void checkBoundary(NodeSpec node, WorkflowState input, WorkflowState result) {
        if (result == null) {
            throw new NodeExecutionException(node.name(), "returned no state");
        }
        if (!input.getThreadId().equals(result.getThreadId())) {
            throw new NodeExecutionException(node.name(), "changed the thread id to " + result.getThreadId());
        }
        if (!result.extendsTurnsOf(input)) {
            throw new NodeExecutionException(node.name(), "rewrote earlier turn records");
        }
        Set<StateField> foreign = EnumSet.noneOf(StateField.class);
        for (StateField field : input.changedFields(result)) {
            if (!node.owns(field)) {
                foreign.add(field);
            }
        }
        if (!foreign.isEmpty()) {
            throw new NodeExecutionException(node.name(), "changed fields it does not own: " + foreign);
        }
    }

    private TurnExecution finish(GraphDefinition graph, WorkflowState state, int steps) {
        Instant now = clock.instant();
        WorkflowState done = state.withAwaitingExternalInput(false)
                .withResolved(graph.resolutionPolicy().isResolved(state));
        Optional<String> reply = done.finalReply();
        if (reply.isPresent()) {
            done = done.withAssistantTurn(reply.get(), now);
        }
        done = done.withUpdatedAt(now);
        Checkpoint cp = checkpointManager.save(done.getThreadId(), done, null);
        log.info("[{}] Thread {} completed turn in {} step(s), checkpoint v{}",
                done.getTraceId(), done.getThreadId(), steps, cp.version());
        return new TurnExecution(done, null, TurnExecution.Outcome.COMPLETED, steps, cp.version());
    }

    private TurnExecution halt(WorkflowState state, String nextNode, int steps) {
        Instant now = clock.instant();
        WorkflowState waiting = state.withAwaitingExternalInput(true).withResolved(false);
        if (waiting.finalReply().isEmpty() && waiting.draftReply().isPresent()) {
            waiting = waiting.withField(StateField.FINAL_REPLY, waiting.draftReply().get());
        }
        Optional<String> reply = waiting.finalReply();
        if (reply.isPresent()) {
            waiting = waiting.withAssistantTurn(reply.get(), now);
        }
        waiting = waiting.withUpdatedAt(now);
        Checkpoint cp = checkpointManager.save(waiting.getThreadId(), waiting, nextNode);
        return new TurnExecution(waiting, nextNode, TurnExecution.Outcome.INTERRUPTED, steps, cp.version());
    }
}
