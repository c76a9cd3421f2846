package io.github.drompincen.durableagent.runtime.agent;

import io.github.drompincen.durableagent.protocol.api.CheckpointDto;
import io.github.drompincen.durableagent.protocol.api.ConversationHitDto;
import io.github.drompincen.durableagent.protocol.api.FailureKind;
import io.github.drompincen.durableagent.protocol.api.UserStatisticsDto;
import io.github.drompincen.durableagent.runtime.checkpoint.Checkpoint;
import io.github.drompincen.durableagent.runtime.checkpoint.CheckpointManager;
import io.github.drompincen.durableagent.runtime.checkpoint.StateStoreException;
import io.github.drompincen.durableagent.runtime.graph.GraphConfigurationException;
import io.github.drompincen.durableagent.runtime.graph.GraphDefinition;
import io.github.drompincen.durableagent.runtime.graph.GraphEngine;
import io.github.drompincen.durableagent.runtime.graph.GraphExecutionException;
import io.github.drompincen.durableagent.runtime.graph.NodeExecutionException;
import io.github.drompincen.durableagent.runtime.graph.StateField;
import io.github.drompincen.durableagent.runtime.graph.TurnExecution;
import io.github.drompincen.durableagent.runtime.graph.TurnInput;
import io.github.drompincen.durableagent.runtime.graph.WorkflowState;
import io.github.drompincen.durableagent.runtime.index.Indexer;
import io.github.drompincen.durableagent.runtime.index.SearchDocument;
import io.github.drompincen.durableagent.runtime.index.SearchFilter;
import io.github.drompincen.durableagent.runtime.index.SearchIndex;
import io.github.drompincen.durableagent.runtime.lock.ThreadBusyException;
import io.github.drompincen.durableagent.runtime.lock.ThreadLockService;
import io.github.drompincen.durableagent.runtime.session.SessionRouter;
import io.github.drompincen.durableagent.runtime.session.ThreadResolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for one conversation turn. Serializes turns per thread, runs the workflow graph
 * from the thread's checkpoint and hands successful results to the search indexer.
 * <p>
 * Failures never escape as exceptions: they come back as a {@link TurnResult} with status
 * {@code FAILED}, the input state and a generic apology. A failed turn leaves the thread's
 * checkpoint as it was before the turn started, so the next message is routed from the top
 * instead of from whichever node the failed turn had reached.
 */
@Service
public class ConversationService {

    private static final Logger log = LoggerFactory.getLogger(ConversationService.class);

    public static final String APOLOGY =
            "I apologize, but I encountered an error. Please try again or contact support.";

    private final SessionRouter sessionRouter;
    private final ThreadLockService lockService;
    private final CheckpointManager checkpointManager;
    private final GraphEngine graphEngine;
    private final GraphDefinition graph;
    private final Indexer indexer;
    private final SearchIndex searchIndex;

    public ConversationService(SessionRouter sessionRouter,
                               ThreadLockService lockService,
                               CheckpointManager checkpointManager,
                               GraphEngine graphEngine,
                               GraphDefinition graph,
                               Indexer indexer,
                               SearchIndex searchIndex) {
        this.sessionRouter = sessionRouter;
        this.lockService = lockService;
        this.checkpointManager = checkpointManager;
        this.graphEngine = graphEngine;
        this.graph = graph;
        this.indexer = indexer;
        this.searchIndex = searchIndex;
    }

    /**
     * Runs one turn. {@code sessionId} may be null to start a new conversation.
     *
     * @throws IllegalArgumentException when the user id or message is missing or malformed
     */
    public TurnResult runTurn(String userId, String message, String sessionId) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message is required");
        }
        ThreadResolution resolution;
        try {
            resolution = sessionRouter.resolveThread(userId, Optional.ofNullable(sessionId));
        } catch (StateStoreException e) {
            log.error("Checkpoint store unavailable while resolving session {} of user {}", sessionId, userId, e);
            TurnInput input = new TurnInput(SessionRouter.threadIdFor(userId, sessionId), userId, sessionId, message);
            return failure(graphEngine.beginTurn(Optional.empty(), input), sessionId, false,
                    FailureKind.CHECKPOINT_ERROR, e);
        }

        String threadId = resolution.threadId();
        TurnInput input = new TurnInput(threadId, userId, resolution.sessionId(), message);
        log.info("{} session {} for user {}", resolution.isNew() ? "New" : "Resuming",
                resolution.sessionId(), userId);

        WorkflowState inputState = null;
        TurnResult result;
        try (ThreadLockService.Lease lease = lockService.acquire(threadId)) {
            Optional<Checkpoint> prior = checkpointManager.load(threadId);
            inputState = graphEngine.beginTurn(prior, input);
            TurnExecution execution;
            try {
                execution = graphEngine.executeTurn(graph, inputState, prior);
            } catch (NodeExecutionException | GraphExecutionException | GraphConfigurationException
                     | StateStoreException e) {
                rollback(threadId, prior);
                throw e;
            }
            result = execution.interrupted()
                    ? TurnResult.awaitingInput(execution.state(), resolution.sessionId(), resolution.isNew())
                    : TurnResult.completed(execution.state(), resolution.sessionId(), resolution.isNew());
        } catch (ThreadBusyException e) {
            return failure(fallbackState(inputState, input), resolution, FailureKind.THREAD_BUSY, e);
        } catch (NodeExecutionException | GraphExecutionException e) {
            return failure(fallbackState(inputState, input), resolution, FailureKind.NODE_ERROR, e);
        } catch (GraphConfigurationException e) {
            return failure(fallbackState(inputState, input), resolution, FailureKind.CONFIGURATION_ERROR, e);
        } catch (StateStoreException e) {
            return failure(fallbackState(inputState, input), resolution, FailureKind.CHECKPOINT_ERROR, e);
        }

        indexer.publish(result.state());
        log.info("[{}] Turn on {} finished: {}", result.state().getTraceId(), threadId, result.status());
        return result;
    }

    public List<ConversationHitDto> search(String query, SearchFilter filter, int limit) {
        return searchIndex.search(query, filter, limit).stream()
                .map(SearchDocument::toHit)
                .toList();
    }

    public UserStatisticsDto statistics(String userId) {
        return searchIndex.aggregate(userId);
    }

    public Optional<CheckpointDto> checkpoint(String threadId) {
        return checkpointManager.describe(threadId);
    }

    public boolean isDurable() {
        return checkpointManager.isDurable();
    }

    /** Runs under the thread lock, so no other turn observes the partial checkpoint. */
    private void rollback(String threadId, Optional<Checkpoint> prior) {
        try {
            checkpointManager.restore(threadId, prior);
        } catch (StateStoreException e) {
            log.error("Could not roll back thread {} after a failed turn", threadId, e);
        }
    }

    private WorkflowState fallbackState(WorkflowState inputState, TurnInput input) {
        return inputState != null ? inputState : graphEngine.beginTurn(Optional.empty(), input);
    }

    private TurnResult failure(WorkflowState inputState, ThreadResolution resolution, FailureKind kind,
                               RuntimeException cause) {
        return failure(inputState, resolution.sessionId(), resolution.isNew(), kind, cause);
    }

    private TurnResult failure(WorkflowState inputState, String sessionId, boolean newSession, FailureKind kind,
                               RuntimeException cause) {
        log.error("[{}] Turn on {} failed ({}): {}", inputState.getTraceId(), inputState.getThreadId(), kind,
                cause.getMessage());
        WorkflowState apology = inputState.withField(StateField.FINAL_REPLY, APOLOGY).withResolved(false);
        return TurnResult.failed(apology, sessionId, newSession, kind, cause.getMessage());
    }
}
