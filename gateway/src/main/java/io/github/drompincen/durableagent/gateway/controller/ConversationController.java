package io.github.drompincen.durableagent.gateway.controller;

import io.github.drompincen.durableagent.protocol.api.ConversationHitDto;
import io.github.drompincen.durableagent.protocol.api.FailureKind;
import io.github.drompincen.durableagent.protocol.api.TurnRequest;
import io.github.drompincen.durableagent.protocol.api.UserStatisticsDto;
import io.github.drompincen.durableagent.runtime.agent.ConversationService;
import io.github.drompincen.durableagent.runtime.agent.TurnResult;
import io.github.drompincen.durableagent.runtime.checkpoint.StateStoreException;
import io.github.drompincen.durableagent.runtime.index.SearchFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/conversations")
public class ConversationController {

    private static final Logger log = LoggerFactory.getLogger(ConversationController.class);
    private static final int MAX_LIMIT = 100;

    private final ConversationService conversationService;

    public ConversationController(ConversationService conversationService) {
        this.conversationService = conversationService;
    }

    /**
     * Runs one turn. Failed turns still carry the apology reply; a busy thread answers 409 and
     * other failures 500 so that clients can tell a retryable conflict from a broken turn.
     */
    @PostMapping("/turns")
    public ResponseEntity<?> turn(@RequestBody TurnRequest req) {
        if (req == null || req.userId() == null || req.userId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "userId is required"));
        }
        TurnResult result;
        try {
            result = conversationService.runTurn(req.userId(), req.message(), req.sessionId());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        if (!result.failed()) {
            return ResponseEntity.ok(result.toResponse());
        }
        log.warn("Turn for user {} failed with {}: {}", req.userId(), result.failureKind(), result.errorMessage());
        HttpStatus status = result.failureKind() == FailureKind.THREAD_BUSY
                ? HttpStatus.CONFLICT
                : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(result.toResponse());
    }

    @GetMapping("/search")
    public List<ConversationHitDto> search(@RequestParam(name = "q", required = false) String query,
                                           @RequestParam(required = false) String userId,
                                           @RequestParam(required = false) String intent,
                                           @RequestParam(required = false) Boolean resolved,
                                           @RequestParam(defaultValue = "10") int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_LIMIT));
        return conversationService.search(query, new SearchFilter(userId, intent, resolved), bounded);
    }

    @GetMapping("/users/{userId}/stats")
    public UserStatisticsDto stats(@PathVariable String userId) {
        return conversationService.statistics(userId);
    }

    @GetMapping("/threads/{threadId}")
    public ResponseEntity<?> thread(@PathVariable String threadId) {
        return conversationService.checkpoint(threadId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @ExceptionHandler(StateStoreException.class)
    public ResponseEntity<Map<String, String>> storeFailure(StateStoreException e) {
        log.error("Checkpoint read failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
    }
}
