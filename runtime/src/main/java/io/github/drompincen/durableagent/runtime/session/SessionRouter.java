package io.github.drompincen.durableagent.runtime.session;

import io.github.drompincen.durableagent.runtime.checkpoint.CheckpointManager;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/** Maps a user and an optional session onto the thread that holds their conversation. */
@Service
public class SessionRouter {

    static final String SEPARATOR = ":";

    private final CheckpointManager checkpointManager;

    public SessionRouter(CheckpointManager checkpointManager) {
        this.checkpointManager = checkpointManager;
    }

    public ThreadResolution resolveThread(String userId, Optional<String> sessionId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (userId.contains(SEPARATOR)) {
            throw new IllegalArgumentException("userId must not contain '" + SEPARATOR + "': " + userId);
        }
        Optional<String> session = sessionId.filter(s -> !s.isBlank());
        if (session.isEmpty()) {
            String fresh = UUID.randomUUID().toString();
            return new ThreadResolution(threadIdFor(userId, fresh), fresh, true);
        }
        String threadId = threadIdFor(userId, session.get());
        return new ThreadResolution(threadId, session.get(), checkpointManager.load(threadId).isEmpty());
    }

    public static String threadIdFor(String userId, String sessionId) {
        return userId + SEPARATOR + sessionId;
    }
}
