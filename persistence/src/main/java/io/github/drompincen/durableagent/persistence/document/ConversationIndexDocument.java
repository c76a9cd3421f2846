package io.github.drompincen.durableagent.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.index.TextIndexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Document(collection = "conversation_index")
public class ConversationIndexDocument {

    @Id
    private String threadId;
    @Indexed
    private String sessionId;
    @Indexed
    private String userId;
    private String intent;
    private String orderId;
    private boolean resolved;
    private boolean awaitingHumanInput;
    @TextIndexed
    private String messages;
    private List<HistoryEntry> conversationHistory = new ArrayList<>();
    @Indexed
    private Instant timestamp;
    private String traceId;

    public ConversationIndexDocument() {}

    public String getThreadId() { return threadId; }
    public void setThreadId(String threadId) { this.threadId = threadId; }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getIntent() { return intent; }
    public void setIntent(String intent) { this.intent = intent; }

    public String getOrderId() { return orderId; }
    public void setOrderId(String orderId) { this.orderId = orderId; }

    public boolean isResolved() { return resolved; }
    public void setResolved(boolean resolved) { this.resolved = resolved; }

    public boolean isAwaitingHumanInput() { return awaitingHumanInput; }
    public void setAwaitingHumanInput(boolean awaitingHumanInput) { this.awaitingHumanInput = awaitingHumanInput; }

    public String getMessages() { return messages; }
    public void setMessages(String messages) { this.messages = messages; }

    public List<HistoryEntry> getConversationHistory() { return conversationHistory; }
    public void setConversationHistory(List<HistoryEntry> conversationHistory) { this.conversationHistory = conversationHistory; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }

    public String getTraceId() { return traceId; }
    public void setTraceId(String traceId) { this.traceId = traceId; }

    public static class HistoryEntry {
        private String role;
        private String content;
        private Instant timestamp;

        public HistoryEntry() {}

        public HistoryEntry(String role, String content, Instant timestamp) {
            this.role = role;
            this.content = content;
            this.timestamp = timestamp;
        }

        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }

        public String getContent() { return content; }
        public void setContent(String content) { this.content = content; }

        public Instant getTimestamp() { return timestamp; }
        public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
    }
}
