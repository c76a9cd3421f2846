package io.github.drompincen.durableagent.runtime.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

public final class TurnRecord {

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    private final String role;
    private final String content;
    private final Instant timestamp;

    @JsonCreator
    public TurnRecord(@JsonProperty("role") String role,
                      @JsonProperty("content") String content,
                      @JsonProperty("timestamp") Instant timestamp) {
        this.role = Objects.requireNonNull(role, "role");
        this.content = content != null ? content : "";
        this.timestamp = timestamp;
    }

    public String getRole() { return role; }
    public String getContent() { return content; }
    public Instant getTimestamp() { return timestamp; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TurnRecord other)) return false;
        return role.equals(other.role) && content.equals(other.content)
                && Objects.equals(timestamp, other.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, content, timestamp);
    }

    @Override
    public String toString() {
        return role + ": " + content;
    }
}
