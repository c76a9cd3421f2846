package io.github.drompincen.durableagent.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record CheckpointDto(
        String threadId,
        long version,
        String nextNode,
        Instant savedAt,
        boolean durable,
        JsonNode state
) {}
